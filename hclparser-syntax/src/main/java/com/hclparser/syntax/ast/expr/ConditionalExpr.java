package com.hclparser.syntax.ast.expr;

import com.hclparser.syntax.ast.AstVisitor;
import com.hclparser.syntax.ast.SourceRange;

/**
 * 条件表达式 {@code cond ? a : b}，模板中的 {@code %{if}} 指令也解析为此节点
 */
public class ConditionalExpr extends Expression {
    private final Expression condition;
    private final Expression trueResult;
    private final Expression falseResult;

    public ConditionalExpr(SourceRange range,
                           Expression condition, Expression trueResult, Expression falseResult) {
        super(range);
        this.condition = condition;
        this.trueResult = trueResult;
        this.falseResult = falseResult;
    }

    public Expression getCondition() { return condition; }
    public Expression getTrueResult() { return trueResult; }
    public Expression getFalseResult() { return falseResult; }

    @Override
    public SourceRange getStartRange() {
        return condition.getStartRange();
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitConditionalExpr(this, context);
    }
}
