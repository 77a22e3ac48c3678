package com.hclparser.syntax.ast.expr;

import com.hclparser.syntax.ast.AstVisitor;
import com.hclparser.syntax.ast.SourceRange;

/**
 * 括号表达式，区间包含两侧括号
 */
public class ParenthesesExpr extends Expression {
    private final Expression expression;

    public ParenthesesExpr(SourceRange range, Expression expression) {
        super(range);
        this.expression = expression;
    }

    public Expression getExpression() {
        return expression;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitParenthesesExpr(this, context);
    }
}
