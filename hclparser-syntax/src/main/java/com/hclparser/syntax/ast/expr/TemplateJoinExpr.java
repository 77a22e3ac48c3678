package com.hclparser.syntax.ast.expr;

import com.hclparser.syntax.ast.AstVisitor;
import com.hclparser.syntax.ast.SourceRange;

/**
 * 模板 for 指令的结果：将元组各元素拼接为字符串
 */
public class TemplateJoinExpr extends Expression {
    private final Expression tuple;

    public TemplateJoinExpr(Expression tuple) {
        super(tuple.getRange());
        this.tuple = tuple;
    }

    /** 通常为 {@link ForExpr} */
    public Expression getTuple() {
        return tuple;
    }

    @Override
    public SourceRange getStartRange() {
        return tuple.getStartRange();
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitTemplateJoinExpr(this, context);
    }
}
