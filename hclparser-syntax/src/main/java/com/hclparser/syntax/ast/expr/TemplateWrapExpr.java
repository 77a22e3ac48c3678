package com.hclparser.syntax.ast.expr;

import com.hclparser.syntax.ast.AstVisitor;
import com.hclparser.syntax.ast.SourceRange;

/**
 * 只包含单个插值的模板，如 {@code "${x}"}，其值即被包装表达式的值
 */
public class TemplateWrapExpr extends Expression {
    private final Expression wrapped;

    public TemplateWrapExpr(SourceRange range, Expression wrapped) {
        super(range);
        this.wrapped = wrapped;
    }

    public Expression getWrapped() {
        return wrapped;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitTemplateWrapExpr(this, context);
    }
}
