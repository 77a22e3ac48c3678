package com.hclparser.syntax.ast.expr;

import com.hclparser.syntax.ast.AstVisitor;
import com.hclparser.syntax.ast.SourceRange;

/**
 * 对象键。裸标识符键按字面名称解释，加括号时强制按表达式求值
 */
public class ObjectConsKeyExpr extends Expression {
    private final Expression wrapped;
    private final boolean forceNonLiteral;

    public ObjectConsKeyExpr(Expression wrapped, boolean forceNonLiteral) {
        super(wrapped.getRange());
        this.wrapped = wrapped;
        this.forceNonLiteral = forceNonLiteral;
    }

    public Expression getWrapped() {
        return wrapped;
    }

    public boolean isForceNonLiteral() {
        return forceNonLiteral;
    }

    @Override
    public SourceRange getStartRange() {
        return wrapped.getStartRange();
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitObjectConsKeyExpr(this, context);
    }
}
