package com.hclparser.syntax.ast;

import com.hclparser.syntax.ast.expr.Expression;

/**
 * 属性定义 {@code name = expr}
 */
public class Attribute extends Node {
    private final String name;
    private final Expression expr;
    private final SourceRange nameRange;
    private final SourceRange equalsRange;

    public Attribute(SourceRange range, String name, Expression expr,
                     SourceRange nameRange, SourceRange equalsRange) {
        super(range);
        this.name = name;
        this.expr = expr;
        this.nameRange = nameRange;
        this.equalsRange = equalsRange;
    }

    public String getName() {
        return name;
    }

    public Expression getExpr() {
        return expr;
    }

    public SourceRange getNameRange() {
        return nameRange;
    }

    public SourceRange getEqualsRange() {
        return equalsRange;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitAttribute(this, context);
    }
}
