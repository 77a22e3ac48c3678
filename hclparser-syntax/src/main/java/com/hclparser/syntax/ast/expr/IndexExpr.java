package com.hclparser.syntax.ast.expr;

import com.hclparser.syntax.ast.AstVisitor;
import com.hclparser.syntax.ast.SourceRange;

/**
 * 以非字面量键取索引 {@code collection[key]}
 */
public class IndexExpr extends Expression {
    private final Expression collection;
    private final Expression key;
    private final SourceRange bracketRange;

    public IndexExpr(SourceRange range, Expression collection, Expression key, SourceRange bracketRange) {
        super(range);
        this.collection = collection;
        this.key = key;
        this.bracketRange = bracketRange;
    }

    public Expression getCollection() {
        return collection;
    }

    public Expression getKey() {
        return key;
    }

    public SourceRange getBracketRange() {
        return bracketRange;
    }

    @Override
    public SourceRange getStartRange() {
        return bracketRange;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitIndexExpr(this, context);
    }
}
