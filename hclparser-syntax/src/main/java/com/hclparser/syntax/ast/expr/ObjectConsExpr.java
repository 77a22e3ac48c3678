package com.hclparser.syntax.ast.expr;

import com.hclparser.syntax.ast.AstVisitor;
import com.hclparser.syntax.ast.SourceRange;

import java.util.Collections;
import java.util.List;

/**
 * 对象构造 {@code { key = value, ... }}
 */
public class ObjectConsExpr extends Expression {
    private final List<Item> items;
    private final SourceRange openRange;

    public ObjectConsExpr(SourceRange range, SourceRange openRange, List<Item> items) {
        super(range);
        this.openRange = openRange;
        this.items = Collections.unmodifiableList(items);
    }

    public List<Item> getItems() {
        return items;
    }

    public SourceRange getOpenRange() {
        return openRange;
    }

    @Override
    public SourceRange getStartRange() {
        return openRange;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitObjectConsExpr(this, context);
    }

    /**
     * 对象的一个键值对
     */
    public static final class Item {
        private final Expression keyExpr;
        private final Expression valueExpr;

        public Item(Expression keyExpr, Expression valueExpr) {
            this.keyExpr = keyExpr;
            this.valueExpr = valueExpr;
        }

        public Expression getKeyExpr() {
            return keyExpr;
        }

        public Expression getValueExpr() {
            return valueExpr;
        }
    }
}
