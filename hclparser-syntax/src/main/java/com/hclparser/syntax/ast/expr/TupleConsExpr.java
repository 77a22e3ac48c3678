package com.hclparser.syntax.ast.expr;

import com.hclparser.syntax.ast.AstVisitor;
import com.hclparser.syntax.ast.SourceRange;

import java.util.Collections;
import java.util.List;

/**
 * 元组构造 {@code [a, b, c]}
 */
public class TupleConsExpr extends Expression {
    private final List<Expression> exprs;
    private final SourceRange openRange;

    public TupleConsExpr(SourceRange range, SourceRange openRange, List<Expression> exprs) {
        super(range);
        this.openRange = openRange;
        this.exprs = Collections.unmodifiableList(exprs);
    }

    public List<Expression> getExprs() {
        return exprs;
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
        return visitor.visitTupleConsExpr(this, context);
    }
}
