package com.hclparser.syntax.ast.expr;

import com.hclparser.syntax.ast.AstVisitor;
import com.hclparser.syntax.ast.SourceRange;

import java.util.Collections;
import java.util.List;

/**
 * 作用于任意表达式结果的遍历，如 {@code f(x).name}
 */
public class RelativeTraversalExpr extends Expression {
    private final Expression source;
    private final List<Traverser> steps;

    public RelativeTraversalExpr(SourceRange range, Expression source, List<Traverser> steps) {
        super(range);
        this.source = source;
        this.steps = Collections.unmodifiableList(steps);
    }

    public Expression getSource() {
        return source;
    }

    public List<Traverser> getSteps() {
        return steps;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitRelativeTraversalExpr(this, context);
    }
}
