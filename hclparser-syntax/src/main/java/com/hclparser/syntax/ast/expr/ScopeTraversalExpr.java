package com.hclparser.syntax.ast.expr;

import com.hclparser.syntax.ast.AstVisitor;
import com.hclparser.syntax.ast.SourceRange;

import java.util.Collections;
import java.util.List;

/**
 * 以变量名开头的遍历，如 {@code var.name[0].id}
 */
public class ScopeTraversalExpr extends Expression {
    private final String rootName;
    private final List<Traverser> steps;

    public ScopeTraversalExpr(SourceRange range, String rootName, List<Traverser> steps) {
        super(range);
        this.rootName = rootName;
        this.steps = Collections.unmodifiableList(steps);
    }

    public String getRootName() {
        return rootName;
    }

    public List<Traverser> getSteps() {
        return steps;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitScopeTraversalExpr(this, context);
    }
}
