package com.hclparser.syntax.ast.expr;

import com.hclparser.syntax.ast.AstVisitor;
import com.hclparser.syntax.ast.SourceRange;

import java.util.Collections;
import java.util.List;

/**
 * 展开表达式：属性展开 {@code list.*.id} 与完全展开 {@code list[*].id}
 */
public class SplatExpr extends Expression {
    private final Expression source;
    private final List<Traverser> each;
    private final boolean full;
    private final SourceRange markerRange;

    public SplatExpr(SourceRange range, Expression source, List<Traverser> each,
                     boolean full, SourceRange markerRange) {
        super(range);
        this.source = source;
        this.each = Collections.unmodifiableList(each);
        this.full = full;
        this.markerRange = markerRange;
    }

    public Expression getSource() {
        return source;
    }

    /** 对每个元素依次应用的遍历 */
    public List<Traverser> getEach() {
        return each;
    }

    public boolean isFull() {
        return full;
    }

    public SourceRange getMarkerRange() {
        return markerRange;
    }

    @Override
    public SourceRange getStartRange() {
        return markerRange;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitSplatExpr(this, context);
    }
}
