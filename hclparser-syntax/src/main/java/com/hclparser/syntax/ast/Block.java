package com.hclparser.syntax.ast;

import java.util.Collections;
import java.util.List;

/**
 * 块定义 {@code type "label" ... { body }}
 */
public class Block extends Node {
    private final String type;
    private final List<String> labels;
    private final Body body;
    private final SourceRange typeRange;
    private final List<SourceRange> labelRanges;

    public Block(SourceRange range, String type, List<String> labels, Body body,
                 SourceRange typeRange, List<SourceRange> labelRanges) {
        super(range);
        this.type = type;
        this.labels = Collections.unmodifiableList(labels);
        this.body = body;
        this.typeRange = typeRange;
        this.labelRanges = Collections.unmodifiableList(labelRanges);
    }

    public String getType() {
        return type;
    }

    public List<String> getLabels() {
        return labels;
    }

    public Body getBody() {
        return body;
    }

    /** 块类型名的区间 */
    public SourceRange getTypeRange() {
        return typeRange;
    }

    public List<SourceRange> getLabelRanges() {
        return labelRanges;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitBlock(this, context);
    }
}
