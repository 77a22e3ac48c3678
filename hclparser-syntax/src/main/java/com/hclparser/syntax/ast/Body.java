package com.hclparser.syntax.ast;

import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * 原生语法的体：属性与子块的容器
 *
 * <p>属性按名称保存，迭代顺序与源码顺序一致；块按源码顺序保存。
 * 文件根体的区间覆盖整个文件，块体的区间从 {@code {} 到 {@code }}（含）。</p>
 */
public class Body extends Node implements ConfigBody {
    private final Map<String, Attribute> attributes;
    private final List<Block> blocks;

    public Body(SourceRange range, Map<String, Attribute> attributes, List<Block> blocks) {
        super(range);
        this.attributes = Collections.unmodifiableMap(attributes);
        this.blocks = Collections.unmodifiableList(blocks);
    }

    public Map<String, Attribute> getAttributes() {
        return attributes;
    }

    public List<Block> getBlocks() {
        return blocks;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitBody(this, context);
    }
}
