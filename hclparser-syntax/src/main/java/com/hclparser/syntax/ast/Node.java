package com.hclparser.syntax.ast;

/**
 * 语法树节点基类
 */
public abstract class Node {
    protected final SourceRange range;

    protected Node(SourceRange range) {
        this.range = range;
    }

    /** 节点覆盖的完整源码区间 */
    public SourceRange getRange() {
        return range;
    }

    public abstract <R, C> R accept(AstVisitor<R, C> visitor, C context);
}
