package com.hclparser.convert;

/**
 * 一次转换的结果：值节点与对应的行信息节点
 */
public final class Converted {
    private final ValueNode value;
    private final LineNode line;

    public Converted(ValueNode value, LineNode line) {
        this.value = value;
        this.line = line;
    }

    public ValueNode getValue() {
        return value;
    }

    public LineNode getLine() {
        return line;
    }
}
