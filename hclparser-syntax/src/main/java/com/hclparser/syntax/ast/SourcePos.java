package com.hclparser.syntax.ast;

/**
 * 源码中的单个位置
 *
 * <p>行、列从 1 开始，列按 Unicode 码点计数；byteOffset 是 UTF-8 字节偏移（从 0 开始）。</p>
 */
public final class SourcePos {
    private final int line;
    private final int column;
    private final int byteOffset;

    public static final SourcePos START = new SourcePos(1, 1, 0);

    public SourcePos(int line, int column, int byteOffset) {
        this.line = line;
        this.column = column;
        this.byteOffset = byteOffset;
    }

    public int getLine() {
        return line;
    }

    public int getColumn() {
        return column;
    }

    public int getByteOffset() {
        return byteOffset;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof SourcePos)) return false;
        SourcePos other = (SourcePos) o;
        return line == other.line && column == other.column && byteOffset == other.byteOffset;
    }

    @Override
    public int hashCode() {
        return (line * 31 + column) * 31 + byteOffset;
    }

    @Override
    public String toString() {
        return line + "," + column;
    }
}
