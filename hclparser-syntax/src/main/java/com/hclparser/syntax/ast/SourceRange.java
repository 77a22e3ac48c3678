package com.hclparser.syntax.ast;

/**
 * 源码区间：[start, end)，end 不包含
 */
public final class SourceRange {
    private final String fileName;
    private final SourcePos start;
    private final SourcePos end;

    public SourceRange(String fileName, SourcePos start, SourcePos end) {
        this.fileName = fileName != null ? fileName.intern() : null;
        this.start = start;
        this.end = end;
    }

    /**
     * 覆盖 from 起点到 to 终点的区间
     */
    public static SourceRange between(SourceRange from, SourceRange to) {
        return new SourceRange(from.fileName, from.start, to.end);
    }

    /**
     * 位于 pos 处的零宽区间
     */
    public static SourceRange at(String fileName, SourcePos pos) {
        return new SourceRange(fileName, pos, pos);
    }

    public String getFileName() {
        return fileName;
    }

    public SourcePos getStart() {
        return start;
    }

    public SourcePos getEnd() {
        return end;
    }

    /** 区间的 UTF-8 字节长度 */
    public int getByteLength() {
        return end.getByteOffset() - start.getByteOffset();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof SourceRange)) return false;
        SourceRange other = (SourceRange) o;
        return start.equals(other.start) && end.equals(other.end)
                && (fileName == null ? other.fileName == null : fileName.equals(other.fileName));
    }

    @Override
    public int hashCode() {
        return start.hashCode() * 31 + end.hashCode();
    }

    @Override
    public String toString() {
        return fileName + ":" + start + "-" + end;
    }
}
