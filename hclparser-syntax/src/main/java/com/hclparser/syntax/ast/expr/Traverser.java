package com.hclparser.syntax.ast.expr;

import com.hclparser.syntax.ast.SourceRange;

/**
 * 遍历路径中的一步：属性访问或字面量索引
 */
public abstract class Traverser {
    private final SourceRange range;

    private Traverser(SourceRange range) {
        this.range = range;
    }

    public SourceRange getRange() {
        return range;
    }

    /** {@code .name} */
    public static final class Attr extends Traverser {
        private final String name;

        public Attr(SourceRange range, String name) {
            super(range);
            this.name = name;
        }

        public String getName() {
            return name;
        }

        @Override
        public String toString() {
            return "." + name;
        }
    }

    /** {@code [key]} 或旧式 {@code .0}，key 为 String 或 BigDecimal */
    public static final class Index extends Traverser {
        private final Object key;

        public Index(SourceRange range, Object key) {
            super(range);
            this.key = key;
        }

        public Object getKey() {
            return key;
        }

        @Override
        public String toString() {
            return "[" + key + "]";
        }
    }
}
