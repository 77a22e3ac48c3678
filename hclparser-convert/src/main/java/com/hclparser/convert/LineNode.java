package com.hclparser.convert;

import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.hclparser.syntax.ast.SourceRange;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 行信息树节点，形状与对应的 {@link ValueNode} 一致
 *
 * <p>位置字段：{@code line} 为起始行，{@code startIndex}/{@code endIndex} 为起止列。
 * 属于某个属性或块的节点另外带有名称的位置 {@code __key__startIndex}、{@code __key__endIndex}、
 * {@code __key__line}。</p>
 */
public abstract class LineNode {

    public static final String LINE = "line";
    public static final String START_INDEX = "startIndex";
    public static final String END_INDEX = "endIndex";
    public static final String KEY_START_INDEX = "__key__startIndex";
    public static final String KEY_END_INDEX = "__key__endIndex";
    public static final String KEY_LINE = "__key__line";

    private LineNode() {
    }

    public abstract JsonElement toJson();

    /**
     * 记录拥有该节点的属性名或块类型名的区间
     */
    abstract void annotateKey(SourceRange keyRange);

    /**
     * 单个表达式的位置（取自表达式的起始区间）
     */
    public static final class Position extends LineNode {
        private final SourceRange range;
        private SourceRange keyRange;

        private Position(SourceRange range) {
            this.range = range;
        }

        public static Position of(SourceRange range) {
            return new Position(range);
        }

        public int getLine() {
            return range.getStart().getLine();
        }

        public int getStartIndex() {
            return range.getStart().getColumn();
        }

        public int getEndIndex() {
            return range.getEnd().getColumn();
        }

        /** 未标注时为 null */
        public SourceRange getKeyRange() {
            return keyRange;
        }

        @Override
        void annotateKey(SourceRange keyRange) {
            this.keyRange = keyRange;
        }

        @Override
        public JsonElement toJson() {
            JsonObject obj = new JsonObject();
            writePosition(obj, range);
            writeKey(obj, keyRange);
            return obj;
        }

        @Override
        public String toString() {
            return toJson().toString();
        }
    }

    /**
     * 同名条目合并后的序列
     */
    public static final class Sequence extends LineNode {
        private final List<LineNode> items = new ArrayList<LineNode>();

        Sequence() {
        }

        void add(LineNode item) {
            items.add(item);
        }

        public List<LineNode> getItems() {
            return Collections.unmodifiableList(items);
        }

        public int size() {
            return items.size();
        }

        public LineNode get(int index) {
            return items.get(index);
        }

        @Override
        void annotateKey(SourceRange keyRange) {
            throw new IllegalStateException("merged line sequences carry no key range");
        }

        @Override
        public JsonElement toJson() {
            JsonArray array = new JsonArray();
            for (LineNode item : items) {
                array.add(item.toJson());
            }
            return array;
        }

        @Override
        public String toString() {
            return toJson().toString();
        }
    }

    /**
     * 体或对象的行信息：各条目的行信息，以及自身的位置与名称位置（可选）
     */
    public static final class Mapping extends LineNode {
        private final Map<String, LineNode> entries = new LinkedHashMap<String, LineNode>();
        private SourceRange range;
        private SourceRange keyRange;

        Mapping() {
        }

        Mapping(SourceRange range) {
            this.range = range;
        }

        void put(String key, LineNode line) {
            entries.put(key, line);
        }

        void setRange(SourceRange range) {
            this.range = range;
        }

        public LineNode get(String key) {
            return entries.get(key);
        }

        public boolean containsKey(String key) {
            return entries.containsKey(key);
        }

        public Map<String, LineNode> getEntries() {
            return Collections.unmodifiableMap(entries);
        }

        /** 自身区间，标签嵌套产生的中间层为 null */
        public SourceRange getRange() {
            return range;
        }

        public SourceRange getKeyRange() {
            return keyRange;
        }

        @Override
        void annotateKey(SourceRange keyRange) {
            this.keyRange = keyRange;
        }

        /**
         * 条目优先：与位置字段同名的条目（如名为 line 的属性）保留条目本身
         */
        @Override
        public JsonElement toJson() {
            JsonObject obj = new JsonObject();
            for (Map.Entry<String, LineNode> entry : entries.entrySet()) {
                obj.add(entry.getKey(), entry.getValue().toJson());
            }
            if (range != null) {
                writePosition(obj, range);
            }
            writeKey(obj, keyRange);
            return obj;
        }

        @Override
        public String toString() {
            return toJson().toString();
        }
    }

    private static void writePosition(JsonObject obj, SourceRange range) {
        putIfAbsent(obj, LINE, range.getStart().getLine());
        putIfAbsent(obj, START_INDEX, range.getStart().getColumn());
        putIfAbsent(obj, END_INDEX, range.getEnd().getColumn());
    }

    private static void writeKey(JsonObject obj, SourceRange keyRange) {
        if (keyRange == null) {
            return;
        }
        putIfAbsent(obj, KEY_START_INDEX, keyRange.getStart().getColumn());
        putIfAbsent(obj, KEY_END_INDEX, keyRange.getEnd().getColumn());
        putIfAbsent(obj, KEY_LINE, keyRange.getStart().getLine());
    }

    private static void putIfAbsent(JsonObject obj, String name, int value) {
        if (!obj.has(name)) {
            obj.addProperty(name, value);
        }
    }
}
