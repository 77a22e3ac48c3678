package com.hclparser.convert;

import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonNull;
import com.google.gson.JsonObject;
import com.google.gson.JsonPrimitive;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * 值树节点：标量、序列或映射
 *
 * <p>只有本类中的三个子类，构造器私有。转换过程中由本包代码自底向上构建，
 * 对外只暴露只读视图。</p>
 */
public abstract class ValueNode {

    private ValueNode() {
    }

    public abstract JsonElement toJson();

    public static Scalar scalar(Object value) {
        return new Scalar(value);
    }

    /**
     * 标量：String、BigDecimal、Boolean 或 null
     */
    public static final class Scalar extends ValueNode {
        private final Object value;

        private Scalar(Object value) {
            this.value = value;
        }

        public Object getValue() {
            return value;
        }

        @Override
        public JsonElement toJson() {
            if (value == null) {
                return JsonNull.INSTANCE;
            }
            if (value instanceof BigDecimal) {
                return new JsonPrimitive(normalize((BigDecimal) value));
            }
            if (value instanceof Boolean) {
                return new JsonPrimitive((Boolean) value);
            }
            return new JsonPrimitive(value.toString());
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) return true;
            if (!(o instanceof Scalar)) return false;
            Object other = ((Scalar) o).value;
            if (value instanceof BigDecimal && other instanceof BigDecimal) {
                return ((BigDecimal) value).compareTo((BigDecimal) other) == 0;
            }
            return Objects.equals(value, other);
        }

        @Override
        public int hashCode() {
            if (value instanceof BigDecimal) {
                return normalize((BigDecimal) value).hashCode();
            }
            return Objects.hashCode(value);
        }

        @Override
        public String toString() {
            return String.valueOf(value);
        }
    }

    /**
     * 有序序列：元组的值，或同名条目合并后的结果
     */
    public static final class Sequence extends ValueNode {
        private final List<ValueNode> items = new ArrayList<ValueNode>();

        Sequence() {
        }

        void add(ValueNode item) {
            items.add(item);
        }

        public List<ValueNode> getItems() {
            return Collections.unmodifiableList(items);
        }

        public int size() {
            return items.size();
        }

        public ValueNode get(int index) {
            return items.get(index);
        }

        @Override
        public JsonElement toJson() {
            JsonArray array = new JsonArray();
            for (ValueNode item : items) {
                array.add(item.toJson());
            }
            return array;
        }

        @Override
        public boolean equals(Object o) {
            return o instanceof Sequence && items.equals(((Sequence) o).items);
        }

        @Override
        public int hashCode() {
            return items.hashCode();
        }

        @Override
        public String toString() {
            return items.toString();
        }
    }

    /**
     * 键到值节点的映射，按插入顺序迭代
     */
    public static final class Mapping extends ValueNode {
        private final Map<String, ValueNode> entries = new LinkedHashMap<String, ValueNode>();

        Mapping() {
        }

        void put(String key, ValueNode value) {
            entries.put(key, value);
        }

        public ValueNode get(String key) {
            return entries.get(key);
        }

        public boolean containsKey(String key) {
            return entries.containsKey(key);
        }

        public Map<String, ValueNode> getEntries() {
            return Collections.unmodifiableMap(entries);
        }

        public int size() {
            return entries.size();
        }

        @Override
        public JsonElement toJson() {
            JsonObject obj = new JsonObject();
            for (Map.Entry<String, ValueNode> entry : entries.entrySet()) {
                obj.add(entry.getKey(), entry.getValue().toJson());
            }
            return obj;
        }

        @Override
        public boolean equals(Object o) {
            return o instanceof Mapping && entries.equals(((Mapping) o).entries);
        }

        @Override
        public int hashCode() {
            return entries.hashCode();
        }

        @Override
        public String toString() {
            return entries.toString();
        }
    }

    // 超过该指数的数字保留科学计数法，避免展开为超长的数字
    private static final int MAX_PLAIN_EXPONENT = 1000;

    /**
     * 数字的规范形式：去掉末尾的零，且不使用科学计数法的正指数（1e3 → 1000）
     */
    static BigDecimal normalize(BigDecimal number) {
        BigDecimal stripped = number.stripTrailingZeros();
        if (stripped.scale() < 0 && stripped.scale() >= -MAX_PLAIN_EXPONENT) {
            stripped = stripped.setScale(0);
        }
        return stripped;
    }

    /**
     * 数字在模板中的文本：一般为普通小数，指数过大或过小时为科学计数法（1E+1001）
     */
    static String numberText(BigDecimal number) {
        BigDecimal normalized = normalize(number);
        if (Math.abs((long) normalized.scale()) > MAX_PLAIN_EXPONENT) {
            return normalized.toString();
        }
        return normalized.toPlainString();
    }
}
