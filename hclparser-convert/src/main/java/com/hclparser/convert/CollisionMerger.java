package com.hclparser.convert;

/**
 * 同一层级同名条目的合并规则
 *
 * <p>首次出现直接存放；第二次出现时把原条目与新条目组成两元素序列；之后追加到该序列。
 * 值树与行信息树同步合并，因此两棵树在每个键上的形状一致。
 * 是否已是合并序列以行信息树为准：元组的值也是序列，但其行信息是单个位置。</p>
 */
final class CollisionMerger {

    private CollisionMerger() {
    }

    static void merge(ValueNode.Mapping values, LineNode.Mapping lines, String key, Converted entry) {
        if (!values.containsKey(key)) {
            values.put(key, entry.getValue());
            lines.put(key, entry.getLine());
            return;
        }

        ValueNode existing = values.get(key);
        LineNode existingLine = lines.get(key);
        if (existingLine instanceof LineNode.Sequence && existing instanceof ValueNode.Sequence) {
            ((ValueNode.Sequence) existing).add(entry.getValue());
            ((LineNode.Sequence) existingLine).add(entry.getLine());
            return;
        }

        ValueNode.Sequence valueList = new ValueNode.Sequence();
        valueList.add(existing);
        valueList.add(entry.getValue());
        LineNode.Sequence lineList = new LineNode.Sequence();
        lineList.add(existingLine);
        lineList.add(entry.getLine());
        values.put(key, valueList);
        lines.put(key, lineList);
    }
}
