package com.hclparser.convert;

import com.hclparser.syntax.ast.Block;

/**
 * 块转换：沿标签逐层嵌套，最后把块体合并到最内层
 *
 * <p>{@code db "mysql" "primary" { x = 1 }} 得到 {@code {"db":{"mysql":{"primary":{"x":1}}}}}。
 * 已存在的同名层级会被复用，因此同类型不同标签的块共享上层对象。</p>
 */
class BlockConverter {
    private final BodyConverter bodies;

    BlockConverter(BodyConverter bodies) {
        this.bodies = bodies;
    }

    void convert(Block block, ValueNode.Mapping values, LineNode.Mapping lines) {
        ValueNode.Mapping currentValues = values;
        LineNode.Mapping currentLines = lines;
        String key = block.getType();

        for (String label : block.getLabels()) {
            if (currentValues.containsKey(key)) {
                ValueNode existing = currentValues.get(key);
                LineNode existingLine = currentLines.get(key);
                if (!(existing instanceof ValueNode.Mapping) || !(existingLine instanceof LineNode.Mapping)) {
                    throw new ConversionException(ConversionException.Kind.STRUCTURE,
                            "unable to convert block to JSON: " + path(block));
                }
                currentValues = (ValueNode.Mapping) existing;
                currentLines = (LineNode.Mapping) existingLine;
            } else {
                ValueNode.Mapping nestedValues = new ValueNode.Mapping();
                LineNode.Mapping nestedLines = new LineNode.Mapping();
                currentValues.put(key, nestedValues);
                currentLines.put(key, nestedLines);
                currentValues = nestedValues;
                currentLines = nestedLines;
            }
            key = label;
        }

        Converted body;
        try {
            body = bodies.convert(block.getBody());
        } catch (ConversionException e) {
            throw e.withContext("convert body");
        }
        body.getLine().annotateKey(block.getTypeRange());
        CollisionMerger.merge(currentValues, currentLines, key, body);
    }

    private static String path(Block block) {
        StringBuilder sb = new StringBuilder(block.getType());
        for (String label : block.getLabels()) {
            sb.append('.').append(label);
        }
        return sb.toString();
    }
}
