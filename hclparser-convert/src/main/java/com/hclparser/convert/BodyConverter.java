package com.hclparser.convert;

import com.hclparser.syntax.ast.Attribute;
import com.hclparser.syntax.ast.Block;
import com.hclparser.syntax.ast.Body;
import com.hclparser.syntax.ast.Node;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * 体转换：属性与子块按源码顺序依次写入同一对值/行信息映射
 */
class BodyConverter {
    private final ExpressionConverter expressions;
    private final BlockConverter blocks;

    BodyConverter(ConversionContext context) {
        this.expressions = new ExpressionConverter(new TemplateReconstructor(context));
        this.blocks = new BlockConverter(this);
    }

    Converted convert(Body body) {
        ValueNode.Mapping values = new ValueNode.Mapping();
        LineNode.Mapping lines = new LineNode.Mapping();

        for (Node item : sourceOrder(body)) {
            if (item instanceof Block) {
                try {
                    blocks.convert((Block) item, values, lines);
                } catch (ConversionException e) {
                    throw e.withContext("convert block");
                }
            } else {
                Attribute attribute = (Attribute) item;
                Converted converted;
                try {
                    converted = expressions.convert(attribute.getExpr());
                } catch (ConversionException e) {
                    throw e.withContext("convert expression");
                }
                converted.getLine().annotateKey(attribute.getNameRange());
                CollisionMerger.merge(values, lines, attribute.getName(), converted);
            }
        }

        lines.setRange(body.getRange());
        return new Converted(values, lines);
    }

    private static List<Node> sourceOrder(Body body) {
        List<Node> items = new ArrayList<Node>(body.getAttributes().values());
        items.addAll(body.getBlocks());
        items.sort(Comparator.comparingInt(n -> n.getRange().getStart().getByteOffset()));
        return items;
    }
}
