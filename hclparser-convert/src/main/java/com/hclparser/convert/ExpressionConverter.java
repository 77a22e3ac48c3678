package com.hclparser.convert;

import com.hclparser.syntax.ast.AstVisitor;
import com.hclparser.syntax.ast.expr.*;

/**
 * 表达式转换：按表达式类型生成值节点与行信息节点
 *
 * <p>行信息统一取表达式的起始区间。常量直接成为值；模板交给 {@link TemplateReconstructor}；
 * 无法用 JSON 表示的表达式（访问方法返回 null）输出为 {@code ${原文}} 字符串。</p>
 */
class ExpressionConverter implements AstVisitor<Converted, LineNode.Position> {
    private final TemplateReconstructor templates;

    ExpressionConverter(TemplateReconstructor templates) {
        this.templates = templates;
    }

    Converted convert(Expression expr) {
        LineNode.Position position = LineNode.Position.of(expr.getStartRange());
        Converted converted = expr.accept(this, position);
        if (converted == null) {
            converted = new Converted(ValueNode.scalar(templates.wrap(expr)), position);
        }
        return converted;
    }

    @Override
    public Converted visitLiteralValueExpr(LiteralValueExpr node, LineNode.Position position) {
        return new Converted(ValueNode.scalar(node.getValue()), position);
    }

    @Override
    public Converted visitTemplateExpr(TemplateExpr node, LineNode.Position position) {
        return new Converted(ValueNode.scalar(templates.template(node)), position);
    }

    @Override
    public Converted visitTemplateWrapExpr(TemplateWrapExpr node, LineNode.Position position) {
        return convert(node.getWrapped());
    }

    // 元素的行信息不保留，元组整体只有一个位置
    @Override
    public Converted visitTupleConsExpr(TupleConsExpr node, LineNode.Position position) {
        ValueNode.Sequence values = new ValueNode.Sequence();
        for (Expression element : node.getExprs()) {
            values.add(convert(element).getValue());
        }
        return new Converted(values, position);
    }

    @Override
    public Converted visitObjectConsExpr(ObjectConsExpr node, LineNode.Position position) {
        ValueNode.Mapping values = new ValueNode.Mapping();
        LineNode.Mapping lines = new LineNode.Mapping(node.getStartRange());
        for (ObjectConsExpr.Item item : node.getItems()) {
            String key = templates.key(item.getKeyExpr());
            Converted converted = convert(item.getValueExpr());
            values.put(key, converted.getValue());
            lines.put(key, converted.getLine());
        }
        return new Converted(values, lines);
    }
}
