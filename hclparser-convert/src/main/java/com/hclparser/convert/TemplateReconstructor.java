package com.hclparser.convert;

import com.hclparser.syntax.ast.AstVisitor;
import com.hclparser.syntax.ast.SourceRange;
import com.hclparser.syntax.ast.expr.*;

import java.math.BigDecimal;

/**
 * 还原模板的文本形式
 *
 * <p>只做语法到语法的改写：常量字面量直接输出，条件与循环输出为 {@code %{if}}/{@code %{for}} 指令，
 * 其余表达式输出为 {@code ${原文}}，任何表达式都不求值。
 * 访问方法返回 null 表示按 {@code ${原文}} 处理。</p>
 */
class TemplateReconstructor implements AstVisitor<String, Void> {
    private final ConversionContext context;
    private final SourceExtractor extractor;

    TemplateReconstructor(ConversionContext context) {
        this.context = context;
        this.extractor = context.getExtractor();
    }

    /**
     * 整个模板的文本：纯字符串模板直接取值，否则依次拼接各片段
     */
    String template(TemplateExpr template) {
        if (template.isStringLiteral()) {
            return (String) ((LiteralValueExpr) template.getParts().get(0)).getValue();
        }
        StringBuilder sb = new StringBuilder();
        for (Expression part : template.getParts()) {
            sb.append(stringPart(part));
        }
        return sb.toString();
    }

    /**
     * 模板中单个片段的文本
     */
    String stringPart(Expression expr) {
        String text = expr.accept(this, null);
        return text != null ? text : wrap(expr);
    }

    /**
     * 对象键：裸标识符（及其遍历）按原文，其余按模板片段处理
     */
    String key(Expression keyExpr) {
        Expression expr = keyExpr;
        if (expr instanceof ObjectConsKeyExpr) {
            expr = ((ObjectConsKeyExpr) expr).getWrapped();
            if (expr instanceof ScopeTraversalExpr) {
                return extractor.extract(expr.getRange());
            }
        }
        return stringPart(expr);
    }

    /** {@code ${原文}} */
    String wrap(Expression expr) {
        return "${" + extractor.extract(expr.getRange()) + "}";
    }

    // ============ 片段 ============

    @Override
    public String visitLiteralValueExpr(LiteralValueExpr node, Void ctx) {
        Object value = node.getValue();
        if (value == null) {
            SourceRange range = node.getRange();
            throw new ConversionException(ConversionException.Kind.VALUE_CONVERSION,
                    "convert literal to string: null value cannot be converted to string ("
                            + context.getFileName() + ":" + range.getStart() + ": "
                            + extractor.extract(range) + ")");
        }
        if (value instanceof BigDecimal) {
            return ValueNode.numberText((BigDecimal) value);
        }
        return value.toString();
    }

    @Override
    public String visitTemplateExpr(TemplateExpr node, Void ctx) {
        return template(node);
    }

    @Override
    public String visitTemplateWrapExpr(TemplateWrapExpr node, Void ctx) {
        return stringPart(node.getWrapped());
    }

    @Override
    public String visitConditionalExpr(ConditionalExpr node, Void ctx) {
        StringBuilder sb = new StringBuilder();
        sb.append("%{if ").append(extractor.extract(node.getCondition().getRange())).append('}');
        sb.append(stringPart(node.getTrueResult()));
        String falseResult = stringPart(node.getFalseResult());
        if (!falseResult.isEmpty()) {
            sb.append("%{else}").append(falseResult);
        }
        sb.append("%{endif}");
        return sb.toString();
    }

    @Override
    public String visitTemplateJoinExpr(TemplateJoinExpr node, Void ctx) {
        if (!(node.getTuple() instanceof ForExpr)) {
            return null;
        }
        ForExpr forExpr = (ForExpr) node.getTuple();
        StringBuilder sb = new StringBuilder();
        sb.append("%{for ");
        if (forExpr.getKeyVar() != null) {
            sb.append(forExpr.getKeyVar()).append(", ");
        }
        sb.append(forExpr.getValVar()).append(" in ")
          .append(extractor.extract(forExpr.getCollExpr().getRange())).append('}');
        sb.append(stringPart(forExpr.getValExpr()));
        sb.append("%{endfor}");
        return sb.toString();
    }
}
