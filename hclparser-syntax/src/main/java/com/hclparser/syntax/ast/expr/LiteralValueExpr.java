package com.hclparser.syntax.ast.expr;

import com.hclparser.syntax.ast.AstVisitor;
import com.hclparser.syntax.ast.SourceRange;

import java.math.BigDecimal;

/**
 * 已知值的字面量：字符串、数字、布尔或 null
 */
public class LiteralValueExpr extends Expression {
    private final Object value;
    private final LiteralKind kind;

    public LiteralValueExpr(SourceRange range, Object value, LiteralKind kind) {
        super(range);
        this.value = value;
        this.kind = kind;
    }

    public static LiteralValueExpr string(SourceRange range, String value) {
        return new LiteralValueExpr(range, value, LiteralKind.STRING);
    }

    public static LiteralValueExpr number(SourceRange range, BigDecimal value) {
        return new LiteralValueExpr(range, value, LiteralKind.NUMBER);
    }

    public static LiteralValueExpr bool(SourceRange range, boolean value) {
        return new LiteralValueExpr(range, value, LiteralKind.BOOL);
    }

    public static LiteralValueExpr nullValue(SourceRange range) {
        return new LiteralValueExpr(range, null, LiteralKind.NULL);
    }

    /** String、BigDecimal、Boolean 或 null */
    public Object getValue() {
        return value;
    }

    public LiteralKind getKind() {
        return kind;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitLiteralValueExpr(this, context);
    }

    /**
     * 字面量类型
     */
    public enum LiteralKind {
        STRING,
        NUMBER,
        BOOL,
        NULL
    }
}
