package com.hclparser.syntax.ast.expr;

import com.hclparser.syntax.ast.AstVisitor;
import com.hclparser.syntax.ast.SourceRange;

import java.util.Collections;
import java.util.List;

/**
 * 字符串模板，由字面量片段与插值、控制序列组成
 */
public class TemplateExpr extends Expression {
    private final List<Expression> parts;

    public TemplateExpr(SourceRange range, List<Expression> parts) {
        super(range);
        this.parts = Collections.unmodifiableList(parts);
    }

    public List<Expression> getParts() {
        return parts;
    }

    /**
     * 模板是否只由单个字符串字面量构成
     */
    public boolean isStringLiteral() {
        if (parts.size() != 1) {
            return false;
        }
        Expression part = parts.get(0);
        return part instanceof LiteralValueExpr
                && ((LiteralValueExpr) part).getKind() == LiteralValueExpr.LiteralKind.STRING;
    }

    @Override
    public SourceRange getStartRange() {
        return parts.get(0).getStartRange();
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitTemplateExpr(this, context);
    }
}
