package com.hclparser.syntax.ast.expr;

import com.hclparser.syntax.ast.AstVisitor;
import com.hclparser.syntax.ast.SourceRange;

/**
 * for 表达式
 *
 * <p>元组形式 {@code [for k, v in coll : expr if cond]}，
 * 对象形式 {@code {for k, v in coll : key => value... if cond}}；
 * 模板中的 {@code %{for}} 指令同样解析为此节点（值表达式为循环体模板）。</p>
 */
public class ForExpr extends Expression {
    private final String keyVar;
    private final String valVar;
    private final Expression collExpr;
    private final Expression keyExpr;
    private final Expression valExpr;
    private final Expression condExpr;
    private final boolean group;
    private final SourceRange openRange;

    public ForExpr(SourceRange range, SourceRange openRange,
                   String keyVar, String valVar, Expression collExpr,
                   Expression keyExpr, Expression valExpr, Expression condExpr, boolean group) {
        super(range);
        this.openRange = openRange;
        this.keyVar = keyVar;
        this.valVar = valVar;
        this.collExpr = collExpr;
        this.keyExpr = keyExpr;
        this.valExpr = valExpr;
        this.condExpr = condExpr;
        this.group = group;
    }

    /** 未绑定键变量时为 null */
    public String getKeyVar() { return keyVar; }
    public String getValVar() { return valVar; }
    public Expression getCollExpr() { return collExpr; }
    /** 元组形式为 null */
    public Expression getKeyExpr() { return keyExpr; }
    public Expression getValExpr() { return valExpr; }
    /** 无 if 子句时为 null */
    public Expression getCondExpr() { return condExpr; }
    public boolean isGroup() { return group; }

    public boolean isObjectForm() {
        return keyExpr != null;
    }

    public SourceRange getOpenRange() {
        return openRange;
    }

    @Override
    public SourceRange getStartRange() {
        return openRange;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitForExpr(this, context);
    }
}
