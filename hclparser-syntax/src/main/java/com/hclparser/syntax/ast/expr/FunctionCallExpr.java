package com.hclparser.syntax.ast.expr;

import com.hclparser.syntax.ast.AstVisitor;
import com.hclparser.syntax.ast.SourceRange;

import java.util.Collections;
import java.util.List;

/**
 * 函数调用 {@code name(arg, ...)}
 */
public class FunctionCallExpr extends Expression {
    private final String name;
    private final List<Expression> args;
    private final boolean expandFinal;
    private final SourceRange nameRange;
    private final SourceRange openParenRange;

    public FunctionCallExpr(SourceRange range, String name, List<Expression> args, boolean expandFinal,
                            SourceRange nameRange, SourceRange openParenRange) {
        super(range);
        this.name = name;
        this.args = Collections.unmodifiableList(args);
        this.expandFinal = expandFinal;
        this.nameRange = nameRange;
        this.openParenRange = openParenRange;
    }

    public String getName() {
        return name;
    }

    public List<Expression> getArgs() {
        return args;
    }

    /** 最后一个参数后是否带 {@code ...} */
    public boolean isExpandFinal() {
        return expandFinal;
    }

    public SourceRange getNameRange() {
        return nameRange;
    }

    public SourceRange getOpenParenRange() {
        return openParenRange;
    }

    @Override
    public SourceRange getStartRange() {
        return SourceRange.between(nameRange, openParenRange);
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitFunctionCallExpr(this, context);
    }
}
