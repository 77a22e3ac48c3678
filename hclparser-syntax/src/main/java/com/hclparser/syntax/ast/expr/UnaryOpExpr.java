package com.hclparser.syntax.ast.expr;

import com.hclparser.syntax.ast.AstVisitor;
import com.hclparser.syntax.ast.SourceRange;

/**
 * 一元运算表达式 {@code !x} / {@code -x}
 */
public class UnaryOpExpr extends Expression {
    private final UnaryOp operator;
    private final Expression operand;
    private final SourceRange symbolRange;

    public UnaryOpExpr(SourceRange range, UnaryOp operator, Expression operand, SourceRange symbolRange) {
        super(range);
        this.operator = operator;
        this.operand = operand;
        this.symbolRange = symbolRange;
    }

    public UnaryOp getOperator() {
        return operator;
    }

    public Expression getOperand() {
        return operand;
    }

    public SourceRange getSymbolRange() {
        return symbolRange;
    }

    @Override
    public SourceRange getStartRange() {
        return symbolRange;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitUnaryOpExpr(this, context);
    }

    /**
     * 一元运算符
     */
    public enum UnaryOp {
        NOT("!"),
        NEGATE("-");

        private final String symbol;

        UnaryOp(String symbol) {
            this.symbol = symbol;
        }

        public String getSymbol() {
            return symbol;
        }
    }
}
