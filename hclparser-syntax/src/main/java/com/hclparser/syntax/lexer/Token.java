package com.hclparser.syntax.lexer;

import com.hclparser.syntax.ast.SourcePos;
import com.hclparser.syntax.ast.SourceRange;

/**
 * 词法单元
 */
public final class Token {
    private final TokenType type;
    private final String lexeme;
    private final Object literal;
    private final SourceRange range;

    public Token(TokenType type, String lexeme, Object literal, SourceRange range) {
        this.type = type;
        this.lexeme = lexeme;
        this.literal = literal;
        this.range = range;
    }

    public TokenType getType() {
        return type;
    }

    public String getLexeme() {
        return lexeme;
    }

    /**
     * 字面量值：QUOTED_LIT/STRING_LIT 为解码后的字符串，NUMBER_LIT 为 BigDecimal，
     * OHEREDOC 为结束标记，ERROR 为错误信息
     */
    public Object getLiteral() {
        return literal;
    }

    public SourceRange getRange() {
        return range;
    }

    public SourcePos getStart() {
        return range.getStart();
    }

    public SourcePos getEnd() {
        return range.getEnd();
    }

    public int getLine() {
        return range.getStart().getLine();
    }

    public int getColumn() {
        return range.getStart().getColumn();
    }

    public boolean is(TokenType type) {
        return this.type == type;
    }

    public boolean isOneOf(TokenType... types) {
        for (TokenType t : types) {
            if (this.type == t) {
                return true;
            }
        }
        return false;
    }

    @Override
    public String toString() {
        if (literal != null) {
            return String.format("%s(%s, %s) at %d:%d",
                    type, lexeme, literal, getLine(), getColumn());
        }
        return String.format("%s(%s) at %d:%d",
                type, lexeme, getLine(), getColumn());
    }
}
