package com.hclparser.syntax.parser;

import com.hclparser.syntax.lexer.Token;

/**
 * 解析异常
 */
public class ParseException extends RuntimeException {
    private final Token token;
    private final String expected;

    public ParseException(String message, Token token) {
        super(message);
        this.token = token;
        this.expected = null;
    }

    public ParseException(String message, Token token, String expected) {
        super(message);
        this.token = token;
        this.expected = expected;
    }

    public Token getToken() {
        return token;
    }

    public String getExpected() {
        return expected;
    }

    /** 不含位置信息的原始描述 */
    public String getDescription() {
        return super.getMessage();
    }

    @Override
    public String getMessage() {
        StringBuilder sb = new StringBuilder();
        if (token != null) {
            sb.append(token.getRange().getFileName()).append(':')
              .append(token.getLine()).append(',').append(token.getColumn()).append(": ");
        }
        sb.append(super.getMessage());
        if (token != null && !token.getLexeme().isEmpty()) {
            sb.append(" (found '").append(token.getLexeme().trim()).append("')");
        }
        if (expected != null) {
            sb.append(", expected: ").append(expected);
        }
        return sb.toString();
    }
}
