package com.hclparser.convert;

import com.hclparser.syntax.ast.SourceRange;

import java.nio.charset.StandardCharsets;

/**
 * 按字节区间截取源码原文
 */
class SourceExtractor {
    private final byte[] bytes;

    SourceExtractor(byte[] bytes) {
        this.bytes = bytes;
    }

    /**
     * 区间 [start, end) 对应的原文。
     * 若原文中的左括号多于右括号且紧随其后的字节是 {@code )}，则把它一并包含，结果中只出现一次。
     */
    String extract(SourceRange range) {
        int start = range.getStart().getByteOffset();
        int end = range.getEnd().getByteOffset();
        String text = new String(bytes, start, end - start, StandardCharsets.UTF_8);
        if (end < bytes.length && bytes[end] == ')' && hasUnclosedParen(text)) {
            return text + ")";
        }
        return text;
    }

    /** 引号字符串内的括号不计入 */
    static boolean hasUnclosedParen(String text) {
        int depth = 0;
        boolean inString = false;
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (inString) {
                if (c == '\\') {
                    i++;
                } else if (c == '"') {
                    inString = false;
                }
                continue;
            }
            switch (c) {
                case '"':
                    inString = true;
                    break;
                case '(':
                    depth++;
                    break;
                case ')':
                    if (depth > 0) depth--;
                    break;
                default:
                    break;
            }
        }
        return depth > 0;
    }
}
