package com.hclparser.syntax.parser;

import com.hclparser.syntax.ast.SourceRange;
import com.hclparser.syntax.ast.expr.*;
import com.hclparser.syntax.lexer.Token;
import com.hclparser.syntax.lexer.TokenType;

import java.util.ArrayList;
import java.util.List;

import static com.hclparser.syntax.lexer.TokenType.*;

/**
 * 模板解析辅助类
 *
 * <p>分两步进行：先把 token 序列整理成扁平的片段列表（字面量、插值、指令），
 * 处理 {@code <<-} 缩进与 {@code ~} 去空白；再把 if/for 指令配对，组装成嵌套的表达式树。</p>
 */
class TemplateParser {

    final Parser parser;

    TemplateParser(Parser parser) {
        this.parser = parser;
    }

    /**
     * 引号模板 {@code "..."}，当前 token 为 OQUOTE
     */
    Expression parseQuoted() {
        Token open = parser.advance();
        List<Item> items = parseItems(CQUOTE, "Unterminated template string");
        Token close = parser.advance();
        return buildTemplate(items, SourceRange.between(open.getRange(), close.getRange()), open.getRange());
    }

    /**
     * heredoc 模板，当前 token 为 OHEREDOC
     */
    Expression parseHeredoc() {
        Token open = parser.advance();
        List<Item> items = parseItems(CHEREDOC, "Unterminated heredoc");
        Token close = parser.advance();
        if (open.getLexeme().startsWith("<<-")) {
            flushIndent(items);
        }
        return buildTemplate(items, SourceRange.between(open.getRange(), close.getRange()), open.getRange());
    }

    // ============ 第一步：扁平片段 ============

    private List<Item> parseItems(TokenType end, String unterminatedMessage) {
        List<Item> items = new ArrayList<Item>();
        while (!parser.check(end)) {
            Token token = parser.current();
            switch (token.getType()) {
                case QUOTED_LIT:
                case STRING_LIT:
                    parser.advance();
                    items.add(Item.literal((String) token.getLiteral(), token.getRange()));
                    break;
                case TEMPLATE_INTERP:
                    items.add(parseInterpolation());
                    break;
                case TEMPLATE_CONTROL:
                    items.add(parseDirective());
                    break;
                case EOF:
                    throw new ParseException(unterminatedMessage, token);
                default:
                    throw new ParseException("Unexpected token in template", token);
            }
        }
        return items;
    }

    private Item parseInterpolation() {
        Token open = parser.advance();
        parser.ignoreNewlines();
        boolean stripLeft = parser.match(TILDE);
        Expression expr = parser.exprParser.parseExpression();
        boolean stripRight = parser.match(TILDE);
        Token close = parser.expect(TEMPLATE_SEQ_END, "Extra characters after interpolation expression");
        parser.restoreNewlines();

        Item item = new Item(ItemKind.INTERP, SourceRange.between(open.getRange(), close.getRange()));
        item.expr = expr;
        item.stripLeft = stripLeft;
        item.stripRight = stripRight;
        return item;
    }

    private Item parseDirective() {
        Token open = parser.advance();
        parser.ignoreNewlines();
        boolean stripLeft = parser.match(TILDE);
        Token keyword = parser.expect(IDENTIFIER, "Invalid template directive; expected if, else, endif, for or endfor");

        Item item;
        String name = keyword.getLexeme();
        if ("if".equals(name)) {
            item = new Item(ItemKind.IF, null);
            item.expr = parser.exprParser.parseExpression();
        } else if ("else".equals(name)) {
            item = new Item(ItemKind.ELSE, null);
        } else if ("endif".equals(name)) {
            item = new Item(ItemKind.ENDIF, null);
        } else if ("for".equals(name)) {
            item = new Item(ItemKind.FOR, null);
            String first = parser.expect(IDENTIFIER, "Invalid 'for' directive; an iterator variable is required")
                    .getLexeme();
            if (parser.match(COMMA)) {
                item.keyVar = first;
                item.valVar = parser.expect(IDENTIFIER, "Invalid 'for' directive; a value variable is required")
                        .getLexeme();
            } else {
                item.valVar = first;
            }
            parser.expectKeyword("in", "Invalid 'for' directive; the 'in' keyword is required");
            item.expr = parser.exprParser.parseExpression();
        } else if ("endfor".equals(name)) {
            item = new Item(ItemKind.ENDFOR, null);
        } else {
            throw new ParseException("Invalid template directive '" + name + "'", keyword,
                    "if, else, endif, for or endfor");
        }

        item.stripLeft = stripLeft;
        item.stripRight = parser.match(TILDE);
        Token close = parser.expect(TEMPLATE_SEQ_END, "Extra characters in " + name + " directive");
        parser.restoreNewlines();
        item.range = SourceRange.between(open.getRange(), close.getRange());
        return item;
    }

    /**
     * {@code <<-} heredoc：去掉各行共同的最小缩进，空白行不参与计算
     */
    private static void flushIndent(List<Item> items) {
        int min = Integer.MAX_VALUE;
        for (Item item : items) {
            if (!item.isLineStart()) {
                continue;
            }
            if (item.kind != ItemKind.LITERAL) {
                min = 0;
                continue;
            }
            int spaces = leadingSpaces(item.text);
            if (spaces == item.text.length() || item.text.charAt(spaces) == '\n' || item.text.charAt(spaces) == '\r') {
                continue;
            }
            min = Math.min(min, spaces);
        }
        if (min == Integer.MAX_VALUE || min == 0) {
            return;
        }
        for (Item item : items) {
            if (item.kind == ItemKind.LITERAL && item.isLineStart()) {
                item.text = item.text.substring(Math.min(min, leadingSpaces(item.text)));
            }
        }
    }

    private static int leadingSpaces(String text) {
        int i = 0;
        while (i < text.length() && (text.charAt(i) == ' ' || text.charAt(i) == '\t')) {
            i++;
        }
        return i;
    }

    /**
     * 处理 ~ 去空白标记，合并相邻字面量并丢弃空字面量
     */
    private static List<Item> normalize(List<Item> items) {
        for (int i = 0; i < items.size(); i++) {
            Item item = items.get(i);
            if (item.stripLeft && i > 0 && items.get(i - 1).kind == ItemKind.LITERAL) {
                Item prev = items.get(i - 1);
                prev.text = stripTrailing(prev.text);
            }
            if (item.stripRight && i + 1 < items.size() && items.get(i + 1).kind == ItemKind.LITERAL) {
                Item next = items.get(i + 1);
                next.text = stripLeading(next.text);
            }
        }

        List<Item> result = new ArrayList<Item>();
        for (Item item : items) {
            if (item.kind == ItemKind.LITERAL) {
                if (item.text.isEmpty()) {
                    continue;
                }
                Item last = result.isEmpty() ? null : result.get(result.size() - 1);
                if (last != null && last.kind == ItemKind.LITERAL) {
                    last.text = last.text + item.text;
                    last.range = SourceRange.between(last.range, item.range);
                    continue;
                }
            }
            result.add(item);
        }
        return result;
    }

    private static String stripLeading(String text) {
        int i = 0;
        while (i < text.length() && Character.isWhitespace(text.charAt(i))) i++;
        return text.substring(i);
    }

    private static String stripTrailing(String text) {
        int i = text.length();
        while (i > 0 && Character.isWhitespace(text.charAt(i - 1))) i--;
        return text.substring(0, i);
    }

    // ============ 第二步：嵌套结构 ============

    private Expression buildTemplate(List<Item> rawItems, SourceRange range, SourceRange openRange) {
        List<Item> items = normalize(rawItems);

        // 恰好一个插值的模板直接包装其表达式
        if (items.size() == 1 && items.get(0).kind == ItemKind.INTERP) {
            return new TemplateWrapExpr(range, items.get(0).expr);
        }

        Cursor cursor = new Cursor(items);
        List<Expression> parts = parseParts(cursor);
        if (!cursor.isAtEnd()) {
            throw unexpectedDirective(cursor.peek());
        }
        return new TemplateExpr(range, withEmptyLiteral(parts, SourceRange.at(range.getFileName(), openRange.getEnd())));
    }

    /**
     * 读取片段直到遇到 else / endif / endfor（不消费）或结束
     */
    private List<Expression> parseParts(Cursor cursor) {
        List<Expression> parts = new ArrayList<Expression>();
        while (!cursor.isAtEnd()) {
            Item item = cursor.peek();
            switch (item.kind) {
                case LITERAL:
                    cursor.next();
                    parts.add(LiteralValueExpr.string(item.range, item.text));
                    break;
                case INTERP:
                    cursor.next();
                    parts.add(item.expr);
                    break;
                case IF:
                    parts.add(parseIf(cursor));
                    break;
                case FOR:
                    parts.add(parseForDirective(cursor));
                    break;
                default:
                    return parts;
            }
        }
        return parts;
    }

    private Expression parseIf(Cursor cursor) {
        Item ifItem = cursor.next();
        List<Expression> trueParts = parseParts(cursor);
        Expression falseResult = null;
        SourceRange trueEnd = ifItem.range;

        if (!cursor.isAtEnd() && cursor.peek().kind == ItemKind.ELSE) {
            Item elseItem = cursor.next();
            trueEnd = elseItem.range;
            List<Expression> falseParts = parseParts(cursor);
            Item endIf = expectDirective(cursor, ItemKind.ENDIF, ifItem, "if");
            falseResult = partsTemplate(falseParts, elseItem.range, endIf.range);
            return new ConditionalExpr(SourceRange.between(ifItem.range, endIf.range), ifItem.expr,
                    partsTemplate(trueParts, ifItem.range, trueEnd), falseResult);
        }

        Item endIf = expectDirective(cursor, ItemKind.ENDIF, ifItem, "if");
        falseResult = LiteralValueExpr.string(SourceRange.at(endIf.range.getFileName(), endIf.range.getStart()), "");
        return new ConditionalExpr(SourceRange.between(ifItem.range, endIf.range), ifItem.expr,
                partsTemplate(trueParts, ifItem.range, endIf.range), falseResult);
    }

    private Expression parseForDirective(Cursor cursor) {
        Item forItem = cursor.next();
        List<Expression> bodyParts = parseParts(cursor);
        Item endFor = expectDirective(cursor, ItemKind.ENDFOR, forItem, "for");

        Expression body = partsTemplate(bodyParts, forItem.range, endFor.range);
        ForExpr forExpr = new ForExpr(SourceRange.between(forItem.range, endFor.range), forItem.range,
                forItem.keyVar, forItem.valVar, forItem.expr, null, body, null, false);
        return new TemplateJoinExpr(forExpr);
    }

    /** 指令之间的片段组成的子模板，区间为两个指令之间 */
    private static TemplateExpr partsTemplate(List<Expression> parts, SourceRange after, SourceRange before) {
        SourceRange range = new SourceRange(after.getFileName(), after.getEnd(), before.getStart());
        return new TemplateExpr(range, withEmptyLiteral(parts, SourceRange.at(after.getFileName(), after.getEnd())));
    }

    private static List<Expression> withEmptyLiteral(List<Expression> parts, SourceRange emptyRange) {
        if (parts.isEmpty()) {
            parts.add(LiteralValueExpr.string(emptyRange, ""));
        }
        return parts;
    }

    private Item expectDirective(Cursor cursor, ItemKind kind, Item opener, String name) {
        if (cursor.isAtEnd()) {
            throw new ParseException("Unterminated template " + name + " directive; no matching end"
                    + name + " found for the directive at " + opener.range.getStart(), parser.current());
        }
        Item item = cursor.peek();
        if (item.kind != kind) {
            throw unexpectedDirective(item);
        }
        return cursor.next();
    }

    private ParseException unexpectedDirective(Item item) {
        String name = item.kind.name().toLowerCase();
        return new ParseException("Unexpected " + name + " directive at " + item.range.getStart()
                + "; no matching opening directive", parser.current());
    }

    // ============ 片段 ============

    private enum ItemKind {
        LITERAL,
        INTERP,
        IF,
        ELSE,
        ENDIF,
        FOR,
        ENDFOR
    }

    private static final class Item {
        final ItemKind kind;
        SourceRange range;
        String text;
        Expression expr;
        String keyVar;
        String valVar;
        boolean stripLeft;
        boolean stripRight;

        Item(ItemKind kind, SourceRange range) {
            this.kind = kind;
            this.range = range;
        }

        static Item literal(String text, SourceRange range) {
            Item item = new Item(ItemKind.LITERAL, range);
            item.text = text;
            return item;
        }

        boolean isLineStart() {
            return range.getStart().getColumn() == 1;
        }
    }

    private static final class Cursor {
        private final List<Item> items;
        private int index;

        Cursor(List<Item> items) {
            this.items = items;
        }

        boolean isAtEnd() {
            return index >= items.size();
        }

        Item peek() {
            return items.get(index);
        }

        Item next() {
            return items.get(index++);
        }
    }
}
