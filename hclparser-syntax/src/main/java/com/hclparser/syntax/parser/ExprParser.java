package com.hclparser.syntax.parser;

import com.hclparser.syntax.ast.SourceRange;
import com.hclparser.syntax.ast.expr.*;
import com.hclparser.syntax.lexer.Token;
import com.hclparser.syntax.lexer.TokenType;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;

import static com.hclparser.syntax.lexer.TokenType.*;

/**
 * 表达式解析辅助类
 */
class ExprParser {

    // 二元运算优先级，从低到高
    private static final TokenType[][] BINARY_LEVELS = {
            {OR},
            {AND},
            {EQUAL_OP, NOT_EQUAL},
            {LT, GT, LTE, GTE},
            {PLUS, MINUS},
            {STAR, SLASH, PERCENT},
    };

    final Parser parser;

    ExprParser(Parser parser) {
        this.parser = parser;
    }

    Expression parseExpression() {
        return parseConditional();
    }

    // 条件表达式 cond ? a : b（右结合）
    private Expression parseConditional() {
        Expression condition = parseBinary(0);

        if (parser.match(QUESTION)) {
            Expression trueResult = parseExpression();
            parser.expect(COLON, "Missing false expression in conditional");
            Expression falseResult = parseExpression();
            return new ConditionalExpr(SourceRange.between(condition.getRange(), falseResult.getRange()),
                    condition, trueResult, falseResult);
        }

        return condition;
    }

    // 左结合的二元运算
    private Expression parseBinary(int level) {
        if (level == BINARY_LEVELS.length) {
            return parseUnary();
        }
        Expression left = parseBinary(level + 1);
        while (true) {
            BinaryOpExpr.BinaryOp op = binaryOp(level, parser.current().getType());
            if (op == null) {
                return left;
            }
            parser.advance();
            Expression right = parseBinary(level + 1);
            left = new BinaryOpExpr(SourceRange.between(left.getRange(), right.getRange()), left, op, right);
        }
    }

    private static BinaryOpExpr.BinaryOp binaryOp(int level, TokenType type) {
        boolean inLevel = false;
        for (TokenType t : BINARY_LEVELS[level]) {
            if (t == type) {
                inLevel = true;
                break;
            }
        }
        if (!inLevel) {
            return null;
        }
        switch (type) {
            case OR: return BinaryOpExpr.BinaryOp.OR;
            case AND: return BinaryOpExpr.BinaryOp.AND;
            case EQUAL_OP: return BinaryOpExpr.BinaryOp.EQ;
            case NOT_EQUAL: return BinaryOpExpr.BinaryOp.NE;
            case LT: return BinaryOpExpr.BinaryOp.LT;
            case GT: return BinaryOpExpr.BinaryOp.GT;
            case LTE: return BinaryOpExpr.BinaryOp.LE;
            case GTE: return BinaryOpExpr.BinaryOp.GE;
            case PLUS: return BinaryOpExpr.BinaryOp.ADD;
            case MINUS: return BinaryOpExpr.BinaryOp.SUB;
            case STAR: return BinaryOpExpr.BinaryOp.MUL;
            case SLASH: return BinaryOpExpr.BinaryOp.DIV;
            case PERCENT: return BinaryOpExpr.BinaryOp.MOD;
            default: return null;
        }
    }

    // 一元运算 ! / -
    private Expression parseUnary() {
        if (parser.check(BANG) || parser.check(MINUS)) {
            Token symbol = parser.advance();
            Expression operand = parseUnary();
            UnaryOpExpr.UnaryOp op = symbol.is(BANG) ? UnaryOpExpr.UnaryOp.NOT : UnaryOpExpr.UnaryOp.NEGATE;
            return new UnaryOpExpr(SourceRange.between(symbol.getRange(), operand.getRange()), op, operand,
                    symbol.getRange());
        }
        return parsePostfix(parseTerm());
    }

    // ============ 遍历、索引与展开 ============

    private Expression parsePostfix(Expression term) {
        Expression base = term;
        List<Traverser> steps = new ArrayList<Traverser>();

        while (true) {
            if (parser.check(DOT)) {
                Token dot = parser.advance();
                if (parser.check(STAR)) {
                    Token star = parser.advance();
                    base = applySteps(base, steps);
                    steps = new ArrayList<Traverser>();
                    base = parseSplat(base, false, SourceRange.between(dot.getRange(), star.getRange()));
                } else {
                    steps.add(parseDotStep(dot));
                }
            } else if (parser.check(LBRACKET)) {
                Token open = parser.advance();
                if (parser.check(STAR)) {
                    parser.advance();
                    Token close = parser.expect(RBRACKET, "Missing close bracket on splat index");
                    base = applySteps(base, steps);
                    steps = new ArrayList<Traverser>();
                    base = parseSplat(base, true, SourceRange.between(open.getRange(), close.getRange()));
                    continue;
                }

                parser.ignoreNewlines();
                Expression key = parseExpression();
                Token close = parser.expect(RBRACKET, "Missing close bracket on index");
                parser.restoreNewlines();

                SourceRange bracketRange = SourceRange.between(open.getRange(), close.getRange());
                Object literalKey = literalIndexKey(key);
                if (literalKey != null) {
                    steps.add(new Traverser.Index(bracketRange, literalKey));
                } else {
                    Expression collection = applySteps(base, steps);
                    steps = new ArrayList<Traverser>();
                    base = new IndexExpr(SourceRange.between(collection.getRange(), close.getRange()),
                            collection, key, bracketRange);
                }
            } else {
                return applySteps(base, steps);
            }
        }
    }

    private Traverser parseDotStep(Token dot) {
        if (parser.check(IDENTIFIER)) {
            Token name = parser.advance();
            return new Traverser.Attr(SourceRange.between(dot.getRange(), name.getRange()), name.getLexeme());
        }
        if (parser.check(NUMBER_LIT)) {
            // 旧式索引 a.0
            Token index = parser.advance();
            return new Traverser.Index(SourceRange.between(dot.getRange(), index.getRange()), index.getLiteral());
        }
        throw new ParseException("Invalid attribute name; an attribute name is required after a dot", parser.current());
    }

    /**
     * 展开之后紧跟的属性（及完全展开时的字面量索引）对每个元素生效
     */
    private Expression parseSplat(Expression source, boolean full, SourceRange markerRange) {
        List<Traverser> each = new ArrayList<Traverser>();
        SourceRange end = markerRange;
        while (true) {
            if (parser.check(DOT) && (parser.peek(1).is(IDENTIFIER) || parser.peek(1).is(NUMBER_LIT))) {
                Traverser step = parseDotStep(parser.advance());
                each.add(step);
                end = step.getRange();
            } else if (full && parser.check(LBRACKET) && isLiteralIndexAhead()) {
                Token open = parser.advance();
                Token key = parser.advance();
                Token close = parser.advance();
                Object value = key.is(NUMBER_LIT) ? key.getLiteral() : null;
                Traverser step = new Traverser.Index(SourceRange.between(open.getRange(), close.getRange()), value);
                each.add(step);
                end = step.getRange();
            } else {
                break;
            }
        }
        return new SplatExpr(SourceRange.between(source.getRange(), end), source, each, full, markerRange);
    }

    private boolean isLiteralIndexAhead() {
        return parser.peek(1).is(NUMBER_LIT) && parser.peek(2).is(RBRACKET);
    }

    private static Object literalIndexKey(Expression key) {
        if (key instanceof LiteralValueExpr) {
            LiteralValueExpr literal = (LiteralValueExpr) key;
            if (literal.getKind() == LiteralValueExpr.LiteralKind.NUMBER
                    || literal.getKind() == LiteralValueExpr.LiteralKind.STRING) {
                return literal.getValue();
            }
        }
        if (key instanceof TemplateExpr && ((TemplateExpr) key).isStringLiteral()) {
            return ((LiteralValueExpr) ((TemplateExpr) key).getParts().get(0)).getValue();
        }
        return null;
    }

    private static Expression applySteps(Expression base, List<Traverser> steps) {
        if (steps.isEmpty()) {
            return base;
        }
        SourceRange range = SourceRange.between(base.getRange(), steps.get(steps.size() - 1).getRange());
        if (base instanceof ScopeTraversalExpr) {
            ScopeTraversalExpr traversal = (ScopeTraversalExpr) base;
            List<Traverser> all = new ArrayList<Traverser>(traversal.getSteps());
            all.addAll(steps);
            return new ScopeTraversalExpr(range, traversal.getRootName(), all);
        }
        return new RelativeTraversalExpr(range, base, new ArrayList<Traverser>(steps));
    }

    // ============ 基本项 ============

    private Expression parseTerm() {
        Token token = parser.current();
        switch (token.getType()) {
            case NUMBER_LIT:
                parser.advance();
                return LiteralValueExpr.number(token.getRange(), (BigDecimal) token.getLiteral());

            case IDENTIFIER:
                return parseIdentifierTerm();

            case OQUOTE:
                return parser.templateParser.parseQuoted();

            case OHEREDOC:
                return parser.templateParser.parseHeredoc();

            case LPAREN: {
                Token open = parser.advance();
                parser.ignoreNewlines();
                Expression inner = parseExpression();
                Token close = parser.expect(RPAREN, "Unbalanced parentheses");
                parser.restoreNewlines();
                return new ParenthesesExpr(SourceRange.between(open.getRange(), close.getRange()), inner);
            }

            case LBRACKET:
                return parseTuple();

            case LBRACE:
                return parseObject();

            default:
                throw new ParseException("Invalid expression; expected the start of an expression", token);
        }
    }

    private Expression parseIdentifierTerm() {
        Token name = parser.advance();
        String text = name.getLexeme();
        if ("true".equals(text) || "false".equals(text)) {
            return LiteralValueExpr.bool(name.getRange(), Boolean.parseBoolean(text));
        }
        if ("null".equals(text)) {
            return LiteralValueExpr.nullValue(name.getRange());
        }
        if (parser.check(LPAREN)) {
            return parseFunctionCall(name);
        }
        return new ScopeTraversalExpr(name.getRange(), text, new ArrayList<Traverser>());
    }

    private Expression parseFunctionCall(Token name) {
        Token open = parser.advance();
        parser.ignoreNewlines();

        List<Expression> args = new ArrayList<Expression>();
        boolean expandFinal = false;
        while (!parser.check(RPAREN)) {
            args.add(parseExpression());
            if (parser.match(ELLIPSIS)) {
                expandFinal = true;
                parser.match(COMMA);
                if (!parser.check(RPAREN)) {
                    throw new ParseException("Missing closing parenthesis; an expanded argument must be the last argument",
                            parser.current(), "')'");
                }
                break;
            }
            if (!parser.match(COMMA)) {
                break;
            }
        }
        Token close = parser.expect(RPAREN, "Missing argument separator or closing parenthesis");
        parser.restoreNewlines();

        return new FunctionCallExpr(SourceRange.between(name.getRange(), close.getRange()), name.getLexeme(), args,
                expandFinal, name.getRange(), open.getRange());
    }

    // ============ 元组与对象 ============

    private Expression parseTuple() {
        Token open = parser.advance();
        parser.ignoreNewlines();
        try {
            if (isForAhead()) {
                return parseFor(open, false);
            }

            List<Expression> exprs = new ArrayList<Expression>();
            while (!parser.check(RBRACKET)) {
                exprs.add(parseExpression());
                if (!parser.match(COMMA)) {
                    break;
                }
            }
            Token close = parser.expect(RBRACKET, "Missing item separator or closing bracket");
            return new TupleConsExpr(SourceRange.between(open.getRange(), close.getRange()), open.getRange(), exprs);
        } finally {
            parser.restoreNewlines();
        }
    }

    private Expression parseObject() {
        Token open = parser.advance();
        parser.ignoreNewlines();
        if (isForAhead()) {
            try {
                return parseFor(open, true);
            } finally {
                parser.restoreNewlines();
            }
        }
        parser.restoreNewlines();

        parser.respectNewlines();
        try {
            List<ObjectConsExpr.Item> items = new ArrayList<ObjectConsExpr.Item>();
            while (true) {
                parser.skipNewlines();
                if (parser.check(RBRACE)) {
                    break;
                }
                Expression key = parseObjectKey();
                if (!parser.match(EQUAL) && !parser.match(COLON)) {
                    throw new ParseException("Missing key/value separator; expected an equals sign to mark the "
                            + "beginning of the attribute value", parser.current(), "'=' or ':'");
                }
                Expression value = parseExpression();
                items.add(new ObjectConsExpr.Item(key, value));

                if (parser.match(COMMA) || parser.match(NEWLINE)) {
                    continue;
                }
                if (!parser.check(RBRACE)) {
                    throw new ParseException("Missing attribute separator; expected a newline or comma to mark the "
                            + "end of the attribute", parser.current());
                }
            }
            Token close = parser.expect(RBRACE, "Unclosed object constructor");
            return new ObjectConsExpr(SourceRange.between(open.getRange(), close.getRange()), open.getRange(), items);
        } finally {
            parser.restoreNewlines();
        }
    }

    private Expression parseObjectKey() {
        boolean forceNonLiteral = parser.check(LPAREN);
        Expression key = parseExpression();
        return new ObjectConsKeyExpr(key, forceNonLiteral);
    }

    // ============ for 表达式 ============

    private boolean isForAhead() {
        return parser.checkKeyword("for") && parser.peek(1).is(IDENTIFIER);
    }

    private Expression parseFor(Token open, boolean objectForm) {
        parser.expectKeyword("for", "Invalid for expression");
        String keyVar = null;
        String valVar = parser.expect(IDENTIFIER, "Invalid for expression; an iterator variable is required")
                .getLexeme();
        if (parser.match(COMMA)) {
            keyVar = valVar;
            valVar = parser.expect(IDENTIFIER, "Invalid for expression; a value variable is required after the comma")
                    .getLexeme();
        }
        parser.expectKeyword("in", "Invalid for expression; the 'in' keyword is required after the iterator");
        Expression collExpr = parseExpression();
        parser.expect(COLON, "Invalid for expression; a colon is required after the collection");

        Expression keyExpr = null;
        Expression valExpr;
        boolean group = false;
        if (objectForm) {
            keyExpr = parseExpression();
            parser.expect(FAT_ARROW, "Invalid 'for' expression; an object 'for' expression requires the '=>' operator");
            valExpr = parseExpression();
            group = parser.match(ELLIPSIS);
        } else {
            valExpr = parseExpression();
        }

        Expression condExpr = null;
        if (parser.checkKeyword("if")) {
            parser.advance();
            condExpr = parseExpression();
        }

        TokenType closeType = objectForm ? RBRACE : RBRACKET;
        Token close = parser.expect(closeType, "Invalid 'for' expression; extra characters after the expression");
        return new ForExpr(SourceRange.between(open.getRange(), close.getRange()), open.getRange(),
                keyVar, valVar, collExpr, keyExpr, valExpr, condExpr, group);
    }
}
