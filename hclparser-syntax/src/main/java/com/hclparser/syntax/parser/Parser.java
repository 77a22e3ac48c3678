package com.hclparser.syntax.parser;

import com.hclparser.syntax.ast.*;
import com.hclparser.syntax.ast.expr.Expression;
import com.hclparser.syntax.lexer.Lexer;
import com.hclparser.syntax.lexer.Token;
import com.hclparser.syntax.lexer.TokenType;

import java.nio.charset.StandardCharsets;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static com.hclparser.syntax.lexer.TokenType.*;

/**
 * HCL 原生语法分析器（递归下降）
 *
 * <p>本类负责体、属性与块的结构；表达式与模板分别委托给 {@link ExprParser} 与 {@link TemplateParser}。</p>
 */
public class Parser {

    final String fileName;
    private final List<Token> tokens;
    private final byte[] bytes;
    private int position;

    // 换行是否被忽略：圆括号、方括号与模板序列内部为 true
    private final Deque<Boolean> newlineModes = new ArrayDeque<Boolean>();

    // === Helper 实例 ===
    final ExprParser exprParser = new ExprParser(this);
    final TemplateParser templateParser = new TemplateParser(this);

    public Parser(Lexer lexer, String fileName) {
        this(lexer, fileName, lexer.getSource().getBytes(StandardCharsets.UTF_8));
    }

    private Parser(Lexer lexer, String fileName, byte[] bytes) {
        this.fileName = fileName;
        this.tokens = lexer.scanTokens();
        this.bytes = bytes;
        this.newlineModes.push(Boolean.FALSE);
    }

    /**
     * 解析 UTF-8 编码的配置文件内容
     */
    public static ConfigFile parseConfig(byte[] bytes, String fileName) {
        String source = new String(bytes, StandardCharsets.UTF_8);
        return new Parser(new Lexer(source, fileName), fileName, bytes).parse();
    }

    /**
     * 解析整个文件
     *
     * @throws ParseException 词法或语法错误
     */
    public ConfigFile parse() {
        Body body = parseBody(EOF, SourcePos.START);
        return new ConfigFile(fileName, bytes, body);
    }

    // ============ 体、属性与块 ============

    private Body parseBody(TokenType terminator, SourcePos startPos) {
        Map<String, Attribute> attributes = new LinkedHashMap<String, Attribute>();
        List<Block> blocks = new ArrayList<Block>();

        while (true) {
            skipNewlines();
            if (check(terminator)) {
                break;
            }
            if (isAtEnd()) {
                throw new ParseException("Unclosed configuration block; there is no closing brace for this block", current());
            }
            Token name = expect(IDENTIFIER, "Argument or block definition required");
            if (check(EQUAL)) {
                Attribute attribute = parseAttribute(name, terminator);
                Attribute existing = attributes.get(attribute.getName());
                if (existing != null) {
                    throw new ParseException("Attribute redefined: the argument \"" + attribute.getName()
                            + "\" was already set at " + existing.getNameRange().getStart(), name);
                }
                attributes.put(attribute.getName(), attribute);
            } else {
                blocks.add(parseBlock(name));
            }
        }

        SourcePos endPos = current().getEnd();
        return new Body(new SourceRange(fileName, startPos, endPos), attributes, blocks);
    }

    private Attribute parseAttribute(Token name, TokenType terminator) {
        Token equals = advance();
        Expression expr = exprParser.parseExpression();

        // 单行块 a { x = 1 } 允许属性直接以 } 结束
        if (!check(NEWLINE) && !isAtEnd() && !(terminator == RBRACE && check(RBRACE))) {
            throw new ParseException("Missing newline after argument; an argument definition must end with a newline",
                    current());
        }
        return new Attribute(SourceRange.between(name.getRange(), expr.getRange()), name.getLexeme(), expr,
                name.getRange(), equals.getRange());
    }

    private Block parseBlock(Token type) {
        List<String> labels = new ArrayList<String>();
        List<SourceRange> labelRanges = new ArrayList<SourceRange>();

        while (!check(LBRACE)) {
            if (check(IDENTIFIER)) {
                Token label = advance();
                labels.add(label.getLexeme());
                labelRanges.add(label.getRange());
            } else if (check(OQUOTE)) {
                parseQuotedLabel(labels, labelRanges);
            } else if (check(EQUAL_OP) || check(COLON)) {
                throw new ParseException("Invalid argument definition; use a single equals sign to assign a value",
                        current());
            } else {
                throw new ParseException("Invalid block definition; either a quoted label or an opening brace is expected",
                        current(), "'{'");
            }
        }

        Token open = advance();
        Body body = parseBody(RBRACE, open.getStart());
        Token close = expect(RBRACE, "Unclosed configuration block");

        if (!check(NEWLINE) && !isAtEnd()) {
            throw new ParseException("Missing newline after block definition; a block definition must end with a newline",
                    current());
        }
        return new Block(SourceRange.between(type.getRange(), close.getRange()), type.getLexeme(), labels, body,
                type.getRange(), labelRanges);
    }

    private void parseQuotedLabel(List<String> labels, List<SourceRange> labelRanges) {
        Token open = advance();
        StringBuilder sb = new StringBuilder();
        while (!check(CQUOTE)) {
            if (check(QUOTED_LIT)) {
                sb.append((String) advance().getLiteral());
            } else if (check(TEMPLATE_INTERP) || check(TEMPLATE_CONTROL)) {
                throw new ParseException("Invalid block label; template sequences are not allowed in block labels",
                        current());
            } else {
                throw new ParseException("Unterminated block label", current(), "'\"'");
            }
        }
        Token close = advance();
        labels.add(sb.toString());
        labelRanges.add(SourceRange.between(open.getRange(), close.getRange()));
    }

    // ============ 基础方法 ============

    /**
     * 当前 token；忽略换行的上下文中自动跳过 NEWLINE，遇到 ERROR token 立即报错
     */
    Token current() {
        if (newlineModes.peek()) {
            while (tokens.get(position).is(NEWLINE)) {
                position++;
            }
        }
        Token token = tokens.get(position);
        if (token.is(ERROR)) {
            throw new ParseException((String) token.getLiteral(), token);
        }
        return token;
    }

    /**
     * 向后查看第 n 个 token（n = 0 即当前）
     */
    Token peek(int n) {
        current();
        int index = position;
        boolean ignoreNewlines = newlineModes.peek();
        for (int i = 0; i < n && index < tokens.size() - 1; i++) {
            index++;
            while (ignoreNewlines && index < tokens.size() - 1 && tokens.get(index).is(NEWLINE)) {
                index++;
            }
        }
        return tokens.get(index);
    }

    /**
     * 前进到下一个 token，返回被消费的 token
     */
    Token advance() {
        Token token = current();
        if (!token.is(EOF)) {
            position++;
        }
        return token;
    }

    boolean check(TokenType type) {
        return current().getType() == type;
    }

    /** 当前 token 是否为给定文本的标识符（HCL 的关键字都是上下文相关的标识符） */
    boolean checkKeyword(String keyword) {
        Token token = current();
        return token.is(IDENTIFIER) && token.getLexeme().equals(keyword);
    }

    boolean match(TokenType type) {
        if (check(type)) {
            advance();
            return true;
        }
        return false;
    }

    Token expect(TokenType type, String message) {
        if (check(type)) {
            return advance();
        }
        throw new ParseException(message, current(), type.name());
    }

    Token expectKeyword(String keyword, String message) {
        if (checkKeyword(keyword)) {
            return advance();
        }
        throw new ParseException(message, current(), "'" + keyword + "'");
    }

    boolean isAtEnd() {
        return check(EOF);
    }

    void skipNewlines() {
        while (match(NEWLINE)) {
            // 跳过
        }
    }

    /** 进入括号或模板序列：其中的换行不再有意义 */
    void ignoreNewlines() {
        newlineModes.push(Boolean.TRUE);
    }

    /** 进入对象构造：换行重新作为分隔符 */
    void respectNewlines() {
        newlineModes.push(Boolean.FALSE);
    }

    void restoreNewlines() {
        newlineModes.pop();
    }
}
