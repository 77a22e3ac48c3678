package com.hclparser.syntax.lexer;

import com.hclparser.syntax.ast.SourcePos;
import com.hclparser.syntax.ast.SourceRange;

import java.math.BigDecimal;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.logging.Logger;

/**
 * HCL 原生语法词法分析器
 *
 * <p>通过模式栈区分表达式、引号模板与 heredoc 模板三种扫描状态。
 * 模板中的 {@code ${} / {@code %{} 会压入一个表达式模式，遇到与之配对的 {@code }} 时弹出。</p>
 */
public class Lexer {
    private static final Logger LOG = Logger.getLogger(Lexer.class.getName());

    private final String source;
    private final String fileName;
    private final List<Token> tokens = new ArrayList<>();
    private final Deque<Mode> modes = new ArrayDeque<>();

    // 当前 token 起点
    private int start = 0;
    private int startLine = 1;
    private int startColumn = 1;
    private int startByte = 0;

    // 扫描游标
    private int current = 0;
    private int line = 1;
    private int column = 1;
    private int byteOffset = 0;

    public Lexer(String source, String fileName) {
        this.source = source;
        this.fileName = fileName;
        this.modes.push(Mode.expression(false));
    }

    public Lexer(String source) {
        this(source, "<input>");
    }

    public String getFileName() {
        return fileName;
    }

    public String getSource() {
        return source;
    }

    /**
     * 执行词法分析，返回以 EOF 结尾的 Token 列表
     */
    public List<Token> scanTokens() {
        while (!isAtEnd()) {
            markStart();
            Mode mode = modes.peek();
            switch (mode.kind) {
                case QUOTED:
                    scanQuotedToken();
                    break;
                case HEREDOC:
                    scanHeredocToken(mode);
                    break;
                default:
                    scanExpressionToken(mode);
                    break;
            }
        }

        markStart();
        if (modes.size() > 1) {
            Mode mode = modes.peek();
            switch (mode.kind) {
                case QUOTED:
                    error("Unterminated template string");
                    break;
                case HEREDOC:
                    error("Unterminated heredoc, missing closing marker " + mode.marker);
                    break;
                default:
                    error("Unterminated template sequence");
                    break;
            }
        }
        addToken(TokenType.EOF);
        return tokens;
    }

    // === 表达式模式 ===

    private void scanExpressionToken(Mode mode) {
        char c = advance();
        switch (c) {
            case '(': addToken(TokenType.LPAREN); break;
            case ')': addToken(TokenType.RPAREN); break;
            case '[': addToken(TokenType.LBRACKET); break;
            case ']': addToken(TokenType.RBRACKET); break;
            case ',': addToken(TokenType.COMMA); break;
            case ':': addToken(TokenType.COLON); break;
            case '?': addToken(TokenType.QUESTION); break;
            case '+': addToken(TokenType.PLUS); break;
            case '-': addToken(TokenType.MINUS); break;
            case '*': addToken(TokenType.STAR); break;
            case '%': addToken(TokenType.PERCENT); break;
            case '~': addToken(TokenType.TILDE); break;

            case '{':
                mode.braceDepth++;
                addToken(TokenType.LBRACE);
                break;

            case '}':
                if (mode.braceDepth > 0) {
                    mode.braceDepth--;
                    addToken(TokenType.RBRACE);
                } else if (mode.sequence) {
                    modes.pop();
                    addToken(TokenType.TEMPLATE_SEQ_END);
                } else {
                    addToken(TokenType.RBRACE);
                }
                break;

            case '.':
                if (peek() == '.' && peekNext() == '.') {
                    advance();
                    advance();
                    addToken(TokenType.ELLIPSIS);
                } else {
                    addToken(TokenType.DOT);
                }
                break;

            case '=':
                if (match('=')) addToken(TokenType.EQUAL_OP);
                else if (match('>')) addToken(TokenType.FAT_ARROW);
                else addToken(TokenType.EQUAL);
                break;

            case '!':
                addToken(match('=') ? TokenType.NOT_EQUAL : TokenType.BANG);
                break;

            case '>':
                addToken(match('=') ? TokenType.GTE : TokenType.GT);
                break;

            case '<':
                if (peek() == '<' && isHeredocStart()) {
                    heredoc();
                } else {
                    addToken(match('=') ? TokenType.LTE : TokenType.LT);
                }
                break;

            case '&':
                if (match('&')) {
                    addToken(TokenType.AND);
                } else {
                    error("Unexpected character '&'. Did you mean '&&'?");
                }
                break;

            case '|':
                if (match('|')) {
                    addToken(TokenType.OR);
                } else {
                    error("Unexpected character '|'. Did you mean '||'?");
                }
                break;

            case '#':
                while (peek() != '\n' && !isAtEnd()) advance();
                break;

            case '/':
                if (match('/')) {
                    while (peek() != '\n' && !isAtEnd()) advance();
                } else if (match('*')) {
                    blockComment();
                } else {
                    addToken(TokenType.SLASH);
                }
                break;

            case '"':
                addToken(TokenType.OQUOTE);
                modes.push(Mode.quoted());
                break;

            // 空白字符
            case ' ':
            case '\r':
            case '\t':
                break;

            case '\n':
                addToken(TokenType.NEWLINE);
                break;

            default:
                if (isDigit(c)) {
                    number();
                } else if (isIdentifierStart(c)) {
                    identifier();
                } else {
                    error("Unexpected character: " + source.substring(start, current));
                }
                break;
        }
    }

    private void blockComment() {
        while (!isAtEnd()) {
            if (peek() == '*' && peekNext() == '/') {
                advance();
                advance();
                return;
            }
            advance();
        }
        error("Unterminated block comment");
    }

    private void identifier() {
        while (isIdentifierPart(peek())) advance();
        addToken(TokenType.IDENTIFIER);
    }

    private void number() {
        advanceDigits();

        // 旧式索引 a.0.1 中，点号之后只取整数部分
        boolean afterDot = !tokens.isEmpty() && tokens.get(tokens.size() - 1).is(TokenType.DOT);
        if (!afterDot) {
            if (peek() == '.' && isDigit(peekNext())) {
                advance();
                advanceDigits();
            }
            if (peek() == 'e' || peek() == 'E') {
                char next = peekNext();
                if (isDigit(next) || ((next == '+' || next == '-') && isDigit(peekAt(2)))) {
                    advance();
                    if (peek() == '+' || peek() == '-') advance();
                    advanceDigits();
                }
            }
        }
        addToken(TokenType.NUMBER_LIT, new BigDecimal(source.substring(start, current)));
    }

    private void advanceDigits() {
        while (isDigit(peek())) advance();
    }

    private boolean isHeredocStart() {
        char next = peekNext();
        if (next == '-') {
            return isIdentifierStart(peekAt(2));
        }
        return isIdentifierStart(next);
    }

    private void heredoc() {
        advance(); // 第二个 <
        match('-'); // <<- 缩进形式，由解析器处理
        int markerStart = current;
        while (isIdentifierPart(peek())) advance();
        String marker = source.substring(markerStart, current);

        if (peek() == '\r' && peekNext() == '\n') advance();
        if (!match('\n')) {
            error("Invalid heredoc introducer: the marker must be followed immediately by a newline");
            return;
        }
        addToken(TokenType.OHEREDOC, marker);
        modes.push(Mode.heredoc(marker));
    }

    // === 引号模板模式 ===

    private void scanQuotedToken() {
        char c = peek();
        if (c == '"') {
            advance();
            modes.pop();
            addToken(TokenType.CQUOTE);
        } else if (c == '\n' || (c == '\r' && peekNext() == '\n')) {
            modes.pop();
            error("Unterminated template string: quoted strings may not be split over multiple lines; "
                    + "use the \\n escape or a heredoc instead");
            advance();
        } else if (!templateSequenceStart()) {
            quotedLiteral();
        }
    }

    private void quotedLiteral() {
        StringBuilder sb = new StringBuilder();
        while (!isAtEnd()) {
            char c = peek();
            if (c == '"' || c == '\n' || (c == '\r' && peekNext() == '\n')) break;
            if ((c == '$' || c == '%') && peekNext() == '{') break;
            if (escapedSequenceStart(c)) {
                advance();
                advance();
                advance();
                sb.append(c).append('{');
                continue;
            }
            if (c == '\\') {
                advance();
                if (!escape(sb)) return;
                continue;
            }
            int i = current;
            advance();
            sb.append(source, i, current);
        }
        addToken(TokenType.QUOTED_LIT, sb.toString());
    }

    private boolean escape(StringBuilder sb) {
        if (isAtEnd()) {
            error("Unterminated escape sequence");
            return false;
        }
        char e = advance();
        switch (e) {
            case 'n': sb.append('\n'); return true;
            case 'r': sb.append('\r'); return true;
            case 't': sb.append('\t'); return true;
            case '"': sb.append('"'); return true;
            case '\\': sb.append('\\'); return true;
            case 'u': return unicodeEscape(sb, 4);
            case 'U': return unicodeEscape(sb, 8);
            default:
                error("Invalid escape sequence: \\" + e);
                return false;
        }
    }

    private boolean unicodeEscape(StringBuilder sb, int digits) {
        int hexStart = current;
        for (int i = 0; i < digits; i++) {
            if (!isHexDigit(peek())) {
                error("Invalid unicode escape: expected " + digits + " hex digits");
                return false;
            }
            advance();
        }
        int codePoint = (int) Long.parseLong(source.substring(hexStart, current), 16);
        if (!Character.isValidCodePoint(codePoint)) {
            error("Invalid unicode escape: code point out of range");
            return false;
        }
        sb.appendCodePoint(codePoint);
        return true;
    }

    // === heredoc 模板模式 ===

    private void scanHeredocToken(Mode mode) {
        if (column == 1 && closingMarker(mode)) {
            return;
        }
        if (!templateSequenceStart()) {
            heredocLiteral();
        }
    }

    /** 行首（允许缩进）恰为结束标记时生成 CHEREDOC */
    private boolean closingMarker(Mode mode) {
        int i = current;
        while (i < source.length() && (source.charAt(i) == ' ' || source.charAt(i) == '\t')) i++;
        if (!source.startsWith(mode.marker, i)) {
            return false;
        }
        int end = i + mode.marker.length();
        if (end < source.length() && source.charAt(end) != '\n' && source.charAt(end) != '\r') {
            return false;
        }
        while (current < end) advance();
        modes.pop();
        addToken(TokenType.CHEREDOC);
        return true;
    }

    /** 每个 STRING_LIT 最多延伸到本行换行符（含） */
    private void heredocLiteral() {
        StringBuilder sb = new StringBuilder();
        while (!isAtEnd()) {
            char c = peek();
            if ((c == '$' || c == '%') && peekNext() == '{') break;
            if (escapedSequenceStart(c)) {
                advance();
                advance();
                advance();
                sb.append(c).append('{');
                continue;
            }
            int i = current;
            advance();
            sb.append(source, i, current);
            if (c == '\n') break;
        }
        addToken(TokenType.STRING_LIT, sb.toString());
    }

    // === 模板公共 ===

    private boolean templateSequenceStart() {
        char c = peek();
        if ((c == '$' || c == '%') && peekNext() == '{') {
            advance();
            advance();
            addToken(c == '$' ? TokenType.TEMPLATE_INTERP : TokenType.TEMPLATE_CONTROL);
            modes.push(Mode.expression(true));
            return true;
        }
        return false;
    }

    /** $${ 与 %%{ 表示字面的 ${ 和 %{ */
    private boolean escapedSequenceStart(char c) {
        return (c == '$' || c == '%') && peekNext() == c && peekAt(2) == '{';
    }

    // === 辅助方法 ===

    private boolean isAtEnd() {
        return current >= source.length();
    }

    /** 前进一个码点，同步维护行、列与 UTF-8 字节偏移 */
    private char advance() {
        char c = source.charAt(current++);
        if (Character.isHighSurrogate(c) && current < source.length()
                && Character.isLowSurrogate(source.charAt(current))) {
            current++;
            byteOffset += 4;
            column++;
            return c;
        }
        byteOffset += utf8Length(c);
        if (c == '\n') {
            line++;
            column = 1;
        } else {
            column++;
        }
        return c;
    }

    private boolean match(char expected) {
        if (isAtEnd() || source.charAt(current) != expected) return false;
        advance();
        return true;
    }

    private char peek() {
        return peekAt(0);
    }

    private char peekNext() {
        return peekAt(1);
    }

    private char peekAt(int offset) {
        int index = current + offset;
        if (index >= source.length()) return '\0';
        return source.charAt(index);
    }

    private void markStart() {
        start = current;
        startLine = line;
        startColumn = column;
        startByte = byteOffset;
    }

    private static int utf8Length(char c) {
        if (c < 0x80) return 1;
        if (c < 0x800) return 2;
        return 3;
    }

    private static boolean isDigit(char c) {
        return c >= '0' && c <= '9';
    }

    private static boolean isHexDigit(char c) {
        return isDigit(c) || (c >= 'a' && c <= 'f') || (c >= 'A' && c <= 'F');
    }

    private static boolean isIdentifierStart(char c) {
        return c == '_' || Character.isLetter(c);
    }

    private static boolean isIdentifierPart(char c) {
        return c == '_' || c == '-' || Character.isLetterOrDigit(c);
    }

    private void addToken(TokenType type) {
        addToken(type, null);
    }

    private void addToken(TokenType type, Object literal) {
        String lexeme = source.substring(start, current);
        SourceRange range = new SourceRange(fileName,
                new SourcePos(startLine, startColumn, startByte),
                new SourcePos(line, column, byteOffset));
        tokens.add(new Token(type, lexeme, literal, range));
    }

    private void error(String message) {
        LOG.fine(String.format("[%s:%d:%d] Lexer error: %s", fileName, startLine, startColumn, message));
        addToken(TokenType.ERROR, message);
    }

    /**
     * 扫描模式
     */
    private enum ModeKind {
        EXPRESSION,
        QUOTED,
        HEREDOC
    }

    private static final class Mode {
        final ModeKind kind;
        /** 表达式模式是否由 ${ / %{ 开启 */
        final boolean sequence;
        final String marker;
        int braceDepth;

        private Mode(ModeKind kind, boolean sequence, String marker) {
            this.kind = kind;
            this.sequence = sequence;
            this.marker = marker;
        }

        static Mode expression(boolean sequence) {
            return new Mode(ModeKind.EXPRESSION, sequence, null);
        }

        static Mode quoted() {
            return new Mode(ModeKind.QUOTED, false, null);
        }

        static Mode heredoc(String marker) {
            return new Mode(ModeKind.HEREDOC, false, marker);
        }
    }
}
