package com.hclparser.syntax.lexer;

/**
 * HCL 原生语法词法单元类型
 */
public enum TokenType {
    // === 字面量 ===
    NUMBER_LIT,
    IDENTIFIER,

    // === 模板 ===
    OQUOTE,             // "  (开引号)
    CQUOTE,             // "  (闭引号)
    OHEREDOC,           // <<EOT / <<-EOT
    CHEREDOC,           // 结束标记行
    QUOTED_LIT,         // 引号模板中的字面量片段
    STRING_LIT,         // heredoc 中的字面量片段（按行切分）
    TEMPLATE_INTERP,    // ${
    TEMPLATE_CONTROL,   // %{
    TEMPLATE_SEQ_END,   // 模板序列的闭合 }

    // === 操作符 - 算术 ===
    PLUS,           // +
    MINUS,          // -
    STAR,           // *
    SLASH,          // /
    PERCENT,        // %

    // === 操作符 - 比较 ===
    EQUAL_OP,       // ==
    NOT_EQUAL,      // !=
    LT,             // <
    GT,             // >
    LTE,            // <=
    GTE,            // >=

    // === 操作符 - 逻辑 ===
    AND,            // &&
    OR,             // ||
    BANG,           // !

    // === 操作符 - 特殊 ===
    EQUAL,          // =
    COLON,          // :
    QUESTION,       // ?
    FAT_ARROW,      // =>
    ELLIPSIS,       // ...
    TILDE,          // ~ (模板去空白标记)

    // === 分隔符 ===
    LPAREN,         // (
    RPAREN,         // )
    LBRACE,         // {
    RBRACE,         // }
    LBRACKET,       // [
    RBRACKET,       // ]
    COMMA,          // ,
    DOT,            // .

    // === 特殊 ===
    NEWLINE,
    EOF,
    ERROR;

    /**
     * 是否为模板字面量片段
     */
    public boolean isTemplateLiteral() {
        return this == QUOTED_LIT || this == STRING_LIT;
    }

    /**
     * 是否为二元操作符
     */
    public boolean isBinaryOp() {
        switch (this) {
            case PLUS:
            case MINUS:
            case STAR:
            case SLASH:
            case PERCENT:
            case EQUAL_OP:
            case NOT_EQUAL:
            case LT:
            case GT:
            case LTE:
            case GTE:
            case AND:
            case OR:
                return true;
            default:
                return false;
        }
    }
}
