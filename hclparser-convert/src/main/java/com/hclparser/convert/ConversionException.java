package com.hclparser.convert;

/**
 * 转换失败
 *
 * <p>每一层递归通过 {@link #withContext(String)} 追加上下文，消息形如
 * {@code convert body: convert block: convert body: convert expression: ...}。</p>
 */
public class ConversionException extends RuntimeException {

    /**
     * 错误类别
     */
    public enum Kind {
        /** 源码无法解析 */
        PARSE,
        /** 根体类型不符，或块标签路径与已有的非对象条目冲突 */
        STRUCTURE,
        /** 常量无法转换为字符串 */
        VALUE_CONVERSION
    }

    private final Kind kind;

    public ConversionException(Kind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public ConversionException(Kind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public Kind getKind() {
        return kind;
    }

    /**
     * 返回带有外层上下文前缀的新异常，保留类别与根因
     */
    public ConversionException withContext(String context) {
        ConversionException wrapped = new ConversionException(kind, context + ": " + getMessage(), getCause());
        wrapped.setStackTrace(getStackTrace());
        return wrapped;
    }
}
