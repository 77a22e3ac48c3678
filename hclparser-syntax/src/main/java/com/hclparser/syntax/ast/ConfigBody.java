package com.hclparser.syntax.ast;

/**
 * 配置文件根体
 *
 * <p>原生语法解析得到 {@link Body}；其它实现（例如 JSON 语法）由调用方自行提供。</p>
 */
public interface ConfigBody {

    SourceRange getRange();
}
