package com.hclparser.syntax.ast;

/**
 * 已解析的配置文件：原始字节与根体
 */
public final class ConfigFile {
    private final String fileName;
    private final byte[] bytes;
    private final ConfigBody body;

    public ConfigFile(String fileName, byte[] bytes, ConfigBody body) {
        this.fileName = fileName;
        this.bytes = bytes;
        this.body = body;
    }

    public String getFileName() {
        return fileName;
    }

    /** 源码的 UTF-8 字节，所有区间的字节偏移都指向这里 */
    public byte[] getBytes() {
        return bytes;
    }

    public ConfigBody getBody() {
        return body;
    }
}
