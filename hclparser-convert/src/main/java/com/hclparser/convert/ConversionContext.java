package com.hclparser.convert;

/**
 * 单次转换的不可变上下文：文件名与源码
 */
final class ConversionContext {
    private final String fileName;
    private final SourceExtractor extractor;

    ConversionContext(String fileName, byte[] bytes) {
        this.fileName = fileName;
        this.extractor = new SourceExtractor(bytes);
    }

    String getFileName() {
        return fileName;
    }

    SourceExtractor getExtractor() {
        return extractor;
    }
}
