package com.hclparser.convert;

import com.hclparser.syntax.ast.Body;
import com.hclparser.syntax.ast.ConfigFile;
import com.hclparser.syntax.parser.ParseException;
import com.hclparser.syntax.parser.Parser;

import java.util.logging.Logger;

/**
 * HCL 配置到 JSON 值树与行信息树的转换入口
 *
 * <p>转换器不保存任何可变状态，可以复用或在线程间共享。
 * 失败时抛出 {@link ConversionException}，消息带有逐层上下文，不返回部分结果。</p>
 */
public class HclConverter {
    private static final Logger LOG = Logger.getLogger(HclConverter.class.getName());

    /**
     * 解析并转换源码
     *
     * @param bytes    UTF-8 源码
     * @param fileName 文件名，用于位置与错误信息
     * @param options  转换选项，为 null 时使用默认值
     */
    public ConvertResult convert(byte[] bytes, String fileName, ConvertOptions options) {
        ConfigFile file;
        try {
            file = Parser.parseConfig(bytes, fileName);
        } catch (ParseException e) {
            throw new ConversionException(ConversionException.Kind.PARSE, "parse config: " + e.getMessage(), e);
        }
        try {
            return convertFile(file, options);
        } catch (ConversionException e) {
            throw e.withContext("convert file");
        }
    }

    /**
     * 转换已解析的配置文件
     */
    public ConvertResult convertFile(ConfigFile file, ConvertOptions options) {
        if (!(file.getBody() instanceof Body)) {
            throw new ConversionException(ConversionException.Kind.STRUCTURE,
                    "convert file body to body type");
        }
        ConvertOptions effective = options != null ? options : ConvertOptions.defaults();
        ConversionContext context = new ConversionContext(file.getFileName(), file.getBytes());

        Converted converted;
        try {
            converted = new BodyConverter(context).convert((Body) file.getBody());
        } catch (ConversionException e) {
            throw e.withContext("convert body");
        }

        ValueNode.Mapping values = (ValueNode.Mapping) converted.getValue();
        LOG.fine("Converted " + file.getFileName() + " with " + effective + ": "
                + values.size() + " top-level entries");
        return new ConvertResult(values, (LineNode.Mapping) converted.getLine());
    }
}
