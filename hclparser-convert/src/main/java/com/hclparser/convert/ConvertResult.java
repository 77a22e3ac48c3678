package com.hclparser.convert;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;

/**
 * 转换结果：值树与行信息树
 */
public final class ConvertResult {
    private static final Gson GSON = new GsonBuilder()
            .serializeNulls()
            .disableHtmlEscaping()
            .create();
    private static final Gson PRETTY_GSON = new GsonBuilder()
            .serializeNulls()
            .disableHtmlEscaping()
            .setPrettyPrinting()
            .create();

    private final ValueNode.Mapping values;
    private final LineNode.Mapping lines;

    ConvertResult(ValueNode.Mapping values, LineNode.Mapping lines) {
        this.values = values;
        this.lines = lines;
    }

    public ValueNode.Mapping getValues() {
        return values;
    }

    public LineNode.Mapping getLines() {
        return lines;
    }

    public String toValueJson() {
        return GSON.toJson(values.toJson());
    }

    public String toLineJson() {
        return GSON.toJson(lines.toJson());
    }

    public String toValueJson(boolean pretty) {
        return pretty ? PRETTY_GSON.toJson(values.toJson()) : toValueJson();
    }

    public String toLineJson(boolean pretty) {
        return pretty ? PRETTY_GSON.toJson(lines.toJson()) : toLineJson();
    }
}
