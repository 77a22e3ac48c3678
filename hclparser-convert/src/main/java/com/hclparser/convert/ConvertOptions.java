package com.hclparser.convert;

/**
 * 转换选项
 */
public class ConvertOptions {

    // 尽可能求值而不是输出 ${...} 标记；保留选项，当前转换规则不使用
    private boolean simplify = false;

    public ConvertOptions() {
    }

    public static ConvertOptions defaults() {
        return new ConvertOptions();
    }

    public boolean isSimplify() {
        return simplify;
    }

    public ConvertOptions setSimplify(boolean simplify) {
        this.simplify = simplify;
        return this;
    }

    @Override
    public String toString() {
        return "ConvertOptions{simplify=" + simplify + "}";
    }
}
