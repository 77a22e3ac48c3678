package com.hclparser.syntax.ast.expr;

import com.hclparser.syntax.ast.Node;
import com.hclparser.syntax.ast.SourceRange;

/**
 * 表达式基类
 */
public abstract class Expression extends Node {

    protected Expression(SourceRange range) {
        super(range);
    }

    /**
     * 表达式起始部分的区间，用于定位诊断信息。
     * 默认与完整区间相同，复合表达式返回其最左侧组成部分的区间。
     */
    public SourceRange getStartRange() {
        return range;
    }
}
