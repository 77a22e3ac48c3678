package com.hclparser.syntax.ast;

import com.hclparser.syntax.ast.expr.*;

/**
 * 语法树访问者接口
 *
 * <p>所有方法提供默认实现（返回 null），实现类只需覆盖感兴趣的节点类型。</p>
 */
public interface AstVisitor<R, C> {

    // ============ 结构 ============

    default R visitBody(Body node, C ctx) { return null; }

    default R visitAttribute(Attribute node, C ctx) { return null; }

    default R visitBlock(Block node, C ctx) { return null; }

    // ============ 字面量与模板 ============

    default R visitLiteralValueExpr(LiteralValueExpr node, C ctx) { return null; }

    default R visitTemplateExpr(TemplateExpr node, C ctx) { return null; }

    default R visitTemplateWrapExpr(TemplateWrapExpr node, C ctx) { return null; }

    default R visitTemplateJoinExpr(TemplateJoinExpr node, C ctx) { return null; }

    // ============ 集合构造 ============

    default R visitTupleConsExpr(TupleConsExpr node, C ctx) { return null; }

    default R visitObjectConsExpr(ObjectConsExpr node, C ctx) { return null; }

    default R visitObjectConsKeyExpr(ObjectConsKeyExpr node, C ctx) { return null; }

    default R visitForExpr(ForExpr node, C ctx) { return null; }

    // ============ 引用与调用 ============

    default R visitScopeTraversalExpr(ScopeTraversalExpr node, C ctx) { return null; }

    default R visitRelativeTraversalExpr(RelativeTraversalExpr node, C ctx) { return null; }

    default R visitIndexExpr(IndexExpr node, C ctx) { return null; }

    default R visitSplatExpr(SplatExpr node, C ctx) { return null; }

    default R visitFunctionCallExpr(FunctionCallExpr node, C ctx) { return null; }

    // ============ 运算 ============

    default R visitConditionalExpr(ConditionalExpr node, C ctx) { return null; }

    default R visitBinaryOpExpr(BinaryOpExpr node, C ctx) { return null; }

    default R visitUnaryOpExpr(UnaryOpExpr node, C ctx) { return null; }

    default R visitParenthesesExpr(ParenthesesExpr node, C ctx) { return null; }
}
