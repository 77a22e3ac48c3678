package com.hclparser.syntax.parser;

import com.hclparser.syntax.ast.*;
import com.hclparser.syntax.ast.expr.*;
import com.hclparser.syntax.lexer.Lexer;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Parser 单元测试
 */
class ParserTest {

    private Body parse(String source) {
        Lexer lexer = new Lexer(source, "<test>");
        Parser parser = new Parser(lexer, "<test>");
        return (Body) parser.parse().getBody();
    }

    /** 解析单个属性 x = ... 的表达式 */
    private Expression expr(String source) {
        return parse("x = " + source + "\n").getAttributes().get("x").getExpr();
    }

    // ============ 体结构 ============

    @Nested
    @DisplayName("属性与块")
    class BodyTests {

        @Test
        @DisplayName("属性按源码顺序保存")
        void testAttributeOrder() {
            Body body = parse("b = 1\na = 2\nc = 3\n");
            assertEquals(List.of("b", "a", "c"), new ArrayList<>(body.getAttributes().keySet()));
        }

        @Test
        @DisplayName("属性名区间")
        void testAttributeNameRange() {
            Attribute attr = parse("  name = 1").getAttributes().get("name");
            assertEquals(1, attr.getNameRange().getStart().getLine());
            assertEquals(3, attr.getNameRange().getStart().getColumn());
            assertEquals(7, attr.getNameRange().getEnd().getColumn());
            assertEquals(8, attr.getEqualsRange().getStart().getColumn());
            assertEquals(9, attr.getEqualsRange().getEnd().getColumn());
        }

        @Test
        @DisplayName("带引号与不带引号的标签")
        void testBlockLabels() {
            Block block = parse("resource \"aws_instance\" web {\n  ami = \"abc\"\n}\n").getBlocks().get(0);
            assertEquals("resource", block.getType());
            assertEquals(List.of("aws_instance", "web"), block.getLabels());
            assertEquals(1, block.getBody().getAttributes().size());
            assertEquals(1, block.getTypeRange().getStart().getColumn());
            assertEquals(9, block.getTypeRange().getEnd().getColumn());
            // 带引号的标签区间包含引号
            List<SourceRange> labelRanges = block.getLabelRanges();
            assertEquals(10, labelRanges.get(0).getStart().getColumn());
            assertEquals(24, labelRanges.get(0).getEnd().getColumn());
            assertEquals(25, labelRanges.get(1).getStart().getColumn());
            assertEquals(28, labelRanges.get(1).getEnd().getColumn());
        }

        @Test
        @DisplayName("块体区间从左花括号到右花括号")
        void testBlockBodyRange() {
            Block block = parse("a {\n  x = 1\n}\n").getBlocks().get(0);
            SourceRange range = block.getBody().getRange();
            assertEquals(1, range.getStart().getLine());
            assertEquals(3, range.getStart().getColumn());
            assertEquals(3, range.getEnd().getLine());
            assertEquals(2, range.getEnd().getColumn());
        }

        @Test
        @DisplayName("单行块")
        void testSingleLineBlock() {
            Body body = parse("a { x = 1 }\nb {}\n");
            assertEquals(2, body.getBlocks().size());
            assertTrue(body.getBlocks().get(0).getBody().getAttributes().containsKey("x"));
            assertTrue(body.getBlocks().get(1).getBody().getAttributes().isEmpty());
        }

        @Test
        @DisplayName("嵌套块")
        void testNestedBlocks() {
            Body body = parse("outer {\n  inner \"x\" {\n    y = true\n  }\n}\n");
            Block inner = body.getBlocks().get(0).getBody().getBlocks().get(0);
            assertEquals("inner", inner.getType());
            assertEquals(List.of("x"), inner.getLabels());
        }

        @Test
        @DisplayName("重复属性报错")
        void testDuplicateAttribute() {
            ParseException e = assertThrows(ParseException.class, () -> parse("a = 1\na = 2\n"));
            assertTrue(e.getMessage().contains("Attribute redefined"));
        }

        @Test
        @DisplayName("标签中不允许模板序列")
        void testTemplateLabel() {
            assertThrows(ParseException.class, () -> parse("a \"${b}\" {\n}\n"));
        }

        @Test
        @DisplayName("未闭合的块")
        void testUnclosedBlock() {
            assertThrows(ParseException.class, () -> parse("a {\n  x = 1\n"));
        }

        @Test
        @DisplayName("右花括号之后必须换行")
        void testBlockNeedsNewline() {
            assertThrows(ParseException.class, () -> parse("a {} b {}\n"));
        }

        @Test
        @DisplayName("词法错误转为 ParseException 并带有位置")
        void testLexicalError() {
            ParseException e = assertThrows(ParseException.class, () -> parse("x = a & b\n"));
            assertTrue(e.getMessage().startsWith("<test>:1,7"));
        }

        @Test
        @DisplayName("parseConfig 保留原始字节")
        void testParseConfigBytes() {
            byte[] bytes = "a = 1\n".getBytes(StandardCharsets.UTF_8);
            ConfigFile file = Parser.parseConfig(bytes, "main.tf");
            assertSame(bytes, file.getBytes());
            assertEquals("main.tf", file.getFileName());
            assertEquals("main.tf", file.getBody().getRange().getFileName());
        }
    }

    // ============ 表达式 ============

    @Nested
    @DisplayName("表达式")
    class ExpressionTests {

        @Test
        @DisplayName("字面量")
        void testLiterals() {
            assertEquals(new BigDecimal("1.5"), ((LiteralValueExpr) expr("1.5")).getValue());
            assertEquals(Boolean.TRUE, ((LiteralValueExpr) expr("true")).getValue());
            LiteralValueExpr nul = (LiteralValueExpr) expr("null");
            assertEquals(LiteralValueExpr.LiteralKind.NULL, nul.getKind());
            assertNull(nul.getValue());
        }

        @Test
        @DisplayName("运算符优先级：乘法高于加法，比较低于算术")
        void testPrecedence() {
            BinaryOpExpr cmp = (BinaryOpExpr) expr("1 + 2 * 3 > 4");
            assertEquals(BinaryOpExpr.BinaryOp.GT, cmp.getOperator());
            BinaryOpExpr add = (BinaryOpExpr) cmp.getLeft();
            assertEquals(BinaryOpExpr.BinaryOp.ADD, add.getOperator());
            assertEquals(BinaryOpExpr.BinaryOp.MUL, ((BinaryOpExpr) add.getRight()).getOperator());
        }

        @Test
        @DisplayName("逻辑运算：&& 高于 ||")
        void testLogicalPrecedence() {
            BinaryOpExpr or = (BinaryOpExpr) expr("a || b && c");
            assertEquals(BinaryOpExpr.BinaryOp.OR, or.getOperator());
            assertEquals(BinaryOpExpr.BinaryOp.AND, ((BinaryOpExpr) or.getRight()).getOperator());
        }

        @Test
        @DisplayName("条件表达式的起始区间是条件的起始区间")
        void testConditional() {
            ConditionalExpr cond = (ConditionalExpr) expr("a ? 1 : 2");
            assertTrue(cond.getCondition() instanceof ScopeTraversalExpr);
            assertEquals(cond.getCondition().getStartRange(), cond.getStartRange());
        }

        @Test
        @DisplayName("负数是一元表达式，起始区间为运算符")
        void testUnaryMinus() {
            UnaryOpExpr neg = (UnaryOpExpr) expr("-1");
            assertEquals(UnaryOpExpr.UnaryOp.NEGATE, neg.getOperator());
            assertEquals(5, neg.getStartRange().getStart().getColumn());
            assertEquals(6, neg.getStartRange().getEnd().getColumn());
        }

        @Test
        @DisplayName("作用域遍历：属性、字面量索引与旧式索引")
        void testScopeTraversal() {
            ScopeTraversalExpr t = (ScopeTraversalExpr) expr("var.list[0].name.1");
            assertEquals("var", t.getRootName());
            assertEquals(4, t.getSteps().size());
            assertEquals("list", ((Traverser.Attr) t.getSteps().get(0)).getName());
            assertEquals(new BigDecimal("0"), ((Traverser.Index) t.getSteps().get(1)).getKey());
            assertEquals(new BigDecimal("1"), ((Traverser.Index) t.getSteps().get(3)).getKey());
        }

        @Test
        @DisplayName("非字面量键产生 IndexExpr")
        void testIndexExpr() {
            Expression e = expr("a[b].c");
            assertTrue(e instanceof RelativeTraversalExpr);
            IndexExpr index = (IndexExpr) ((RelativeTraversalExpr) e).getSource();
            assertEquals("a", ((ScopeTraversalExpr) index.getCollection()).getRootName());
            assertEquals(6, index.getStartRange().getStart().getColumn());
        }

        @Test
        @DisplayName("属性展开与完全展开")
        void testSplat() {
            SplatExpr attr = (SplatExpr) expr("list.*.id");
            assertFalse(attr.isFull());
            assertEquals(1, attr.getEach().size());

            SplatExpr full = (SplatExpr) expr("list[*].id");
            assertTrue(full.isFull());
            assertEquals("id", ((Traverser.Attr) full.getEach().get(0)).getName());
        }

        @Test
        @DisplayName("函数调用：参数、展开与跨行")
        void testFunctionCall() {
            FunctionCallExpr call = (FunctionCallExpr) expr("max(\n  1,\n  xs...\n)");
            assertEquals("max", call.getName());
            assertEquals(2, call.getArgs().size());
            assertTrue(call.isExpandFinal());
            SourceRange start = call.getStartRange();
            assertEquals(5, start.getStart().getColumn());
            assertEquals(9, start.getEnd().getColumn());
        }

        @Test
        @DisplayName("函数调用区间包含右括号")
        void testFunctionCallRange() {
            FunctionCallExpr call = (FunctionCallExpr) expr("f(x)");
            assertEquals(4, call.getRange().getStart().getByteOffset());
            assertEquals(8, call.getRange().getEnd().getByteOffset());
        }

        @Test
        @DisplayName("元组与跨行元组")
        void testTuple() {
            TupleConsExpr tuple = (TupleConsExpr) expr("[\n  1,\n  \"two\",\n]");
            assertEquals(2, tuple.getExprs().size());
            assertEquals(tuple.getOpenRange(), tuple.getStartRange());
        }

        @Test
        @DisplayName("对象：等号、冒号、换行与逗号分隔")
        void testObject() {
            ObjectConsExpr obj = (ObjectConsExpr) expr("{\n  a = 1\n  \"b\": 2, c = 3\n}");
            assertEquals(3, obj.getItems().size());
            ObjectConsKeyExpr key = (ObjectConsKeyExpr) obj.getItems().get(0).getKeyExpr();
            assertTrue(key.getWrapped() instanceof ScopeTraversalExpr);
            assertFalse(key.isForceNonLiteral());
        }

        @Test
        @DisplayName("括号键强制按表达式解释")
        void testParenthesizedKey() {
            ObjectConsExpr obj = (ObjectConsExpr) expr("{ (var.k) = 1 }");
            ObjectConsKeyExpr key = (ObjectConsKeyExpr) obj.getItems().get(0).getKeyExpr();
            assertTrue(key.isForceNonLiteral());
            assertTrue(key.getWrapped() instanceof ParenthesesExpr);
        }

        @Test
        @DisplayName("对象项之间缺少分隔符")
        void testObjectMissingSeparator() {
            assertThrows(ParseException.class, () -> expr("{ a = 1 b = 2 }"));
        }

        @Test
        @DisplayName("元组形式的 for 表达式")
        void testTupleFor() {
            ForExpr f = (ForExpr) expr("[for i, v in xs : v if v != null]");
            assertEquals("i", f.getKeyVar());
            assertEquals("v", f.getValVar());
            assertFalse(f.isObjectForm());
            assertNotNull(f.getCondExpr());
        }

        @Test
        @DisplayName("对象形式的 for 表达式与分组")
        void testObjectFor() {
            ForExpr f = (ForExpr) expr("{\n  for v in xs : v.k => v...\n}");
            assertNull(f.getKeyVar());
            assertTrue(f.isObjectForm());
            assertTrue(f.isGroup());
        }

        @Test
        @DisplayName("名为 for 的变量不是 for 表达式")
        void testForAsVariable() {
            TupleConsExpr tuple = (TupleConsExpr) expr("[for]");
            assertEquals("for", ((ScopeTraversalExpr) tuple.getExprs().get(0)).getRootName());
        }
    }
}
