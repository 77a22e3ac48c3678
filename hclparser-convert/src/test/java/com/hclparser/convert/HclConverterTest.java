package com.hclparser.convert;

import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.hclparser.syntax.ast.ConfigFile;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.util.Map;

import static org.assertj.core.api.Assertions.*;

@DisplayName("HclConverter 测试")
class HclConverterTest {

    private final HclConverter converter = new HclConverter();

    private ConvertResult convert(String source) {
        return converter.convert(source.getBytes(StandardCharsets.UTF_8), "test.tf", null);
    }

    private String values(String source) {
        return convert(source).toValueJson();
    }

    private ConversionException failure(String source) {
        Throwable thrown = catchThrowable(() -> convert(source));
        assertThat(thrown).isInstanceOf(ConversionException.class);
        return (ConversionException) thrown;
    }

    /** 值树与行信息树在每个键上的形状一致 */
    private static void assertSameShape(ValueNode value, LineNode line) {
        if (value instanceof ValueNode.Mapping) {
            assertThat(line).isInstanceOf(LineNode.Mapping.class);
            Map<String, ValueNode> values = ((ValueNode.Mapping) value).getEntries();
            Map<String, LineNode> lines = ((LineNode.Mapping) line).getEntries();
            assertThat(lines.keySet()).containsExactlyElementsOf(values.keySet());
            for (Map.Entry<String, ValueNode> entry : values.entrySet()) {
                assertSameShape(entry.getValue(), lines.get(entry.getKey()));
            }
        } else if (line instanceof LineNode.Sequence) {
            assertThat(value).isInstanceOf(ValueNode.Sequence.class);
            ValueNode.Sequence sequence = (ValueNode.Sequence) value;
            LineNode.Sequence lineSequence = (LineNode.Sequence) line;
            assertThat(lineSequence.size()).isEqualTo(sequence.size());
            for (int i = 0; i < sequence.size(); i++) {
                assertSameShape(sequence.get(i), lineSequence.get(i));
            }
        } else {
            assertThat(line).isInstanceOf(LineNode.Position.class);
        }
    }

    // ============ 属性 ============

    @Nested
    @DisplayName("属性")
    class AttributeTests {

        @Test
        @DisplayName("常量直接成为 JSON 值")
        void testConstants() {
            assertThat(values("a = 1\nb = \"x\"\nc = true\nd = null\n"))
                    .isEqualTo("{\"a\":1,\"b\":\"x\",\"c\":true,\"d\":null}");
        }

        @Test
        @DisplayName("数字以普通小数形式输出")
        void testNumberNormalization() {
            assertThat(values("n = 1e3\nf = 1.50\nz = 0\n")).isEqualTo("{\"n\":1000,\"f\":1.5,\"z\":0}");
        }

        @Test
        @DisplayName("指数极大或极小的数字保留科学计数法")
        void testHugeExponent() {
            assertThat(values("x = 1e999999999\ny = 1e-999999999\n"))
                    .isEqualTo("{\"x\":1E+999999999,\"y\":1E-999999999}");
            assertThat(values("x = 1e1001\n")).isEqualTo("{\"x\":1E+1001}");
        }

        @Test
        @DisplayName("属性按源码顺序输出")
        void testSourceOrder() {
            assertThat(values("b = 1\na = 2\nc = 3\n")).isEqualTo("{\"b\":1,\"a\":2,\"c\":3}");
        }

        @Test
        @DisplayName("属性的行信息：值的起始区间与属性名区间")
        void testAttributeLine() {
            LineNode.Position line = (LineNode.Position) convert("a = 1\n").getLines().get("a");
            assertThat(line.getLine()).isEqualTo(1);
            assertThat(line.getStartIndex()).isEqualTo(5);
            assertThat(line.getEndIndex()).isEqualTo(6);
            assertThat(line.toJson().toString()).isEqualTo(
                    "{\"line\":1,\"startIndex\":5,\"endIndex\":6,"
                            + "\"__key__startIndex\":1,\"__key__endIndex\":2,\"__key__line\":1}");
        }

        @Test
        @DisplayName("元组：元素依次转换，行信息只有一个位置")
        void testTuple() {
            ConvertResult result = convert("t = [1, \"two\", x]\n");
            assertThat(result.toValueJson()).isEqualTo("{\"t\":[1,\"two\",\"${x}\"]}");
            LineNode.Position line = (LineNode.Position) result.getLines().get("t");
            assertThat(line.getStartIndex()).isEqualTo(5);
            assertThat(line.getEndIndex()).isEqualTo(6);
        }

        @Test
        @DisplayName("对象：键的几种写法")
        void testObjectKeys() {
            assertThat(values("o = { a = 1, \"b\" = 2, foo.bar = 3, (k) = 4, 5 = 6 }\n"))
                    .isEqualTo("{\"o\":{\"a\":1,\"b\":2,\"foo.bar\":3,\"${(k)}\":4,\"5\":6}}");
        }

        @Test
        @DisplayName("对象的行信息带有自身位置与各条目位置")
        void testObjectLines() {
            LineNode.Mapping line = (LineNode.Mapping) convert("o = {\n  a = 1\n}\n").getLines().get("o");
            LineNode.Position a = (LineNode.Position) line.get("a");
            assertThat(a.getLine()).isEqualTo(2);
            assertThat(a.getStartIndex()).isEqualTo(7);
            JsonObject json = line.toJson().getAsJsonObject();
            assertThat(json.get("line").getAsInt()).isEqualTo(1);
            assertThat(json.get("startIndex").getAsInt()).isEqualTo(5);
            assertThat(json.get("endIndex").getAsInt()).isEqualTo(6);
            assertThat(json.get("__key__startIndex").getAsInt()).isEqualTo(1);
        }

        @Test
        @DisplayName("无法用 JSON 表示的表达式输出为 ${原文}")
        void testMarkupFallback() {
            assertThat(values("a = var.x\nb = max(1, 2)\nc = x ? 1 : 2\nd = -1\ne = list[*].id\nf = 1 + 2\n"))
                    .isEqualTo("{\"a\":\"${var.x}\",\"b\":\"${max(1, 2)}\",\"c\":\"${x ? 1 : 2}\","
                            + "\"d\":\"${-1}\",\"e\":\"${list[*].id}\",\"f\":\"${1 + 2}\"}");
        }

        @Test
        @DisplayName("函数调用的右括号只出现一次")
        void testFunctionCallParen() {
            assertThat(values("x = f(x)\n")).isEqualTo("{\"x\":\"${f(x)}\"}");
        }

        @Test
        @DisplayName("for 表达式在模板外输出为 ${原文}")
        void testForExpression() {
            assertThat(values("x = [for v in xs : v]\n")).isEqualTo("{\"x\":\"${[for v in xs : v]}\"}");
        }
    }

    // ============ 模板 ============

    @Nested
    @DisplayName("模板")
    class TemplateTests {

        @Test
        @DisplayName("常量插值折叠为字符串")
        void testConstantCollapse() {
            assertThat(values("a = \"hello-${1}\"\nb = \"${true}-x\"\n"))
                    .isEqualTo("{\"a\":\"hello-1\",\"b\":\"true-x\"}");
        }

        @Test
        @DisplayName("模板中指数极大或极小的数字")
        void testHugeExponentInTemplate() {
            assertThat(values("x = \"${1e999999999}-\"\ny = \"${1e-999999999}-\"\nz = \"${2.50e2}-\"\n"))
                    .isEqualTo("{\"x\":\"1E+999999999-\",\"y\":\"1E-999999999-\",\"z\":\"250-\"}");
        }

        @Test
        @DisplayName("非常量插值原样保留")
        void testInterpolationRoundTrip() {
            assertThat(values("a = \"hello-${var.x}\"\n")).isEqualTo("{\"a\":\"hello-${var.x}\"}");
        }

        @Test
        @DisplayName("单个插值的模板透明处理")
        void testWrap() {
            ConvertResult result = convert("a = \"${var.x}\"\nb = \"${2}\"\n");
            assertThat(result.toValueJson()).isEqualTo("{\"a\":\"${var.x}\",\"b\":2}");
            assertThat(((LineNode.Position) result.getLines().get("a")).getStartIndex()).isEqualTo(8);
        }

        @Test
        @DisplayName("if/else 指令按原文还原")
        void testIfElse() {
            assertThat(values("x = \"%{if cond}A%{else}B%{endif}\"\n"))
                    .isEqualTo("{\"x\":\"%{if cond}A%{else}B%{endif}\"}");
        }

        @Test
        @DisplayName("没有 else 时不输出 else")
        void testIfWithoutElse() {
            assertThat(values("x = \"x%{if c}y%{endif}\"\n")).isEqualTo("{\"x\":\"x%{if c}y%{endif}\"}");
        }

        @Test
        @DisplayName("for 指令按原文还原")
        void testFor() {
            assertThat(values("x = \"%{for k, v in m}${k}=${v};%{endfor}\"\n"))
                    .isEqualTo("{\"x\":\"%{for k, v in m}${k}=${v};%{endfor}\"}");
            assertThat(values("x = \"%{for v in xs}[${v}]%{endfor}\"\n"))
                    .isEqualTo("{\"x\":\"%{for v in xs}[${v}]%{endfor}\"}");
        }

        @Test
        @DisplayName("heredoc")
        void testHeredoc() {
            assertThat(values("h = <<EOT\nhello\nEOT\n")).isEqualTo("{\"h\":\"hello\\n\"}");
        }

        @Test
        @DisplayName("模板中的 null 无法转换为字符串")
        void testNullInTemplate() {
            ConversionException e = failure("x = \"a${null}\"\n");
            assertThat(e.getKind()).isEqualTo(ConversionException.Kind.VALUE_CONVERSION);
            assertThat(e.getMessage())
                    .startsWith("convert file: convert body: convert expression: convert literal to string")
                    .contains("test.tf:1,9");
        }

        @Test
        @DisplayName("条件分支中的错误向上传递")
        void testErrorInBranch() {
            ConversionException e = failure("x = \"%{if c}a%{else}${null}%{endif}\"\n");
            assertThat(e.getKind()).isEqualTo(ConversionException.Kind.VALUE_CONVERSION);
        }
    }

    // ============ 块 ============

    @Nested
    @DisplayName("块")
    class BlockTests {

        @Test
        @DisplayName("单个块不包装为数组")
        void testSingleBlock() {
            assertThat(values("a {\n  x = 1\n}\n")).isEqualTo("{\"a\":{\"x\":1}}");
        }

        @Test
        @DisplayName("同名块按出现顺序合并为数组")
        void testCollisionMerge() {
            ConvertResult result = convert("a {\n  n = 1\n}\na {\n  n = 2\n}\na {\n  n = 3\n}\n");
            assertThat(result.toValueJson()).isEqualTo("{\"a\":[{\"n\":1},{\"n\":2},{\"n\":3}]}");
            LineNode.Sequence lines = (LineNode.Sequence) result.getLines().get("a");
            assertThat(lines.size()).isEqualTo(3);
            assertThat(((LineNode.Mapping) lines.get(2)).getKeyRange().getStart().getLine()).isEqualTo(7);
        }

        @Test
        @DisplayName("标签逐层嵌套")
        void testLabelNesting() {
            assertThat(values("db \"mysql\" \"primary\" { x = 1 }\n"))
                    .isEqualTo("{\"db\":{\"mysql\":{\"primary\":{\"x\":1}}}}");
        }

        @Test
        @DisplayName("相同前缀的标签共享上层对象")
        void testSharedLabelPrefix() {
            assertThat(values("db \"mysql\" \"a\" {}\ndb \"mysql\" \"b\" {}\ndb \"mysql\" \"a\" {}\n"))
                    .isEqualTo("{\"db\":{\"mysql\":{\"a\":[{},{}],\"b\":{}}}}");
        }

        @Test
        @DisplayName("属性与同名块合并")
        void testAttributeAndBlockMerge() {
            assertThat(values("a {}\na = 1\n")).isEqualTo("{\"a\":[{},1]}");
        }

        @Test
        @DisplayName("元组值与同名块合并时元组作为一个元素")
        void testTupleNotTreatedAsMergeSequence() {
            assertThat(values("t = [1, 2]\nt {}\nt {}\n")).isEqualTo("{\"t\":[[1,2],{},{}]}");
        }

        @Test
        @DisplayName("标签路径遇到非对象条目")
        void testStructureError() {
            ConversionException e = failure("db = 1\ndb \"x\" {}\n");
            assertThat(e.getKind()).isEqualTo(ConversionException.Kind.STRUCTURE);
            assertThat(e.getMessage()).isEqualTo(
                    "convert file: convert body: convert block: unable to convert block to JSON: db.x");
        }

        @Test
        @DisplayName("嵌套块中的错误带有逐层上下文")
        void testNestedContext() {
            ConversionException e = failure("a {\n  b {\n    x = \"${null}-\"\n  }\n}\n");
            assertThat(e.getMessage()).startsWith(
                    "convert file: convert body: convert block: convert body: convert block: convert body: "
                            + "convert expression: ");
        }

        @Test
        @DisplayName("块的行信息：块体区间与类型名区间")
        void testBlockLines() {
            JsonObject json = convert("a {\n  x = 1\n}\n").getLines().toJson()
                    .getAsJsonObject().getAsJsonObject("a");
            assertThat(json.get("line").getAsInt()).isEqualTo(1);
            assertThat(json.get("startIndex").getAsInt()).isEqualTo(3);
            assertThat(json.get("endIndex").getAsInt()).isEqualTo(2);
            assertThat(json.get("__key__startIndex").getAsInt()).isEqualTo(1);
            assertThat(json.get("__key__endIndex").getAsInt()).isEqualTo(2);
            assertThat(json.get("__key__line").getAsInt()).isEqualTo(1);
            assertThat(json.getAsJsonObject("x").get("line").getAsInt()).isEqualTo(2);
        }

        @Test
        @DisplayName("与位置字段同名的属性保留条目本身")
        void testMetadataKeyClash() {
            JsonObject json = convert("b {\n  line = 5\n}\n").getLines().toJson()
                    .getAsJsonObject().getAsJsonObject("b");
            JsonElement line = json.get("line");
            assertThat(line.isJsonObject()).isTrue();
            assertThat(line.getAsJsonObject().get("line").getAsInt()).isEqualTo(2);
        }
    }

    // ============ 整体 ============

    @Nested
    @DisplayName("整体性质")
    class PropertyTests {

        private static final String DOCUMENT = "name = \"app\"\n"
                + "ports = [80, 443]\n"
                + "tags = { env = \"prod\", team = var.team }\n"
                + "service \"web\" {\n"
                + "  image = \"nginx:${var.tag}\"\n"
                + "  replicas = 2\n"
                + "  probe {\n"
                + "    path = \"/health\"\n"
                + "  }\n"
                + "  probe {\n"
                + "    path = \"/ready\"\n"
                + "  }\n"
                + "}\n"
                + "service \"worker\" {\n"
                + "  command = [\"run\", local.queue]\n"
                + "}\n"
                + "ports {}\n";

        @Test
        @DisplayName("值树与行信息树形状一致")
        void testShapeParity() {
            ConvertResult result = convert(DOCUMENT);
            assertSameShape(result.getValues(), result.getLines());
        }

        @Test
        @DisplayName("相同输入产生完全相同的 JSON")
        void testDeterminism() {
            ConvertResult first = convert(DOCUMENT);
            ConvertResult second = convert(DOCUMENT);
            assertThat(second.toValueJson()).isEqualTo(first.toValueJson());
            assertThat(second.toLineJson()).isEqualTo(first.toLineJson());
        }

        @Test
        @DisplayName("完整文档的值树")
        void testDocumentValues() {
            assertThat(convert(DOCUMENT).toValueJson()).isEqualTo("{"
                    + "\"name\":\"app\","
                    + "\"ports\":[[80,443],{}],"
                    + "\"tags\":{\"env\":\"prod\",\"team\":\"${var.team}\"},"
                    + "\"service\":{"
                    + "\"web\":{\"image\":\"nginx:${var.tag}\",\"replicas\":2,"
                    + "\"probe\":[{\"path\":\"/health\"},{\"path\":\"/ready\"}]},"
                    + "\"worker\":{\"command\":[\"run\",\"${local.queue}\"]}"
                    + "}}");
        }

        @Test
        @DisplayName("格式化输出")
        void testPrettyJson() {
            ConvertResult result = convert("a = 1\n");
            assertThat(result.toValueJson(true)).isEqualTo("{\n  \"a\": 1\n}");
            assertThat(result.toValueJson(false)).isEqualTo(result.toValueJson());
        }

        @Test
        @DisplayName("simplify 选项不改变转换结果")
        void testSimplifyOption() {
            ConvertOptions options = ConvertOptions.defaults().setSimplify(true);
            assertThat(ConvertOptions.defaults().isSimplify()).isFalse();
            assertThat(options.isSimplify()).isTrue();
            ConvertResult simplified = converter.convert(DOCUMENT.getBytes(StandardCharsets.UTF_8), "test.tf", options);
            assertThat(simplified.toValueJson()).isEqualTo(convert(DOCUMENT).toValueJson());
        }

        @Test
        @DisplayName("HTML 字符不转义")
        void testNoHtmlEscaping() {
            assertThat(values("a = \"<b>&\"\n")).isEqualTo("{\"a\":\"<b>&\"}");
        }
    }

    // ============ 错误 ============

    @Nested
    @DisplayName("错误")
    class ErrorTests {

        @Test
        @DisplayName("语法错误转为 PARSE")
        void testParseError() {
            ConversionException e = failure("a = \n");
            assertThat(e.getKind()).isEqualTo(ConversionException.Kind.PARSE);
            assertThat(e.getMessage()).startsWith("parse config: test.tf:");
            assertThat(e.getCause()).isNotNull();
        }

        @Test
        @DisplayName("根体不是原生语法体")
        void testForeignBody() {
            ConfigFile file = new ConfigFile("x.json", new byte[0], () -> null);
            Throwable thrown = catchThrowable(() -> converter.convertFile(file, ConvertOptions.defaults()));
            assertThat(thrown).isInstanceOf(ConversionException.class)
                    .hasMessage("convert file body to body type");
            assertThat(((ConversionException) thrown).getKind()).isEqualTo(ConversionException.Kind.STRUCTURE);
        }

        @Test
        @DisplayName("withContext 保留类别与根因")
        void testWithContext() {
            IllegalStateException cause = new IllegalStateException("root");
            ConversionException e = new ConversionException(ConversionException.Kind.STRUCTURE, "inner", cause)
                    .withContext("outer");
            assertThat(e.getMessage()).isEqualTo("outer: inner");
            assertThat(e.getKind()).isEqualTo(ConversionException.Kind.STRUCTURE);
            assertThat(e.getCause()).isSameAs(cause);
        }
    }
}
