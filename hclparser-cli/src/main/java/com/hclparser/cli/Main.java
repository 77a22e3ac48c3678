package com.hclparser.cli;

import com.hclparser.convert.ConversionException;
import com.hclparser.convert.ConvertOptions;
import com.hclparser.convert.ConvertResult;
import com.hclparser.convert.HclConverter;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.Spec;

import java.io.IOException;
import java.io.OutputStreamWriter;
import java.io.PrintStream;
import java.io.PrintWriter;
import java.io.UnsupportedEncodingException;
import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.concurrent.Callable;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * hclparser CLI 入口点（picocli）
 */
@Command(name = "hclparser", version = "hclparser v0.1.0",
         mixinStandardHelpOptions = true,
         description = "将 HCL 配置转换为 JSON 值树与行信息树")
public class Main implements Callable<Integer> {
    private static final Logger LOG = Logger.getLogger(Main.class.getName());

    @Spec
    CommandSpec spec;

    @Option(names = {"-o", "--output"}, description = "值 JSON 输出路径（默认标准输出）")
    Path output;

    @Option(names = "--lines", description = "行信息 JSON 输出路径（默认标准输出）")
    Path lines;

    @Option(names = "--pretty", description = "格式化 JSON 输出")
    boolean pretty;

    @Option(names = "--simplify", description = "尽可能求值（保留选项）")
    boolean simplify;

    @Parameters(index = "0", description = "HCL 文件路径")
    Path file;

    @Override
    public Integer call() {
        PrintWriter out = spec.commandLine().getOut();
        PrintWriter err = spec.commandLine().getErr();

        if (!Files.isRegularFile(file)) {
            err.println("错误: 文件不存在 - " + file);
            return 1;
        }

        try {
            byte[] bytes = Files.readAllBytes(file);
            ConvertOptions options = ConvertOptions.defaults().setSimplify(simplify);
            ConvertResult result = new HclConverter().convert(bytes, file.getFileName().toString(), options);

            write(result.toValueJson(pretty), output, out);
            write(result.toLineJson(pretty), lines, out);
            return 0;
        } catch (ConversionException e) {
            LOG.log(Level.WARNING, "Conversion failed: " + file, e);
            err.println("错误: " + e.getMessage());
            return 1;
        } catch (IOException e) {
            LOG.log(Level.WARNING, "I/O failed: " + file, e);
            err.println("错误: " + e.getMessage());
            return 1;
        }
    }

    private static void write(String json, Path target, PrintWriter out) throws IOException {
        if (target == null) {
            out.println(json);
            out.flush();
        } else {
            Files.write(target, (json + "\n").getBytes(StandardCharsets.UTF_8));
        }
    }

    public static void main(String[] args) {
        String charsetName = getConsoleCharsetName();

        try {
            PrintStream out = new PrintStream(System.out, true, charsetName);
            PrintStream err = new PrintStream(System.err, true, charsetName);

            Charset consoleCharset = Charset.forName(charsetName);
            CommandLine cmd = new CommandLine(new Main());
            cmd.setOut(new PrintWriter(new OutputStreamWriter(out, consoleCharset), true));
            cmd.setErr(new PrintWriter(new OutputStreamWriter(err, consoleCharset), true));
            System.exit(cmd.execute(args));
        } catch (UnsupportedEncodingException e) {
            System.exit(new CommandLine(new Main()).execute(args));
        }
    }

    /**
     * 控制台实际使用的字符编码名，native.encoding 反映操作系统原生编码
     */
    private static String getConsoleCharsetName() {
        String nativeEnc = System.getProperty("native.encoding");
        if (nativeEnc != null && Charset.isSupported(nativeEnc)) {
            return nativeEnc;
        }
        return Charset.defaultCharset().name();
    }
}
