package com.retokenizer.cli;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.retokenizer.config.Constants;
import com.retokenizer.config.ScopeMode;
import com.retokenizer.config.TokenizerConfig;
import com.retokenizer.text.TokenizationException;
import com.retokenizer.text.Tokenizer;
import com.retokenizer.text.TokenizerFactory;
import com.retokenizer.text.TokenizerResult;
import com.retokenizer.token.Token;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.io.IOException;
import java.io.InputStreamReader;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;

@Command(
    name = "retokenize",
    description = "🔤 基于正则处理器流水线的文本分词工具",
    mixinStandardHelpOptions = true,
    version = "1.0.0"
)
public class MainCommand implements Callable<Integer> {
    private static final Logger logger = LoggerFactory.getLogger(MainCommand.class);

    static final int EXIT_OK = 0;
    static final int EXIT_TOKENIZE_FAILED = 1;
    static final int EXIT_IO_FAILED = 2;

    @Parameters(description = "要分词的文件，省略时读取标准输入", arity = "0..1")
    private Path inputFile;

    @Option(names = {"--config"}, description = "JSON 配置文件路径")
    private Path configFile;

    @Option(names = {"--scope"}, description = "作用域识别方式 (${COMPLETION-CANDIDATES})")
    private ScopeMode scopeMode;

    @Option(names = {"--allow-mixed-indent"}, description = "同深度行允许切换缩进字符")
    private boolean allowMixedIndent;

    @Option(names = {"--comment"}, description = "注释标记，传空字符串关闭注释识别")
    private String commentMarker;

    @Option(names = {"-f", "--format"}, description = "输出格式 (${COMPLETION-CANDIDATES})", defaultValue = "TEXT")
    private OutputFormat format;

    @Option(names = {"--max-chars"}, description = "允许读取的最大字符数 (默认: ${DEFAULT-VALUE})",
        defaultValue = "" + Constants.MAX_INPUT_CHARS)
    private int maxInputChars;

    public static void main(String[] args) {
        int exitCode = newCommandLine().execute(args);
        System.exit(exitCode);
    }

    static CommandLine newCommandLine() {
        return new CommandLine(new MainCommand()).setCaseInsensitiveEnumValuesAllowed(true);
    }

    @Override
    public Integer call() {
        TokenizerConfig config;
        String content;
        try {
            config = resolveConfig();
            content = readInput();
        } catch (IOException exception) {
            System.err.println("❌ 读取失败: " + exception.getMessage());
            return EXIT_IO_FAILED;
        }

        Tokenizer tokenizer = TokenizerFactory.create(config);
        TokenizerResult result;
        try {
            result = tokenizer.tokenize(content);
        } catch (TokenizationException exception) {
            logger.warn("Tokenization failed at offset {}: {}", exception.getOffset(), exception.getReason());
            System.err.println("❌ 分词失败: " + exception.getMessage());
            return EXIT_TOKENIZE_FAILED;
        }

        List<TokenView> views = toViews(result);
        try {
            if (format == OutputFormat.JSON) {
                printJson(views);
            } else {
                printText(views);
            }
        } catch (IOException exception) {
            System.err.println("❌ 输出失败: " + exception.getMessage());
            return EXIT_IO_FAILED;
        }
        return EXIT_OK;
    }

    private TokenizerConfig resolveConfig() throws IOException {
        TokenizerConfig config = configFile == null ? TokenizerConfig.defaults() : TokenizerConfig.load(configFile);
        if (scopeMode != null) {
            config.setScopeMode(scopeMode);
        }
        if (allowMixedIndent) {
            config.setAllowMixedIndent(true);
        }
        if (commentMarker != null) {
            config.setCommentMarker(commentMarker);
        }
        return config;
    }

    private String readInput() throws IOException {
        if (inputFile != null) {
            try (Reader reader = Files.newBufferedReader(inputFile, StandardCharsets.UTF_8)) {
                return readBounded(reader);
            }
        }
        return readBounded(new InputStreamReader(System.in, StandardCharsets.UTF_8));
    }

    /**
     * 读取到超出上限的第一个块即停止，不会把超长输入整体载入内存。
     */
    private String readBounded(Reader reader) throws IOException {
        StringBuilder buffer = new StringBuilder();
        char[] chunk = new char[8192];
        int read;
        while ((read = reader.read(chunk)) != -1) {
            buffer.append(chunk, 0, read);
            if (buffer.length() > maxInputChars) {
                throw new IOException("输入超过上限 " + maxInputChars + " 个字符");
            }
        }
        return buffer.toString();
    }

    private List<TokenView> toViews(TokenizerResult result) {
        List<TokenView> views = new ArrayList<>(result.size());
        for (int index = 0; index < result.size(); index++) {
            Token token = result.tokens().get(index);
            views.add(TokenView.of(token, result.positionAt(index)));
        }
        return views;
    }

    private void printText(List<TokenView> views) {
        for (TokenView view : views) {
            StringBuilder line = new StringBuilder();
            line.append(view.line()).append(':').append(view.column()).append('\t').append(view.kind());
            if (view.type() != null) {
                line.append('<').append(view.type()).append('>');
            }
            if (view.value() != null) {
                line.append('\t').append(view.value());
            }
            System.out.println(line);
        }
    }

    private void printJson(List<TokenView> views) throws IOException {
        ObjectMapper mapper = new ObjectMapper();
        System.out.println(mapper.writerWithDefaultPrettyPrinter().writeValueAsString(views));
    }
}
