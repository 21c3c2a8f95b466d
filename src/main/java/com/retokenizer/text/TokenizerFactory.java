package com.retokenizer.text;

import com.retokenizer.config.ScopeMode;
import com.retokenizer.config.TokenizerConfig;
import com.retokenizer.processor.CharacterClassProcessor;
import com.retokenizer.processor.ClassicScopeProcessor;
import com.retokenizer.processor.CommentProcessor;
import com.retokenizer.processor.IndentScopeProcessor;
import com.retokenizer.processor.NewLineProcessor;
import com.retokenizer.processor.SequenceProcessor;
import com.retokenizer.processor.TokenProcessor;
import com.retokenizer.processor.ValueProcessor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.function.Supplier;

/**
 * 按配置组装标准处理器流水线。
 */
public final class TokenizerFactory {
    private static final Logger logger = LoggerFactory.getLogger(TokenizerFactory.class);

    private TokenizerFactory() {
    }

    /**
     * 顺序：缩进、换行、注释、空白、括号作用域、值、序列。
     * 返回的 Tokenizer 可重复使用，每次分词都会得到新的缩进状态。
     */
    public static Tokenizer create(TokenizerConfig config) {
        List<Supplier<? extends TokenProcessor>> factories = new ArrayList<>();
        List<String> layout = new ArrayList<>();

        if (config.getScopeMode() == ScopeMode.INDENT) {
            boolean allowMixed = config.isAllowMixedIndent();
            factories.add(() -> new IndentScopeProcessor(allowMixed));
            layout.add("indent");
        }

        NewLineProcessor newLine = new NewLineProcessor();
        factories.add(() -> newLine);
        layout.add("newline");

        String marker = config.getCommentMarker();
        if (marker != null && !marker.isEmpty()) {
            CommentProcessor comment = new CommentProcessor(marker);
            factories.add(() -> comment);
            layout.add("comment");
        }

        String whitespace = config.getWhitespace();
        if (whitespace != null && !whitespace.isEmpty()) {
            CharacterClassProcessor consumer = new CharacterClassProcessor(whitespace);
            factories.add(() -> consumer);
            layout.add("whitespace");
        }

        if (config.getScopeMode() == ScopeMode.BRACES) {
            ClassicScopeProcessor scope = new ClassicScopeProcessor(config.getScopeStart(), config.getScopeEnd());
            factories.add(() -> scope);
            layout.add("braces");
        }

        ValueProcessor values = mergeValues(config);
        if (values != null) {
            factories.add(() -> values);
            layout.add("values");
        }

        SequenceProcessor sequences = mergeSequences(config);
        if (sequences != null) {
            factories.add(() -> sequences);
            layout.add("sequences");
        }

        logger.debug("Tokenizer pipeline: {}", layout);
        return Tokenizer.fromFactories(factories);
    }

    private static ValueProcessor mergeValues(TokenizerConfig config) {
        ValueProcessor merged = null;
        if (config.isNumbers()) {
            merged = ValueProcessor.number();
        }
        if (config.isStrings()) {
            merged = merged == null ? ValueProcessor.quotedString() : merged.merge(ValueProcessor.quotedString());
        }
        if (config.isBooleans()) {
            merged = merged == null ? ValueProcessor.bool() : merged.merge(ValueProcessor.bool());
        }
        return merged;
    }

    private static SequenceProcessor mergeSequences(TokenizerConfig config) {
        SequenceProcessor merged = null;
        if (config.isOperators()) {
            merged = SequenceProcessor.operator();
        }
        if (config.isIdentifiers()) {
            merged = merged == null ? SequenceProcessor.identifier() : merged.merge(SequenceProcessor.identifier());
        }
        return merged;
    }
}
