package com.retokenizer.text;

import com.retokenizer.processor.Emission;
import com.retokenizer.processor.TokenProcessor;
import com.retokenizer.token.Token;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.Reader;
import java.io.StringWriter;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.function.Supplier;

/**
 * 按优先级驱动一组处理器，把文本切分为 token 序列。
 *
 * 每一轮从最高优先级的处理器开始尝试，第一个匹配者生效后重新从头开始；
 * 一整轮都没有匹配时结束。处理器顺序即歧义消解规则。
 *
 * 以实例构造的 Tokenizer 只能使用一次（有状态处理器不会重置）；
 * 以工厂构造的 Tokenizer 每次分词都会创建新的处理器。
 */
public class Tokenizer {
    private static final Logger logger = LoggerFactory.getLogger(Tokenizer.class);

    private final List<Supplier<? extends TokenProcessor>> processorFactories;
    private final boolean reusable;
    private boolean used;

    public Tokenizer(TokenProcessor... processors) {
        this(List.of(processors));
    }

    public Tokenizer(List<? extends TokenProcessor> processors) {
        List<Supplier<? extends TokenProcessor>> factories = new ArrayList<>(processors.size());
        for (TokenProcessor processor : processors) {
            if (processor == null) {
                throw new IllegalArgumentException("处理器不能为 null");
            }
            factories.add(() -> processor);
        }
        this.processorFactories = List.copyOf(factories);
        this.reusable = false;
    }

    private Tokenizer(List<Supplier<? extends TokenProcessor>> processorFactories, boolean reusable) {
        this.processorFactories = List.copyOf(processorFactories);
        this.reusable = reusable;
    }

    /**
     * 以处理器工厂构造，每次 tokenize 都使用新创建的处理器实例。
     */
    public static Tokenizer fromFactories(List<Supplier<? extends TokenProcessor>> processorFactories) {
        return new Tokenizer(processorFactories, true);
    }

    /**
     * 是否可以对多份输入重复调用 tokenize。
     */
    public boolean isReusable() {
        return reusable;
    }

    /**
     * 读取全部输入后分词。
     */
    public TokenizerResult tokenize(Reader reader) throws IOException {
        StringWriter buffer = new StringWriter();
        reader.transferTo(buffer);
        return tokenize(buffer.toString());
    }

    public TokenizerResult tokenize(String source) {
        if (source == null) {
            throw new IllegalArgumentException("源文本不能为 null");
        }
        if (used && !reusable) {
            throw new IllegalStateException("Tokenizer built from processor instances is single-use; use fromFactories for reuse");
        }
        used = true;
        List<TokenProcessor> processors = instantiateProcessors();
        try {
            TokenizerResult result = run(processors, source);
            logger.debug("Tokenized {} chars into {} tokens with {} processors",
                source.length(), result.size(), processors.size());
            return result;
        } catch (TokenizationException exception) {
            throw exception.locate(source);
        }
    }

    private TokenizerResult run(List<TokenProcessor> processors, String source) {
        TokenizerResult result = new TokenizerResult(source);
        int sourceLength = source.length();
        int pos = 0;
        Set<TokenProcessor> stalledAtPos = new HashSet<>();

        boolean processed = true;
        while (processed) {
            processed = false;
            for (TokenProcessor processor : processors) {
                List<Emission> emissions = processor.process(source, pos);
                if (emissions == null || emissions.isEmpty()) {
                    continue;
                }

                int anchor = pos;
                boolean emitted = false;
                for (Emission emission : emissions) {
                    if (emission.token() != null) {
                        result.addToken(emission.token(), anchor);
                        emitted = true;
                    }
                    pos += emission.consumed();
                }

                if (pos > sourceLength) {
                    throw new IllegalStateException(describe(processor) + " consumed past the end of input at offset " + anchor);
                }
                if (pos == anchor) {
                    // 零长度匹配只允许产出 token，且同一处理器在同一偏移只允许一次
                    if (!emitted || !stalledAtPos.add(processor)) {
                        throw new IllegalStateException(describe(processor) + " made no progress at offset " + anchor);
                    }
                } else {
                    stalledAtPos.clear();
                }

                processed = true;
                break;
            }
        }

        if (pos != sourceLength) {
            throw new TokenizationException("Unable to tokenize", pos);
        }

        for (TokenProcessor processor : processors) {
            List<Token> closing = processor.finish();
            if (closing == null) {
                continue;
            }
            for (Token token : closing) {
                if (token != null) {
                    result.addToken(token, sourceLength);
                }
            }
        }
        result.addToken(new Token.EndOfFile(), sourceLength);
        return result;
    }

    private List<TokenProcessor> instantiateProcessors() {
        List<TokenProcessor> processors = new ArrayList<>(processorFactories.size());
        for (Supplier<? extends TokenProcessor> factory : processorFactories) {
            TokenProcessor processor = factory.get();
            if (processor == null) {
                throw new IllegalStateException("处理器工厂返回了 null");
            }
            processors.add(processor);
        }
        return processors;
    }

    private static String describe(TokenProcessor processor) {
        return processor.getClass().getSimpleName();
    }
}
