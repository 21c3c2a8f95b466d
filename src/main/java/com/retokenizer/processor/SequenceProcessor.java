package com.retokenizer.processor;

import com.retokenizer.token.Token;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;

/**
 * 按片段列表识别文本序列，原样输出匹配到的文本。
 */
public class SequenceProcessor implements TokenProcessor {

    private final RegexAlternation alternation;

    public SequenceProcessor(String... sequences) {
        this(List.of(sequences));
    }

    public SequenceProcessor(List<String> sequences) {
        List<RegexAlternation.Alternative> alternatives = new ArrayList<>(sequences.size());
        for (String sequence : sequences) {
            alternatives.add(RegexAlternation.Alternative.of(sequence, false, null, null));
        }
        this.alternation = RegexAlternation.of(alternatives);
    }

    private SequenceProcessor(RegexAlternation alternation) {
        this.alternation = alternation;
    }

    /**
     * 算术运算符：+ - / * =，可选重复自身或后接 =，如 +、++、+=。
     */
    public static SequenceProcessor operator() {
        return new SequenceProcessor("([+\\-/*=])(?:=|\\1)?");
    }

    public static SequenceProcessor identifier() {
        return new SequenceProcessor("[A-Za-z_][A-Za-z0-9_]*");
    }

    public RegexAlternation getAlternation() {
        return alternation;
    }

    @Override
    public List<Emission> process(String content, int offset) {
        Matcher matcher = alternation.pattern().matcher(content).region(offset, content.length());
        if (!matcher.lookingAt() || matcher.end() == offset) {
            return List.of();
        }
        return List.of(Emission.of(new Token.Sequence(matcher.group()), matcher.end() - offset));
    }

    public SequenceProcessor merge(SequenceProcessor other) {
        return new SequenceProcessor(alternation.concat(other.alternation));
    }
}
