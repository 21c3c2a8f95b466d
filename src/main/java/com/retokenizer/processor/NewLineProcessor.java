package com.retokenizer.processor;

import com.retokenizer.token.Token;

import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

public class NewLineProcessor implements TokenProcessor {

    private static final Pattern NEW_LINE = Pattern.compile("\r?\n");

    @Override
    public List<Emission> process(String content, int offset) {
        Matcher matcher = NEW_LINE.matcher(content).region(offset, content.length());
        if (!matcher.lookingAt()) {
            return List.of();
        }
        return List.of(Emission.of(new Token.LineBreak(), matcher.end() - offset));
    }
}
