package com.retokenizer.processor;

import com.retokenizer.config.Constants;
import com.retokenizer.token.Token;

import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * 将注释标记到行尾的内容识别为 Comment，不包含换行符本身。
 */
public class CommentProcessor implements TokenProcessor {

    private final Pattern commentPattern;

    public CommentProcessor() {
        this(Constants.DEFAULT_COMMENT_MARKER);
    }

    public CommentProcessor(String marker) {
        if (marker == null || marker.isEmpty()) {
            throw new IllegalArgumentException("注释标记不能为空");
        }
        this.commentPattern = Pattern.compile(Pattern.quote(marker) + "([^\r\n]*)");
    }

    @Override
    public List<Emission> process(String content, int offset) {
        Matcher matcher = commentPattern.matcher(content).region(offset, content.length());
        if (!matcher.lookingAt()) {
            return List.of();
        }
        return List.of(Emission.of(new Token.Comment(matcher.group(1)), matcher.end() - offset));
    }
}
