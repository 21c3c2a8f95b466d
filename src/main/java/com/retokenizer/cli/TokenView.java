package com.retokenizer.cli;

import com.retokenizer.text.PositionView;
import com.retokenizer.token.Token;

/**
 * 命令行输出用的 token 扁平视图。
 */
public record TokenView(
    String kind,
    Object value,
    String type,
    int line,
    int column,
    int offset
) {

    public static TokenView of(Token token, PositionView position) {
        Object value = null;
        String type = null;
        if (token instanceof Token.Value valueToken) {
            value = valueToken.value();
            type = valueToken.type().getSimpleName();
        } else if (token instanceof Token.Comment comment) {
            value = comment.text();
        } else if (token instanceof Token.Sequence sequence) {
            value = sequence.sequence();
        }
        return new TokenView(token.getClass().getSimpleName(), value, type,
            position.lineNumber(), position.column(), position.offset());
    }
}
