package com.retokenizer.token;

/**
 * 分词结果中的最小单元。
 *
 * 所有实现都是不可变的 record，自身不携带位置信息；位置由 TokenizerResult 按实例身份记录。
 */
public sealed interface Token permits Token.EndOfLine, Token.ScopeStart, Token.ScopeEnd,
        Token.Comment, Token.Value, Token.Sequence {

    /** 行结束，文件结束是它的一种特例 */
    sealed interface EndOfLine extends Token permits LineBreak, EndOfFile {
    }

    record LineBreak() implements EndOfLine {
    }

    record EndOfFile() implements EndOfLine {
    }

    record ScopeStart() implements Token {
    }

    record ScopeEnd() implements Token {
    }

    record Comment(String text) implements Token {
    }

    /**
     * 带语义类型的值，value 已按 type 完成转换。
     */
    record Value(Class<?> type, Object value) implements Token {
    }

    record Sequence(String sequence) implements Token {
    }
}
