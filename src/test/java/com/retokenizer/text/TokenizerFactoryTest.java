package com.retokenizer.text;

import com.retokenizer.config.ScopeMode;
import com.retokenizer.config.TokenizerConfig;
import com.retokenizer.token.Token;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class TokenizerFactoryTest {

    @Test
    @DisplayName("默认流水线：运算符、数字、注释")
    void testDefaultPipeline() {
        Tokenizer tokenizer = TokenizerFactory.create(TokenizerConfig.defaults());

        List<Token> tokens = tokenizer.tokenize("x = 1 + 2.5 # note\n").tokens();

        assertEquals(List.of(
            new Token.Sequence("x"),
            new Token.Sequence("="),
            new Token.Value(Long.class, 1L),
            new Token.Sequence("+"),
            new Token.Value(Double.class, 2.5),
            new Token.Comment(" note"),
            new Token.LineBreak(),
            new Token.EndOfFile()
        ), tokens);
    }

    @Test
    @DisplayName("缩进模式：制表符缩进，结束时关闭作用域")
    void testIndentPipeline() {
        TokenizerConfig config = TokenizerConfig.defaults();
        config.setScopeMode(ScopeMode.INDENT);

        List<Token> tokens = TokenizerFactory.create(config).tokenize("if true\n\tx = 'a'\n").tokens();

        assertEquals(List.of(
            new Token.Sequence("if"),
            new Token.Value(Boolean.class, true),
            new Token.LineBreak(),
            new Token.ScopeStart(),
            new Token.Sequence("x"),
            new Token.Sequence("="),
            new Token.Value(String.class, "a"),
            new Token.LineBreak(),
            new Token.ScopeEnd(),
            new Token.EndOfFile()
        ), tokens);
    }

    @Test
    @DisplayName("括号模式")
    void testBracePipeline() {
        TokenizerConfig config = TokenizerConfig.defaults();
        config.setScopeMode(ScopeMode.BRACES);

        List<Token> tokens = TokenizerFactory.create(config).tokenize("{a}").tokens();

        assertEquals(List.of(
            new Token.ScopeStart(),
            new Token.Sequence("a"),
            new Token.ScopeEnd(),
            new Token.EndOfFile()
        ), tokens);
    }

    @Test
    @DisplayName("关闭注释后注释标记无法识别")
    void testCommentDisabled() {
        TokenizerConfig config = TokenizerConfig.defaults();
        config.setCommentMarker("");

        assertThrows(TokenizationException.class, () -> TokenizerFactory.create(config).tokenize("# x"));
    }

    @Test
    @DisplayName("工厂创建的 Tokenizer 可重复使用")
    void testReusable() {
        TokenizerConfig config = TokenizerConfig.defaults();
        config.setScopeMode(ScopeMode.INDENT);
        Tokenizer tokenizer = TokenizerFactory.create(config);

        List<Token> first = tokenizer.tokenize("a\n  b\n").tokens();
        List<Token> second = tokenizer.tokenize("a\n  b\n").tokens();

        assertTrue(tokenizer.isReusable());
        assertEquals(first, second);
    }
}
