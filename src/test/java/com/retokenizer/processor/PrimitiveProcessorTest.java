package com.retokenizer.processor;

import com.retokenizer.token.Token;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class PrimitiveProcessorTest {

    @Test
    @DisplayName("NewLine: LF 与 CRLF")
    void testNewLine() {
        NewLineProcessor processor = new NewLineProcessor();

        assertEquals(List.of(Emission.of(new Token.LineBreak(), 1)), processor.process("\n", 0));
        assertEquals(List.of(Emission.of(new Token.LineBreak(), 2)), processor.process("a\r\nb", 1));
        assertTrue(processor.process("\r", 0).isEmpty());
    }

    @Test
    @DisplayName("匹配锚定在 offset，不向后搜索")
    void testAnchoredMatch() {
        assertTrue(new NewLineProcessor().process("a\n", 0).isEmpty());
        assertTrue(new CommentProcessor().process("a # b", 0).isEmpty());
    }

    @Test
    @DisplayName("ClassicScope: 默认花括号")
    void testClassicScopeDefaults() {
        ClassicScopeProcessor processor = new ClassicScopeProcessor();

        assertEquals(List.of(Emission.of(new Token.ScopeStart(), 1)), processor.process("{x}", 0));
        assertEquals(List.of(Emission.of(new Token.ScopeEnd(), 1)), processor.process("{x}", 2));
        assertTrue(processor.process("{x}", 1).isEmpty());
    }

    @Test
    @DisplayName("ClassicScope: 自定义起止符号")
    void testClassicScopeCustomSymbols() {
        ClassicScopeProcessor brackets = new ClassicScopeProcessor('[', ']');
        ClassicScopeProcessor keywords = new ClassicScopeProcessor("begin", "end");

        assertEquals(List.of(Emission.of(new Token.ScopeEnd(), 1)), brackets.process("]", 0));
        assertEquals(List.of(Emission.of(new Token.ScopeStart(), 5)), keywords.process("begin x end", 0));
        assertEquals(List.of(Emission.of(new Token.ScopeEnd(), 3)), keywords.process("begin x end", 8));
        assertThrows(IllegalArgumentException.class, () -> new ClassicScopeProcessor("", "}"));
    }

    @Test
    @DisplayName("Comment: 标记之后到行尾")
    void testComment() {
        CommentProcessor processor = new CommentProcessor();

        assertEquals(List.of(Emission.of(new Token.Comment(" hi"), 4)), processor.process("# hi\nx", 0));
        assertEquals(List.of(Emission.of(new Token.Comment("a"), 2)), processor.process("#a\r\n", 0));
        assertEquals(List.of(Emission.of(new Token.Comment(""), 1)), processor.process("#", 0));
    }

    @Test
    @DisplayName("Comment: 多字符与正则特殊字符标记")
    void testCommentMarkers() {
        assertEquals(List.of(Emission.of(new Token.Comment("x"), 3)), new CommentProcessor("//").process("//x", 0));
        assertEquals(List.of(Emission.of(new Token.Comment("note"), 5)), new CommentProcessor("*").process("*note", 0));
        assertTrue(new CommentProcessor("//").process("/x", 0).isEmpty());
    }

    @Test
    @DisplayName("CharacterClass: 贪婪消耗且不产生 token")
    void testCharacterClass() {
        CharacterClassProcessor processor = new CharacterClassProcessor(" \t");

        assertEquals(List.of(Emission.skip(3)), processor.process(" \t x", 0));
        assertTrue(processor.process("x ", 0).isEmpty());
    }

    @ParameterizedTest
    @ValueSource(strings = {"]", "^", "-", "\\", "."})
    @DisplayName("CharacterClass: 字符按字面处理")
    void testCharacterClassLiteralCharacters(String character) {
        CharacterClassProcessor processor = new CharacterClassProcessor(character);

        assertEquals(List.of(Emission.skip(2)), processor.process(character.repeat(2) + "x", 0));
        assertTrue(processor.process("a", 0).isEmpty());
    }

    @Test
    @DisplayName("CharacterClass: 合并为字符集并集")
    void testCharacterClassMerge() {
        CharacterClassProcessor merged = new CharacterClassProcessor(" ").merge(new CharacterClassProcessor("\t "));

        assertEquals(" \t", merged.getCharacters());
        assertEquals(List.of(Emission.skip(2)), merged.process("\t x", 0));
    }

    @Test
    @DisplayName("Emission: 消耗量不能为负")
    void testNegativeConsumption() {
        assertThrows(IllegalArgumentException.class, () -> Emission.skip(-1));
    }
}
