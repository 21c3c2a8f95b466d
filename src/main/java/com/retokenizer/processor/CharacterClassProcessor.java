package com.retokenizer.processor;

import java.util.List;

/**
 * 贪婪消耗给定字符集中的字符，不产生 token，通常用于跳过空白。
 */
public class CharacterClassProcessor implements TokenProcessor {

    private final String characters;

    public CharacterClassProcessor(String characters) {
        if (characters == null || characters.isEmpty()) {
            throw new IllegalArgumentException("字符集不能为空");
        }
        this.characters = characters;
    }

    public String getCharacters() {
        return characters;
    }

    @Override
    public List<Emission> process(String content, int offset) {
        int end = offset;
        while (end < content.length() && characters.indexOf(content.charAt(end)) >= 0) {
            end++;
        }
        if (end == offset) {
            return List.of();
        }
        return List.of(Emission.skip(end - offset));
    }

    /**
     * 合并两个字符集，返回新的处理器。
     */
    public CharacterClassProcessor merge(CharacterClassProcessor other) {
        StringBuilder union = new StringBuilder(characters);
        for (char ch : other.characters.toCharArray()) {
            if (union.indexOf(String.valueOf(ch)) < 0) {
                union.append(ch);
            }
        }
        return new CharacterClassProcessor(union.toString());
    }
}
