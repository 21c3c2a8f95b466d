package com.retokenizer.text;

import com.retokenizer.token.Token;

import java.util.ArrayList;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Tokenizer 的产出：源文本、按顺序排列的 token，以及每个 token 的起始偏移。
 *
 * 结构相同的 token 可能出现在不同偏移，因此偏移按 token 实例身份索引，而非 equals。
 */
public class TokenizerResult {
    private final String source;
    private final List<Token> tokens;
    private final List<Integer> offsets;
    private final Map<Token, Integer> indexByIdentity;

    public TokenizerResult(String source) {
        this(source, new ArrayList<>(), new ArrayList<>(), new IdentityHashMap<>());
    }

    private TokenizerResult(String source, List<Token> tokens, List<Integer> offsets, Map<Token, Integer> indexByIdentity) {
        this.source = source;
        this.tokens = tokens;
        this.offsets = offsets;
        this.indexByIdentity = indexByIdentity;
    }

    /**
     * 源文本；脱离源文本的结果返回 null。
     */
    public String source() {
        return source;
    }

    public List<Token> tokens() {
        return Collections.unmodifiableList(tokens);
    }

    public int size() {
        return tokens.size();
    }

    /**
     * 追加 token 并同时记录偏移。同一实例不能重复加入。
     */
    void addToken(Token token, int offset) {
        if (token == null) {
            throw new IllegalArgumentException("token 不能为 null");
        }
        if (indexByIdentity.containsKey(token)) {
            throw new IllegalArgumentException("同一个 token 实例被重复产出: " + token);
        }
        indexByIdentity.put(token, tokens.size());
        tokens.add(token);
        offsets.add(offset);
    }

    public int offsetOf(int index) {
        return offsets.get(index);
    }

    /**
     * 按实例身份查找 token 偏移，不属于本结果的 token 返回空。
     */
    public Optional<Integer> offsetOf(Token token) {
        Integer index = indexByIdentity.get(token);
        return index == null ? Optional.empty() : Optional.of(offsets.get(index));
    }

    /**
     * 获取 token 的位置视图；结果未保留源文本时抛出 IllegalStateException。
     */
    public Optional<PositionView> positionOf(Token token) {
        requireSource();
        return offsetOf(token).map(offset -> new PositionView(source, offset));
    }

    public PositionView positionAt(int index) {
        requireSource();
        return new PositionView(source, offsets.get(index));
    }

    /**
     * 返回不再持有源文本的副本，token 与偏移保持不变。
     */
    public TokenizerResult detached() {
        return new TokenizerResult(null, tokens, offsets, indexByIdentity);
    }

    private void requireSource() {
        if (source == null) {
            throw new IllegalStateException("Tried to get a token position without text source");
        }
    }
}
