package com.retokenizer.processor;

import com.retokenizer.token.Token;

/**
 * 处理器单次产出：可能为空的 token 与相对锚点消耗的字符数。
 *
 * token 为 null 表示静默跳过 consumed 个字符。
 */
public record Emission(Token token, int consumed) {

    public Emission {
        if (consumed < 0) {
            throw new IllegalArgumentException("consumed must not be negative: " + consumed);
        }
    }

    public static Emission of(Token token, int consumed) {
        return new Emission(token, consumed);
    }

    public static Emission skip(int consumed) {
        return new Emission(null, consumed);
    }
}
