package com.retokenizer.processor;

import com.retokenizer.token.Token;

import java.util.List;

public interface TokenProcessor {

    /**
     * 尝试在 offset 处（锚定匹配，而非搜索）识别一个词法单元。
     *
     * 返回空列表表示不匹配；否则按顺序返回一个或多个产出。
     */
    List<Emission> process(String content, int offset);

    /**
     * 输入耗尽后调用一次，用于补齐未闭合的作用域等。
     */
    default List<Token> finish() {
        return List.of();
    }
}
