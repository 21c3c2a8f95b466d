package com.retokenizer.processor;

import com.retokenizer.config.Constants;
import com.retokenizer.token.Token;

import java.util.List;

/**
 * 识别 C 风格的作用域分隔符，起止符号可分别配置。
 */
public class ClassicScopeProcessor implements TokenProcessor {

    private final String startSymbol;
    private final String endSymbol;

    public ClassicScopeProcessor() {
        this(Constants.DEFAULT_SCOPE_START, Constants.DEFAULT_SCOPE_END);
    }

    public ClassicScopeProcessor(char startSymbol, char endSymbol) {
        this(String.valueOf(startSymbol), String.valueOf(endSymbol));
    }

    public ClassicScopeProcessor(String startSymbol, String endSymbol) {
        if (startSymbol == null || startSymbol.isEmpty() || endSymbol == null || endSymbol.isEmpty()) {
            throw new IllegalArgumentException("作用域起止符号不能为空");
        }
        this.startSymbol = startSymbol;
        this.endSymbol = endSymbol;
    }

    @Override
    public List<Emission> process(String content, int offset) {
        if (content.startsWith(startSymbol, offset)) {
            return List.of(Emission.of(new Token.ScopeStart(), startSymbol.length()));
        }
        if (content.startsWith(endSymbol, offset)) {
            return List.of(Emission.of(new Token.ScopeEnd(), endSymbol.length()));
        }
        return List.of();
    }
}
