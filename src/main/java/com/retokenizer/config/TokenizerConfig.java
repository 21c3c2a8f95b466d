package com.retokenizer.config;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.MapperFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.json.JsonMapper;

import java.io.IOException;
import java.nio.file.Path;

/**
 * 分词流水线配置
 *
 * 支持从CLI参数或JSON配置文件注入，覆盖Constants默认值
 */
public class TokenizerConfig {
    private ScopeMode scopeMode = ScopeMode.NONE;
    private boolean allowMixedIndent = false;
    private String commentMarker = Constants.DEFAULT_COMMENT_MARKER;
    private String whitespace = Constants.DEFAULT_WHITESPACE;
    private String scopeStart = Constants.DEFAULT_SCOPE_START;
    private String scopeEnd = Constants.DEFAULT_SCOPE_END;
    private boolean numbers = true;
    private boolean strings = true;
    private boolean booleans = true;
    private boolean operators = true;
    private boolean identifiers = true;

    public ScopeMode getScopeMode() {
        return scopeMode;
    }

    public void setScopeMode(ScopeMode scopeMode) {
        this.scopeMode = scopeMode;
    }

    public boolean isAllowMixedIndent() {
        return allowMixedIndent;
    }

    public void setAllowMixedIndent(boolean allowMixedIndent) {
        this.allowMixedIndent = allowMixedIndent;
    }

    /**
     * 注释标记，为空表示不识别注释
     */
    public String getCommentMarker() {
        return commentMarker;
    }

    public void setCommentMarker(String commentMarker) {
        this.commentMarker = commentMarker;
    }

    public String getWhitespace() {
        return whitespace;
    }

    public void setWhitespace(String whitespace) {
        this.whitespace = whitespace;
    }

    public String getScopeStart() {
        return scopeStart;
    }

    public void setScopeStart(String scopeStart) {
        this.scopeStart = scopeStart;
    }

    public String getScopeEnd() {
        return scopeEnd;
    }

    public void setScopeEnd(String scopeEnd) {
        this.scopeEnd = scopeEnd;
    }

    public boolean isNumbers() {
        return numbers;
    }

    public void setNumbers(boolean numbers) {
        this.numbers = numbers;
    }

    public boolean isStrings() {
        return strings;
    }

    public void setStrings(boolean strings) {
        this.strings = strings;
    }

    public boolean isBooleans() {
        return booleans;
    }

    public void setBooleans(boolean booleans) {
        this.booleans = booleans;
    }

    public boolean isOperators() {
        return operators;
    }

    public void setOperators(boolean operators) {
        this.operators = operators;
    }

    public boolean isIdentifiers() {
        return identifiers;
    }

    public void setIdentifiers(boolean identifiers) {
        this.identifiers = identifiers;
    }

    /**
     * 使用默认配置创建实例
     */
    public static TokenizerConfig defaults() {
        return new TokenizerConfig();
    }

    /**
     * 从JSON文件加载配置，未出现的字段保持默认值
     */
    public static TokenizerConfig load(Path configFile) throws IOException {
        ObjectMapper mapper = JsonMapper.builder()
            .enable(MapperFeature.ACCEPT_CASE_INSENSITIVE_ENUMS)
            .enable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
            .build();
        return mapper.readValue(configFile.toFile(), TokenizerConfig.class);
    }
}
