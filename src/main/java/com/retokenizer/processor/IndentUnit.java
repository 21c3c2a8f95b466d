package com.retokenizer.processor;

/** 缩进字符种类 */
public enum IndentUnit {
    TAB("tabs"),
    SPACE("spaces");

    private final String displayName;

    IndentUnit(String displayName) {
        this.displayName = displayName;
    }

    public String displayName() {
        return displayName;
    }
}
