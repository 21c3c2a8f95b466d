package com.retokenizer.config;

/** 作用域识别方式 */
public enum ScopeMode {
    NONE,
    INDENT,
    BRACES
}
