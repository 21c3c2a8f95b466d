package com.retokenizer.cli;

/**
 * 命令行输出格式。
 */
public enum OutputFormat {
    TEXT,
    JSON
}
