package com.retokenizer.config;

/**
 * 全局常量定义
 *
 * 包含诊断输出参数、默认处理器参数和命令行限制
 */
public final class Constants {
    private Constants() {
        // 工具类，禁止实例化
    }

    // ==================== 诊断输出 ====================
    /** 指示行中制表符展开的列宽 */
    public static final int TAB_DISPLAY_WIDTH = 4;

    // ==================== 默认处理器参数 ====================
    /** 默认注释标记 */
    public static final String DEFAULT_COMMENT_MARKER = "#";
    /** 默认作为空白跳过的字符 */
    public static final String DEFAULT_WHITESPACE = " \t";
    /** 默认作用域起始符号 */
    public static final String DEFAULT_SCOPE_START = "{";
    /** 默认作用域结束符号 */
    public static final String DEFAULT_SCOPE_END = "}";

    // ==================== 命令行限制 ====================
    /** 单次输入的最大字符数（16M） */
    public static final int MAX_INPUT_CHARS = 16 * 1024 * 1024;
}
