package com.retokenizer.text;

import com.retokenizer.config.Constants;

/**
 * Token 在源文本中的位置视图，行号、所在行与列在首次访问时计算并缓存。
 */
public final class PositionView {
    private final String source;
    private final int offset;

    private Integer lineNumber;
    private Integer lineStart;
    private String line;

    public PositionView(String source, int offset) {
        if (source == null) {
            throw new IllegalStateException("没有源文本，无法计算位置");
        }
        if (offset < 0 || offset > source.length()) {
            throw new IllegalArgumentException("偏移越界: " + offset);
        }
        this.source = source;
        this.offset = offset;
    }

    public int offset() {
        return offset;
    }

    /**
     * 从 1 开始的行号。
     */
    public int lineNumber() {
        if (lineNumber == null) {
            int count = 1;
            for (int index = 0; index < offset; index++) {
                if (source.charAt(index) == '\n') {
                    count++;
                }
            }
            lineNumber = count;
        }
        return lineNumber;
    }

    /**
     * 所在行文本，不含换行符。
     */
    public String line() {
        if (line == null) {
            int start = lineStart();
            int end = source.indexOf('\n', offset);
            if (end < 0) {
                end = source.length();
            }
            if (end > start && source.charAt(end - 1) == '\r') {
                end--;
            }
            line = source.substring(Math.min(start, end), end);
        }
        return line;
    }

    /**
     * 行内从 0 开始的列。
     */
    public int column() {
        return offset - lineStart();
    }

    private int lineStart() {
        if (lineStart == null) {
            lineStart = offset == 0 ? 0 : source.lastIndexOf('\n', offset - 1) + 1;
        }
        return lineStart;
    }

    /**
     * 生成两行指示文本：展开制表符后的源码行，以及指向 token 起点的 ^。
     */
    public String render() {
        String prefix = lineNumber() + ":" + column() + ": ";
        String displayLine = line();
        int tabsBefore = 0;
        int limit = Math.min(column(), displayLine.length());
        for (int index = 0; index < limit; index++) {
            if (displayLine.charAt(index) == '\t') {
                tabsBefore++;
            }
        }
        String expanded = displayLine.replace("\t", " ".repeat(Constants.TAB_DISPLAY_WIDTH));
        int caretColumn = prefix.length() + column() + tabsBefore * (Constants.TAB_DISPLAY_WIDTH - 1);
        return prefix + expanded + "\n" + " ".repeat(caretColumn) + "^";
    }

    @Override
    public String toString() {
        return lineNumber() + ":" + column();
    }
}
