package com.retokenizer.text;

/**
 * 分词失败：某个偏移处没有处理器能继续，或处理器自身报告了语义错误。
 *
 * 处理器只知道偏移；Tokenizer 在抛出前补上源文本，使消息中带有可直接展示的指示行。
 */
public class TokenizationException extends RuntimeException {
    private final String reason;
    private final int offset;
    private PositionView position;

    public TokenizationException(String reason, int offset) {
        this(reason, offset, null);
    }

    public TokenizationException(String reason, int offset, Throwable cause) {
        super(reason, cause);
        this.reason = reason;
        this.offset = offset;
    }

    public String getReason() {
        return reason;
    }

    public int getOffset() {
        return offset;
    }

    /**
     * 源文本尚未关联时返回 null。
     */
    public PositionView getPosition() {
        return position;
    }

    public boolean isLocated() {
        return position != null;
    }

    /**
     * 关联源文本，仅第一次调用生效。
     */
    public TokenizationException locate(String source) {
        if (position == null && source != null) {
            position = new PositionView(source, offset);
        }
        return this;
    }

    @Override
    public String getMessage() {
        if (position == null) {
            return reason + " (offset " + offset + ")";
        }
        return reason + ":\n" + position.render();
    }
}
