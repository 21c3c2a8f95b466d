package com.retokenizer.processor;

import com.retokenizer.token.Token;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * 把行首缩进深度的变化转换为 ScopeStart / ScopeEnd。
 *
 * 缩进宽度由第一次出现的非零缩进推断，之后每次深度变化都必须是它的整数倍；
 * 缩进字符（制表符或空格）一经确定不得混用。allowMixed 时，深度不变的行会释放字符锁定，
 * 下一次深度变化的行可以重新选定字符种类，宽度不会重新推断。
 *
 * 状态贯穿一次分词过程，finish 之后实例不可再用，每份输入需要新的实例。
 * 必须排在空白消耗处理器之前，否则行首缩进会先被消耗掉。
 * 只含空白的行不匹配，需要由其后的空白处理器消耗。
 */
public class IndentScopeProcessor implements TokenProcessor {

    private static final Pattern LINE_INDENT = Pattern.compile(
        "(\t++)(?=[\t ]*+[^\t \r\n])|( ++)(?=[\t ]*+[^\t \r\n])|([^\t \r\n])");

    private final boolean allowMixed;

    private int depth;
    private IndentUnit unit;
    private int width;
    private boolean finished;

    public IndentScopeProcessor() {
        this(false);
    }

    public IndentScopeProcessor(boolean allowMixed) {
        this.allowMixed = allowMixed;
    }

    public int getDepth() {
        return depth;
    }

    /**
     * 当前锁定的缩进字符，尚未确定时为 null。
     */
    public IndentUnit getUnit() {
        return unit;
    }

    /**
     * 推断出的缩进宽度，尚未推断时为 0。
     */
    public int getWidth() {
        return width;
    }

    @Override
    public List<Emission> process(String content, int offset) {
        if (finished) {
            throw new IllegalStateException("IndentScopeProcessor 已结束，请为新的输入创建新实例");
        }
        // 文本开头视为隐式行首
        if (offset >= content.length() || (offset > 0 && content.charAt(offset - 1) != '\n')) {
            return List.of();
        }
        Matcher matcher = LINE_INDENT.matcher(content).region(offset, content.length());
        if (!matcher.lookingAt()) {
            return List.of();
        }

        IndentUnit matchedUnit = null;
        if (matcher.group(1) != null) {
            matchedUnit = IndentUnit.TAB;
        } else if (matcher.group(2) != null) {
            matchedUnit = IndentUnit.SPACE;
        }
        int indentChars = matchedUnit == null ? 0 : matcher.end() - offset;
        int newDepth = indentChars;

        if (matchedUnit != null) {
            if (unit == null) {
                unit = matchedUnit;
                if (width == 0) {
                    width = indentChars;
                }
            } else if (unit != matchedUnit) {
                throw new MixedIndentException(offset, unit, matchedUnit);
            }
        }

        if (newDepth != depth) {
            int difference = Math.abs(newDepth - depth);
            if (difference % width != 0) {
                throw new InvalidIndentMultipleException(offset, width, difference);
            }
            boolean deeper = newDepth > depth;
            int levels = difference / width;
            List<Emission> emissions = new ArrayList<>(levels);
            for (int level = 0; level < levels; level++) {
                Token token = deeper ? new Token.ScopeStart() : new Token.ScopeEnd();
                emissions.add(Emission.of(token, level == 0 ? indentChars : 0));
            }
            depth = newDepth;
            return emissions;
        }

        if (newDepth != 0) {
            if (allowMixed) {
                unit = null;
            }
            return List.of(Emission.skip(indentChars));
        }
        return List.of();
    }

    /**
     * 按剩余深度（字符数）逐个产出 ScopeEnd，每个深度单位一个。
     * 宽度大于 1 时结束符数量会多于按层级计算的数量。
     */
    @Override
    public List<Token> finish() {
        if (finished) {
            throw new IllegalStateException("IndentScopeProcessor 已结束，请为新的输入创建新实例");
        }
        finished = true;
        if (depth == 0) {
            return List.of();
        }
        int openScopes = depth;
        depth = 0;
        List<Token> closing = new ArrayList<>(openScopes);
        for (int index = 0; index < openScopes; index++) {
            closing.add(new Token.ScopeEnd());
        }
        return Collections.unmodifiableList(closing);
    }
}
