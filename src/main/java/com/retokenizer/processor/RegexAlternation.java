package com.retokenizer.processor;

import java.util.ArrayList;
import java.util.List;
import java.util.function.Function;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * 由多个子模式组成的正则选择式，并记录每个子模式对应的捕获组与语义类型。
 *
 * 合并只做子模式列表拼接：左侧在前，因此先列出者优先的规则在任意合并顺序下都保持一致。
 * 每个子模式中的数字反向引用在拼接时按前面的捕获组数量重新编号。
 */
public final class RegexAlternation {

    /**
     * 单个子模式。type 与 converter 仅对值处理器有意义，序列处理器中为 null。
     */
    public record Alternative(String regex, int groupCount, Class<?> type, Function<String, ?> converter) {

        /**
         * 编译校验子模式；wrapUngrouped 为 true 且没有捕获组时包一层捕获组。
         */
        public static Alternative of(String regex, boolean wrapUngrouped, Class<?> type, Function<String, ?> converter) {
            if (regex == null || regex.isEmpty()) {
                throw new IllegalArgumentException("子模式不能为空");
            }
            int groupCount = Pattern.compile(regex).matcher("").groupCount();
            if (groupCount == 0 && wrapUngrouped) {
                return new Alternative("(" + regex + ")", 1, type, converter);
            }
            return new Alternative(regex, groupCount, type, converter);
        }
    }

    private final List<Alternative> alternatives;
    private final int[] firstGroups;
    private final Pattern pattern;

    private RegexAlternation(List<Alternative> alternatives) {
        if (alternatives.isEmpty()) {
            throw new IllegalArgumentException("至少需要一个子模式");
        }
        this.alternatives = List.copyOf(alternatives);
        this.firstGroups = new int[alternatives.size()];

        StringBuilder combined = new StringBuilder();
        int groupsBefore = 0;
        for (int index = 0; index < alternatives.size(); index++) {
            Alternative alternative = alternatives.get(index);
            if (index > 0) {
                combined.append('|');
            }
            combined.append(shiftBackReferences(alternative.regex(), groupsBefore, alternative.groupCount()));
            firstGroups[index] = groupsBefore + 1;
            groupsBefore += alternative.groupCount();
        }
        this.pattern = Pattern.compile(combined.toString());
    }

    public static RegexAlternation of(List<Alternative> alternatives) {
        return new RegexAlternation(alternatives);
    }

    public Pattern pattern() {
        return pattern;
    }

    public List<Alternative> alternatives() {
        return alternatives;
    }

    /**
     * 返回第 index 个子模式在合并后正则中的首个捕获组编号。
     */
    public int firstGroupOf(int index) {
        return firstGroups[index];
    }

    /**
     * 以当前在前、other 在后的顺序合并出新的选择式。
     */
    public RegexAlternation concat(RegexAlternation other) {
        List<Alternative> merged = new ArrayList<>(alternatives.size() + other.alternatives.size());
        merged.addAll(alternatives);
        merged.addAll(other.alternatives);
        return new RegexAlternation(merged);
    }

    /**
     * 找出命中的子模式：首个捕获组参与了匹配的第一个子模式；找不到时返回 -1。
     */
    public int firedAlternative(Matcher matcher) {
        for (int index = 0; index < alternatives.size(); index++) {
            if (alternatives.get(index).groupCount() > 0 && matcher.start(firstGroups[index]) >= 0) {
                return index;
            }
        }
        return -1;
    }

    /**
     * 将子模式中的 \N 反向引用整体平移 shift，\Q...\E 引用段原样保留。
     */
    static String shiftBackReferences(String regex, int shift, int groupCount) {
        if (shift == 0 || groupCount == 0) {
            return regex;
        }
        StringBuilder shifted = new StringBuilder(regex.length() + 8);
        int index = 0;
        while (index < regex.length()) {
            char current = regex.charAt(index);
            if (current != '\\' || index + 1 >= regex.length()) {
                shifted.append(current);
                index++;
                continue;
            }

            char next = regex.charAt(index + 1);
            if (next == 'Q') {
                int quoteEnd = regex.indexOf("\\E", index + 2);
                int stop = quoteEnd < 0 ? regex.length() : quoteEnd + 2;
                shifted.append(regex, index, stop);
                index = stop;
                continue;
            }
            if (next >= '1' && next <= '9') {
                int reference = next - '0';
                int cursor = index + 2;
                while (cursor < regex.length() && Character.isDigit(regex.charAt(cursor))) {
                    int candidate = reference * 10 + (regex.charAt(cursor) - '0');
                    if (candidate > groupCount) {
                        break;
                    }
                    reference = candidate;
                    cursor++;
                }
                // 包一层非捕获组，避免与后续字面数字连读
                shifted.append("(?:\\").append(reference + shift).append(')');
                index = cursor;
                continue;
            }
            shifted.append(current).append(next);
            index += 2;
        }
        return shifted.toString();
    }
}
