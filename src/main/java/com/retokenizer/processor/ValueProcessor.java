package com.retokenizer.processor;

import com.retokenizer.text.TokenizationException;
import com.retokenizer.token.Token;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.function.Function;
import java.util.regex.Matcher;

/**
 * 按 (正则, 类型) 列表识别字面值，并把捕获文本转换成对应类型的值。
 *
 * 每个子模式的值取自它的首个捕获组；没有捕获组的子模式会被整体包成一个捕获组。
 */
public class ValueProcessor implements TokenProcessor {

    private static final Map<Class<?>, Function<String, ?>> DEFAULT_CONVERTERS = Map.<Class<?>, Function<String, ?>>of(
        String.class, Function.identity(),
        Integer.class, Integer::valueOf,
        Long.class, Long::valueOf,
        Float.class, Float::valueOf,
        Double.class, Double::valueOf,
        BigInteger.class, BigInteger::new,
        BigDecimal.class, BigDecimal::new
    );

    /**
     * 构造参数：converter 为 null 时使用类型自身的文本解析。
     */
    public record ValueExpression(String regex, Class<?> type, Function<String, ?> converter) {

        public static ValueExpression of(String regex, Class<?> type) {
            return new ValueExpression(regex, type, null);
        }

        public static ValueExpression of(String regex, Class<?> type, Function<String, ?> converter) {
            return new ValueExpression(regex, type, converter);
        }
    }

    private final RegexAlternation alternation;

    public ValueProcessor(ValueExpression... expressions) {
        this(List.of(expressions));
    }

    public ValueProcessor(List<ValueExpression> expressions) {
        List<RegexAlternation.Alternative> alternatives = new ArrayList<>(expressions.size());
        for (ValueExpression expression : expressions) {
            if (expression.type() == null) {
                throw new IllegalArgumentException("值类型不能为空: " + expression.regex());
            }
            Function<String, ?> converter = expression.converter() != null
                ? expression.converter()
                : DEFAULT_CONVERTERS.get(expression.type());
            if (converter == null) {
                throw new IllegalArgumentException("类型没有默认转换器，请显式提供: " + expression.type().getName());
            }
            alternatives.add(RegexAlternation.Alternative.of(expression.regex(), true, expression.type(), converter));
        }
        this.alternation = RegexAlternation.of(alternatives);
    }

    private ValueProcessor(RegexAlternation alternation) {
        this.alternation = alternation;
    }

    /**
     * 数字：优先匹配带小数点的 Double；整数不超过 18 位时为 Long，更长的为 BigInteger。
     * 18 位以内的整数一定落在 long 的范围内。
     */
    public static ValueProcessor number() {
        return new ValueProcessor(
            ValueExpression.of("-?\\d*\\.\\d+", Double.class),
            ValueExpression.of("-?\\d{1,18}+(?!\\d)", Long.class),
            ValueExpression.of("-?\\d+", BigInteger.class));
    }

    /**
     * 单引号或双引号字符串，允许转义同种引号，非贪婪。
     */
    public static ValueProcessor quotedString() {
        return new ValueProcessor(
            ValueExpression.of("\"((?:\\\\\"|[^\"])*?)\"", String.class),
            ValueExpression.of("'((?:\\\\'|[^'])*?)'", String.class));
    }

    /**
     * 不区分大小写的 true/false。
     */
    public static ValueProcessor bool() {
        return new ValueProcessor(
            ValueExpression.of("(?i:true|false)", Boolean.class,
                text -> text.toLowerCase(Locale.ROOT).equals("true")));
    }

    public RegexAlternation getAlternation() {
        return alternation;
    }

    @Override
    public List<Emission> process(String content, int offset) {
        Matcher matcher = alternation.pattern().matcher(content).region(offset, content.length());
        if (!matcher.lookingAt() || matcher.end() == offset) {
            return List.of();
        }

        int fired = alternation.firedAlternative(matcher);
        if (fired < 0) {
            throw new IllegalStateException("值模式匹配成功但首个捕获组未参与匹配: " + alternation.pattern());
        }
        RegexAlternation.Alternative alternative = alternation.alternatives().get(fired);
        String text = matcher.group(alternation.firstGroupOf(fired));

        Object value;
        try {
            value = alternative.converter().apply(text);
        } catch (RuntimeException exception) {
            throw new TokenizationException(
                "Cannot convert '" + text + "' to " + alternative.type().getSimpleName(), offset, exception);
        }
        return List.of(Emission.of(new Token.Value(alternative.type(), value), matcher.end() - offset));
    }

    /**
     * 合并两个值处理器，当前处理器的子模式在前。
     */
    public ValueProcessor merge(ValueProcessor other) {
        return new ValueProcessor(alternation.concat(other.alternation));
    }
}
