package org.yangtree.compiler.types;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

import org.yangtree.compiler.api.ModelProcessingException;

/**
 * Rewrites range and length expressions into canonical numeric form: {@code min}/{@code max}
 * replaced by the bounds of the underlying type, parts sorted, overlapping or adjacent
 * parts merged. Parts are joined with {@code |}.
 */
public final class RangeNormalizer {

    private record Interval(BigDecimal low, BigDecimal high) {
    }

    private RangeNormalizer() {
    }

    /**
     * Normalizes the {@code range} of a numeric primitive type.
     *
     * @param expression     the range expression, or {@code null}.
     * @param typeName       the built-in type the range restricts.
     * @param fractionDigits fraction digits for {@code decimal64}, otherwise ignored.
     * @return the canonical expression, or {@code null} if {@code expression} is null.
     */
    public static String normalizeRange(String expression, String typeName, Integer fractionDigits) {
        if (expression == null) {
            return null;
        }
        if (BuiltinTypes.isIntegral(typeName)) {
            return normalize(expression,
                    new BigDecimal(BuiltinTypes.integralMin(typeName)),
                    new BigDecimal(BuiltinTypes.integralMax(typeName)),
                    true);
        }
        if (BuiltinTypes.DECIMAL64.equals(typeName)) {
            int digits = fractionDigits == null ? 0 : fractionDigits;
            return normalize(expression,
                    BuiltinTypes.decimal64Min(digits),
                    BuiltinTypes.decimal64Max(digits),
                    false);
        }
        throw new ModelProcessingException("Type '" + typeName + "' does not take a range restriction");
    }

    /**
     * Normalizes a {@code length} expression; lengths range over {@code 0..2^64-1}.
     */
    public static String normalizeLength(String expression) {
        if (expression == null) {
            return null;
        }
        return normalize(expression, BigDecimal.ZERO, new BigDecimal(BuiltinTypes.MAX_LENGTH), true);
    }

    private static String normalize(String expression, BigDecimal min, BigDecimal max, boolean integral) {
        List<Interval> intervals = new ArrayList<>();
        for (String part : expression.split("\\|")) {
            String[] bounds = part.split("\\.\\.", -1);
            if (bounds.length > 2) {
                throw new ModelProcessingException("Malformed range part '" + part.trim() + "' in '" + expression + "'");
            }
            BigDecimal low = bound(bounds[0], min, max, expression);
            BigDecimal high = bounds.length == 2 ? bound(bounds[1], min, max, expression) : low;
            if (low.compareTo(high) > 0) {
                throw new ModelProcessingException("Range part '" + part.trim() + "' has its lower bound above its upper bound");
            }
            intervals.add(new Interval(low, high));
        }
        intervals.sort(Comparator.comparing(Interval::low));

        List<Interval> merged = new ArrayList<>();
        for (Interval next : intervals) {
            if (!merged.isEmpty()) {
                Interval last = merged.get(merged.size() - 1);
                BigDecimal reach = integral ? last.high().add(BigDecimal.ONE) : last.high();
                if (next.low().compareTo(reach) <= 0) {
                    merged.set(merged.size() - 1, new Interval(last.low(), last.high().max(next.high())));
                    continue;
                }
            }
            merged.add(next);
        }

        StringBuilder result = new StringBuilder();
        for (Interval interval : merged) {
            if (result.length() > 0) {
                result.append('|');
            }
            result.append(render(interval.low()));
            if (interval.low().compareTo(interval.high()) != 0) {
                result.append("..").append(render(interval.high()));
            }
        }
        return result.toString();
    }

    private static BigDecimal bound(String text, BigDecimal min, BigDecimal max, String expression) {
        String trimmed = text.trim();
        return switch (trimmed) {
            case "min" -> min;
            case "max" -> max;
            default -> {
                try {
                    yield new BigDecimal(trimmed);
                } catch (NumberFormatException e) {
                    throw new ModelProcessingException("Invalid bound '" + trimmed + "' in range '" + expression + "'", e);
                }
            }
        };
    }

    private static String render(BigDecimal value) {
        BigDecimal stripped = value.stripTrailingZeros();
        return stripped.scale() <= 0 ? stripped.toBigInteger().toString() : stripped.toPlainString();
    }
}
