package org.yangtree.compiler.types;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.Base64;
import java.util.Objects;

/**
 * A built-in scalar type with its optional restrictions.
 *
 * @param name           the built-in type name, e.g. {@code uint8} or {@code string}.
 * @param range          the range restriction for numeric types, or {@code null}.
 * @param length         the length restriction for {@code string}/{@code binary}, or {@code null}.
 * @param fractionDigits the fraction digits of {@code decimal64}, or {@code null}.
 */
public record PrimitiveType(String name, String range, String length, Integer fractionDigits) implements YangType {

    public PrimitiveType {
        Objects.requireNonNull(name, "name");
        if (!BuiltinTypes.isPrimitive(name)) {
            throw new IllegalArgumentException("Not a primitive type: " + name);
        }
    }

    public static PrimitiveType of(String name) {
        return new PrimitiveType(name, null, null, null);
    }

    public PrimitiveType withRange(String newRange) {
        return new PrimitiveType(name, newRange, length, fractionDigits);
    }

    public PrimitiveType withLength(String newLength) {
        return new PrimitiveType(name, range, newLength, fractionDigits);
    }

    public boolean isIntegral() {
        return BuiltinTypes.isIntegral(name);
    }

    @Override
    public String wireTypeName() {
        return name;
    }

    @Override
    public String toWireString(Object value) {
        if (isIntegral()) {
            if (value instanceof Boolean flag) {
                return flag ? "1" : "0";
            }
            if (isIntegralValue(value)) {
                return value.toString();
            }
            throw mismatch(value);
        }
        return switch (name) {
            case BuiltinTypes.BOOLEAN -> {
                if (value instanceof Boolean flag) {
                    yield flag ? "true" : "false";
                }
                throw mismatch(value);
            }
            case BuiltinTypes.EMPTY -> {
                if (value == EmptyValue.INSTANCE) {
                    yield "";
                }
                throw mismatch(value);
            }
            case BuiltinTypes.BINARY -> {
                if (value instanceof byte[] bytes) {
                    yield Base64.getEncoder().encodeToString(bytes);
                }
                if (value instanceof CharSequence text) {
                    yield text.toString();
                }
                throw mismatch(value);
            }
            case BuiltinTypes.DECIMAL64 -> {
                if (value instanceof BigDecimal decimal) {
                    yield decimal.toPlainString();
                }
                if (value instanceof Number || value instanceof CharSequence) {
                    yield value.toString();
                }
                throw mismatch(value);
            }
            default -> {
                if (value instanceof CharSequence || value instanceof Number) {
                    yield value.toString();
                }
                throw mismatch(value);
            }
        };
    }

    @Override
    public Object toValue(String text) {
        if (isIntegral()) {
            return parseIntegral(text);
        }
        return switch (name) {
            case BuiltinTypes.BOOLEAN -> {
                if ("true".equals(text)) {
                    yield Boolean.TRUE;
                }
                if ("false".equals(text)) {
                    yield Boolean.FALSE;
                }
                throw new TypeMismatchException("Invalid boolean value '" + text + "'");
            }
            case BuiltinTypes.EMPTY -> {
                if (text == null || text.isBlank()) {
                    yield EmptyValue.INSTANCE;
                }
                throw new TypeMismatchException("Type 'empty' takes no value but got '" + text + "'");
            }
            case BuiltinTypes.BINARY -> {
                try {
                    yield Base64.getDecoder().decode(text.trim());
                } catch (IllegalArgumentException e) {
                    throw new TypeMismatchException("Invalid base64 value '" + text + "'", e);
                }
            }
            case BuiltinTypes.DECIMAL64 -> {
                try {
                    yield new BigDecimal(text.trim());
                } catch (NumberFormatException e) {
                    throw new TypeMismatchException("Invalid decimal64 value '" + text + "'", e);
                }
            }
            default -> text;
        };
    }

    @Override
    public boolean checkFieldValue(Object value) {
        if (isIntegral()) {
            return isIntegralValue(value) && withinBounds(new BigInteger(value.toString()));
        }
        return switch (name) {
            case BuiltinTypes.BOOLEAN -> value instanceof Boolean;
            case BuiltinTypes.EMPTY -> value == EmptyValue.INSTANCE;
            case BuiltinTypes.BINARY -> value instanceof byte[] || value instanceof CharSequence;
            case BuiltinTypes.DECIMAL64 -> value instanceof CharSequence text
                    ? isDecimalText(text.toString())
                    : value instanceof Number;
            default -> value instanceof CharSequence;
        };
    }

    // text must parse and fit the declared fraction digits
    private boolean isDecimalText(String text) {
        BigDecimal parsed;
        try {
            parsed = new BigDecimal(text.trim());
        } catch (NumberFormatException e) {
            return false;
        }
        return fractionDigits == null || parsed.stripTrailingZeros().scale() <= fractionDigits;
    }

    private Object parseIntegral(String text) {
        BigInteger parsed;
        try {
            parsed = new BigInteger(text.trim());
        } catch (NumberFormatException | NullPointerException e) {
            throw new TypeMismatchException("Invalid " + name + " value '" + text + "'", e);
        }
        if (!withinBounds(parsed)) {
            throw new TypeMismatchException("Value " + text + " is out of bounds for " + name);
        }
        return parsed.bitLength() < 64 ? (Object) parsed.longValue() : parsed;
    }

    private boolean withinBounds(BigInteger value) {
        return value.compareTo(BuiltinTypes.integralMin(name)) >= 0
                && value.compareTo(BuiltinTypes.integralMax(name)) <= 0;
    }

    private static boolean isIntegralValue(Object value) {
        return value instanceof Long || value instanceof Integer || value instanceof Short
                || value instanceof Byte || value instanceof BigInteger;
    }

    private TypeMismatchException mismatch(Object value) {
        String shape = value == null ? "null" : value.getClass().getSimpleName();
        return new TypeMismatchException("Cannot render " + shape + " value '" + value + "' as " + name);
    }
}
