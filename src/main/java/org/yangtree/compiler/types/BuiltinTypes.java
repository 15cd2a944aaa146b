package org.yangtree.compiler.types;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.Map;
import java.util.Set;

/**
 * Names and value bounds of the YANG built-in types.
 */
public final class BuiltinTypes {

    public static final String INT8 = "int8";
    public static final String INT16 = "int16";
    public static final String INT32 = "int32";
    public static final String INT64 = "int64";
    public static final String UINT8 = "uint8";
    public static final String UINT16 = "uint16";
    public static final String UINT32 = "uint32";
    public static final String UINT64 = "uint64";
    public static final String DECIMAL64 = "decimal64";
    public static final String STRING = "string";
    public static final String BOOLEAN = "boolean";
    public static final String EMPTY = "empty";
    public static final String BINARY = "binary";
    public static final String INSTANCE_IDENTIFIER = "instance-identifier";
    public static final String ENUMERATION = "enumeration";
    public static final String BITS = "bits";
    public static final String UNION = "union";
    public static final String IDENTITYREF = "identityref";
    public static final String LEAFREF = "leafref";

    /** Upper bound of every {@code length} restriction. */
    public static final BigInteger MAX_LENGTH = new BigInteger("18446744073709551615");

    private static final Map<String, BigInteger[]> INTEGRAL_BOUNDS = Map.of(
            INT8, bounds(Byte.MIN_VALUE, Byte.MAX_VALUE),
            INT16, bounds(Short.MIN_VALUE, Short.MAX_VALUE),
            INT32, bounds(Integer.MIN_VALUE, Integer.MAX_VALUE),
            INT64, bounds(Long.MIN_VALUE, Long.MAX_VALUE),
            UINT8, bounds(0, 255),
            UINT16, bounds(0, 65535),
            UINT32, bounds(0, 4294967295L),
            UINT64, new BigInteger[] {BigInteger.ZERO, MAX_LENGTH});

    private static final Set<String> PRIMITIVES = Set.of(
            INT8, INT16, INT32, INT64, UINT8, UINT16, UINT32, UINT64,
            DECIMAL64, STRING, BOOLEAN, EMPTY, BINARY, INSTANCE_IDENTIFIER);

    private static final Set<String> CONSTRUCTED = Set.of(ENUMERATION, BITS, UNION, IDENTITYREF, LEAFREF);

    private BuiltinTypes() {
    }

    private static BigInteger[] bounds(long min, long max) {
        return new BigInteger[] {BigInteger.valueOf(min), BigInteger.valueOf(max)};
    }

    public static boolean isBuiltin(String name) {
        return PRIMITIVES.contains(name) || CONSTRUCTED.contains(name);
    }

    public static boolean isPrimitive(String name) {
        return PRIMITIVES.contains(name);
    }

    public static boolean isIntegral(String name) {
        return INTEGRAL_BOUNDS.containsKey(name);
    }

    /** Whether the type accepts a {@code range} restriction. */
    public static boolean hasRange(String name) {
        return isIntegral(name) || DECIMAL64.equals(name);
    }

    /** Whether the type accepts a {@code length} restriction. */
    public static boolean hasLength(String name) {
        return STRING.equals(name) || BINARY.equals(name);
    }

    public static BigInteger integralMin(String name) {
        return integralBounds(name)[0];
    }

    public static BigInteger integralMax(String name) {
        return integralBounds(name)[1];
    }

    /**
     * Smallest decimal64 value for the given number of fraction digits.
     */
    public static BigDecimal decimal64Min(int fractionDigits) {
        return BigDecimal.valueOf(Long.MIN_VALUE, fractionDigits);
    }

    /**
     * Largest decimal64 value for the given number of fraction digits.
     */
    public static BigDecimal decimal64Max(int fractionDigits) {
        return BigDecimal.valueOf(Long.MAX_VALUE, fractionDigits);
    }

    private static BigInteger[] integralBounds(String name) {
        BigInteger[] bounds = INTEGRAL_BOUNDS.get(name);
        if (bounds == null) {
            throw new IllegalArgumentException("Not an integral type: " + name);
        }
        return bounds;
    }
}
