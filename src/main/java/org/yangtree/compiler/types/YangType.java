package org.yangtree.compiler.types;

/**
 * A resolved YANG type as attached to leaves, leaf-lists, typedefs and annotations.
 * <p>
 * Implementations are immutable value objects; two types with equal content are equal,
 * which is what union member deduplication relies on.
 */
public interface YangType {

    /**
     * Renders a native value as wire text.
     *
     * @param value the native value (see {@link #toValue(String)} for the supported shapes).
     * @return the wire representation.
     * @throws TypeMismatchException if the value has a shape this type cannot render.
     */
    String toWireString(Object value);

    /**
     * Converts wire text into the native value for this type.
     *
     * @param text the wire text.
     * @return the native value.
     * @throws TypeMismatchException if the text does not fit the type.
     */
    Object toValue(String text);

    /**
     * Structural acceptance test for a native value.
     */
    boolean checkFieldValue(Object value);

    /**
     * The YANG name of the type's base, e.g. {@code uint8}, {@code union} or {@code identityref}.
     */
    String wireTypeName();
}
