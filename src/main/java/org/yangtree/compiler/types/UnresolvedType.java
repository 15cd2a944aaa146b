package org.yangtree.compiler.types;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

import org.yangtree.compiler.api.InternalSchemaException;
import org.yangtree.compiler.model.Identifier;

/**
 * Placeholder for a reference to a typedef, carrying the restrictions written at the use site.
 *
 * @param name           the referenced typedef.
 * @param range          range restriction at the use site, or {@code null}.
 * @param length         length restriction at the use site, or {@code null}.
 * @param fractionDigits fraction digits at the use site, or {@code null}.
 * @param enumSubset     enum members restated at the use site (restricting the typedef), possibly empty.
 * @param bitSubset      bits restated at the use site, possibly empty.
 */
public record UnresolvedType(Identifier name, String range, String length, Integer fractionDigits,
                             Map<String, Integer> enumSubset, Map<String, Long> bitSubset) implements YangType {

    public UnresolvedType {
        Objects.requireNonNull(name, "name");
        enumSubset = Collections.unmodifiableMap(new LinkedHashMap<>(enumSubset));
        bitSubset = Collections.unmodifiableMap(new LinkedHashMap<>(bitSubset));
    }

    public static UnresolvedType of(Identifier name) {
        return new UnresolvedType(name, null, null, null, Map.of(), Map.of());
    }

    @Override
    public String wireTypeName() {
        throw unresolved();
    }

    @Override
    public String toWireString(Object value) {
        throw unresolved();
    }

    @Override
    public Object toValue(String text) {
        throw unresolved();
    }

    @Override
    public boolean checkFieldValue(Object value) {
        throw unresolved();
    }

    private InternalSchemaException unresolved() {
        return new InternalSchemaException("Type '" + name + "' was never resolved");
    }
}
