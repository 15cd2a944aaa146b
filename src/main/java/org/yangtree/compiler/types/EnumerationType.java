package org.yangtree.compiler.types;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * An enumeration with its members and their assigned values, in declaration order.
 *
 * @param values enum name to integer value.
 */
public record EnumerationType(Map<String, Integer> values) implements YangType {

    public EnumerationType {
        values = Collections.unmodifiableMap(new LinkedHashMap<>(values));
    }

    @Override
    public String wireTypeName() {
        return BuiltinTypes.ENUMERATION;
    }

    @Override
    public String toWireString(Object value) {
        if (value instanceof CharSequence text && values.containsKey(text.toString())) {
            return text.toString();
        }
        throw new TypeMismatchException("'" + value + "' is not a member of enumeration " + values.keySet());
    }

    @Override
    public Object toValue(String text) {
        if (!values.containsKey(text)) {
            throw new TypeMismatchException("'" + text + "' is not a member of enumeration " + values.keySet());
        }
        return text;
    }

    @Override
    public boolean checkFieldValue(Object value) {
        return value instanceof CharSequence text && values.containsKey(text.toString());
    }
}
