package org.yangtree.compiler.types;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A bits type: named bit positions. Values are space-separated sets of bit names.
 *
 * @param positions bit name to position, in declaration order.
 */
public record BitsType(Map<String, Long> positions) implements YangType {

    public BitsType {
        positions = Collections.unmodifiableMap(new LinkedHashMap<>(positions));
    }

    @Override
    public String wireTypeName() {
        return BuiltinTypes.BITS;
    }

    @Override
    public String toWireString(Object value) {
        if (checkFieldValue(value)) {
            return value.toString().trim();
        }
        throw new TypeMismatchException("'" + value + "' is not a valid value of bits " + positions.keySet());
    }

    @Override
    public Object toValue(String text) {
        if (!checkFieldValue(text)) {
            throw new TypeMismatchException("'" + text + "' is not a valid value of bits " + positions.keySet());
        }
        return text.trim();
    }

    @Override
    public boolean checkFieldValue(Object value) {
        if (!(value instanceof CharSequence text)) {
            return false;
        }
        String trimmed = text.toString().trim();
        if (trimmed.isEmpty()) {
            return true;
        }
        for (String bit : trimmed.split("\\s+")) {
            if (!positions.containsKey(bit)) {
                return false;
            }
        }
        return true;
    }
}
