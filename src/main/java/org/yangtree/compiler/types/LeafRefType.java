package org.yangtree.compiler.types;

import org.yangtree.compiler.api.InternalSchemaException;
import org.yangtree.compiler.model.SchemaPath;

/**
 * Placeholder for a leafref until the referenced leaf's type is substituted.
 *
 * @param path            the referenced path.
 * @param requireInstance the {@code require-instance} setting.
 */
public record LeafRefType(SchemaPath path, boolean requireInstance) implements YangType {

    @Override
    public String wireTypeName() {
        return BuiltinTypes.LEAFREF;
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
        return new InternalSchemaException("Leafref to '" + path + "' was never resolved");
    }
}
