package org.yangtree.compiler.types;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

import org.yangtree.compiler.model.Identifier;

/**
 * An identityref: the declared base identities and, once identity closure has run,
 * every identity transitively derived from them.
 *
 * @param bases  the declared base identities.
 * @param values the legal values (derived identities, excluding the bases themselves).
 */
public record IdentityRefType(List<Identifier> bases, Set<Identifier> values) implements YangType {

    public IdentityRefType {
        bases = List.copyOf(bases);
        values = Collections.unmodifiableSet(new LinkedHashSet<>(values));
    }

    public IdentityRefType withValues(Set<Identifier> resolved) {
        return new IdentityRefType(bases, resolved);
    }

    @Override
    public String wireTypeName() {
        return BuiltinTypes.IDENTITYREF;
    }

    @Override
    public String toWireString(Object value) {
        if (value instanceof CharSequence text) {
            return text.toString();
        }
        if (value instanceof Identifier identifier) {
            return identifier.toString();
        }
        throw new TypeMismatchException("Cannot render '" + value + "' as identityref");
    }

    @Override
    public Object toValue(String text) {
        return text;
    }

    /**
     * Accepts an identity given as {@code name} or {@code module:name} if it is one of the
     * derived identities.
     */
    @Override
    public boolean checkFieldValue(Object value) {
        if (value instanceof Identifier identifier) {
            return values.contains(identifier);
        }
        if (!(value instanceof CharSequence text)) {
            return false;
        }
        String candidate = text.toString();
        return values.stream().anyMatch(v -> v.name().equals(candidate) || v.toString().equals(candidate));
    }
}
