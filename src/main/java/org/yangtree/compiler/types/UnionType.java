package org.yangtree.compiler.types;

import java.util.LinkedHashSet;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * A union of member types. Members are kept in declaration order and deduplicated by value.
 *
 * @param members the distinct member types.
 */
public record UnionType(List<YangType> members) implements YangType {

    private static final Logger log = LoggerFactory.getLogger(UnionType.class);

    public UnionType {
        members = List.copyOf(new LinkedHashSet<>(members));
        if (members.isEmpty()) {
            throw new IllegalArgumentException("A union needs at least one member type");
        }
    }

    @Override
    public String wireTypeName() {
        return BuiltinTypes.UNION;
    }

    @Override
    public String toWireString(Object value) {
        if (value instanceof CharSequence text) {
            return text.toString();
        }
        for (YangType member : members) {
            if (member.checkFieldValue(value)) {
                return member.toWireString(value);
            }
        }
        throw new TypeMismatchException("No member of " + this + " accepts value '" + value + "'");
    }

    /**
     * Tries each member in order and returns the first successful conversion. Text that no
     * member converts is kept as a string.
     */
    @Override
    public Object toValue(String text) {
        for (YangType member : members) {
            try {
                return member.toValue(text);
            } catch (TypeMismatchException e) {
                log.trace("Member {} rejected '{}': {}", member, text, e.getMessage());
            }
        }
        return text;
    }

    @Override
    public boolean checkFieldValue(Object value) {
        if (value instanceof CharSequence) {
            return true;
        }
        return members.stream().anyMatch(member -> member.checkFieldValue(value));
    }
}
