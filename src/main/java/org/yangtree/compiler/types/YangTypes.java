package org.yangtree.compiler.types;

import java.util.function.Predicate;
import java.util.function.UnaryOperator;

/**
 * Structural helpers over {@link YangType} trees (unions nest member types).
 */
public final class YangTypes {

    private YangTypes() {
    }

    /**
     * Rebuilds a type bottom-up, applying {@code mapper} to every non-union type.
     * Unions are rebuilt from their mapped members and therefore deduplicated again.
     */
    public static YangType rewrite(YangType type, UnaryOperator<YangType> mapper) {
        if (type instanceof UnionType union) {
            return new UnionType(union.members().stream().map(member -> rewrite(member, mapper)).toList());
        }
        return mapper.apply(type);
    }

    /**
     * Whether {@code predicate} holds for the type or, for unions, for any nested member.
     */
    public static boolean anyMatch(YangType type, Predicate<YangType> predicate) {
        if (type instanceof UnionType union) {
            return union.members().stream().anyMatch(member -> anyMatch(member, predicate));
        }
        return predicate.test(type);
    }
}
