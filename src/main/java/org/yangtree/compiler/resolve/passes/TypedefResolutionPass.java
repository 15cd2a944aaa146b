package org.yangtree.compiler.resolve.passes;

import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Function;

import org.yangtree.compiler.api.InternalSchemaException;
import org.yangtree.compiler.api.ModelProcessingException;
import org.yangtree.compiler.frontend.builder.BuilderNode;
import org.yangtree.compiler.model.Identifier;
import org.yangtree.compiler.model.StatementKind;
import org.yangtree.compiler.resolve.IResolutionPass;
import org.yangtree.compiler.resolve.ResolutionContext;
import org.yangtree.compiler.types.BitsType;
import org.yangtree.compiler.types.EnumerationType;
import org.yangtree.compiler.types.PrimitiveType;
import org.yangtree.compiler.types.RangeMerger;
import org.yangtree.compiler.types.UnresolvedType;
import org.yangtree.compiler.types.YangType;
import org.yangtree.compiler.types.YangTypes;

/**
 * Pass 5: replaces every typedef reference with the typedef's resolved type.
 * <p>
 * Typedef chains are resolved recursively and memoized per typedef. Restrictions written at
 * the use site are merged over the typedef's: range and length via {@link RangeMerger},
 * fraction digits when restated, and enum or bit members restated at the use site restrict
 * the inherited set. Union members resolve independently and duplicates collapse.
 * Leaves without their own {@code default} or {@code units} inherit them from the typedef chain.
 */
public final class TypedefResolutionPass implements IResolutionPass {

    @Override
    public String name() {
        return "typedef-resolution";
    }

    @Override
    public void apply(ResolutionContext context) {
        Resolver resolver = new Resolver(context.getTree().getTypedefs());
        context.getRoot().walk(node -> {
            YangType type = node.getType();
            if (type == null) {
                return;
            }
            if (type instanceof UnresolvedType reference && isValueNode(node)) {
                if (node.getDefaults().isEmpty()) {
                    List<String> inherited = resolver.inherited(reference.name(), BuilderNode::getDefaults, List.of());
                    node.getDefaults().addAll(inherited);
                }
                if (node.getUnits() == null) {
                    node.setUnits(resolver.inherited(reference.name(), BuilderNode::getUnits, null));
                }
            }
            node.setType(resolver.resolve(type, node));
        });
        context.getRoot().walk(node -> {
            if (node.getType() != null && YangTypes.anyMatch(node.getType(), UnresolvedType.class::isInstance)) {
                throw new InternalSchemaException("Unresolved type survived typedef resolution: " + node.describe());
            }
        });
    }

    private static boolean isValueNode(BuilderNode node) {
        return node.getKind() == StatementKind.LEAF || node.getKind() == StatementKind.LEAF_LIST
                || node.getKind() == StatementKind.ANNOTATE;
    }

    private static final class Resolver {

        private final Map<Identifier, BuilderNode> typedefs;
        private final Map<Identifier, YangType> resolved = new HashMap<>();
        private final Set<Identifier> inProgress = new LinkedHashSet<>();

        Resolver(Map<Identifier, BuilderNode> typedefs) {
            this.typedefs = typedefs;
        }

        YangType resolve(YangType type, BuilderNode user) {
            return YangTypes.rewrite(type, member -> member instanceof UnresolvedType reference
                    ? refine(resolveTypedef(reference.name(), user), reference)
                    : member);
        }

        /**
         * Walks the typedef chain for the first non-empty value of {@code attribute}.
         */
        <T> T inherited(Identifier name, Function<BuilderNode, T> attribute, T empty) {
            Set<Identifier> visited = new LinkedHashSet<>();
            Identifier current = name;
            while (current != null && visited.add(current)) {
                BuilderNode typedef = typedefs.get(current);
                if (typedef == null) {
                    return empty;
                }
                T value = attribute.apply(typedef);
                if (value != null && !(value instanceof List<?> list && list.isEmpty())) {
                    return value;
                }
                current = typedef.getType() instanceof UnresolvedType next ? next.name() : null;
            }
            return empty;
        }

        private YangType resolveTypedef(Identifier name, BuilderNode user) {
            YangType cached = resolved.get(name);
            if (cached != null) {
                return cached;
            }
            BuilderNode typedef = typedefs.get(name);
            if (typedef == null) {
                throw new ModelProcessingException("Unknown type '" + name + "' used in " + user.describe());
            }
            if (typedef.getType() == null) {
                throw new ModelProcessingException("Typedef without a type: " + typedef.describe());
            }
            if (!inProgress.add(name)) {
                throw new ModelProcessingException("Circular typedef chain: " + String.join(" -> ",
                        inProgress.stream().map(Identifier::toString).toList()) + " -> " + name);
            }
            YangType type = resolve(typedef.getType(), typedef);
            inProgress.remove(name);
            resolved.put(name, type);
            return type;
        }

        private static YangType refine(YangType base, UnresolvedType reference) {
            if (base instanceof PrimitiveType primitive) {
                return new PrimitiveType(primitive.name(),
                        RangeMerger.merge(primitive.range(), reference.range()),
                        RangeMerger.merge(primitive.length(), reference.length()),
                        reference.fractionDigits() != null ? reference.fractionDigits() : primitive.fractionDigits());
            }
            if (base instanceof EnumerationType enumeration && !reference.enumSubset().isEmpty()) {
                return new EnumerationType(restrict(enumeration.values(), reference.enumSubset(), reference, "enum"));
            }
            if (base instanceof BitsType bits && !reference.bitSubset().isEmpty()) {
                return new BitsType(restrict(bits.positions(), reference.bitSubset(), reference, "bit"));
            }
            return base;
        }

        private static <V> Map<String, V> restrict(Map<String, V> inherited, Map<String, ?> subset,
                                                   UnresolvedType reference, String what) {
            Map<String, V> restricted = new LinkedHashMap<>();
            for (String member : subset.keySet()) {
                V value = inherited.get(member);
                if (value == null) {
                    throw new ModelProcessingException("Restriction of '" + reference.name() + "' names unknown "
                            + what + " '" + member + "'");
                }
                restricted.put(member, value);
            }
            return restricted;
        }
    }
}
