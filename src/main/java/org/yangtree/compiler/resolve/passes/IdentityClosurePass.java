package org.yangtree.compiler.resolve.passes;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Deque;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

import org.yangtree.compiler.model.Identifier;
import org.yangtree.compiler.model.StatementKind;
import org.yangtree.compiler.resolve.IResolutionPass;
import org.yangtree.compiler.resolve.ResolutionContext;
import org.yangtree.compiler.types.IdentityRefType;
import org.yangtree.compiler.types.YangTypes;

/**
 * Pass 7: computes, for every identityref, the identities transitively derived from its
 * bases. The bases themselves are not legal values. Value sets are sorted so the compiled
 * schema does not depend on declaration order.
 */
public final class IdentityClosurePass implements IResolutionPass {

    private static final Comparator<Identifier> ORDER = Comparator
            .comparing((Identifier id) -> id.module() == null ? "" : id.module())
            .thenComparing(Identifier::name);

    @Override
    public String name() {
        return "identity-closure";
    }

    @Override
    public void apply(ResolutionContext context) {
        Map<Identifier, List<Identifier>> derived = new HashMap<>();
        context.getRoot().walk(node -> {
            if (node.getKind() == StatementKind.IDENTITY) {
                for (Identifier base : node.getIdentityBases()) {
                    derived.computeIfAbsent(base, key -> new ArrayList<>()).add(node.getName());
                }
            }
        });

        Map<Identifier, Set<Identifier>> closures = new HashMap<>();
        context.getRoot().walk(node -> {
            if (node.getType() == null) {
                return;
            }
            node.setType(YangTypes.rewrite(node.getType(), type -> {
                if (!(type instanceof IdentityRefType identityRef)) {
                    return type;
                }
                Set<Identifier> values = new TreeSet<>(ORDER);
                for (Identifier base : identityRef.bases()) {
                    values.addAll(closures.computeIfAbsent(base, key -> closure(key, derived)));
                }
                return identityRef.withValues(new LinkedHashSet<>(values));
            }));
        });
    }

    private static Set<Identifier> closure(Identifier base, Map<Identifier, List<Identifier>> derived) {
        Set<Identifier> result = new TreeSet<>(ORDER);
        Deque<Identifier> work = new ArrayDeque<>(derived.getOrDefault(base, List.of()));
        while (!work.isEmpty()) {
            Identifier identity = work.pop();
            if (result.add(identity)) {
                work.addAll(derived.getOrDefault(identity, List.of()));
            }
        }
        return result;
    }
}
