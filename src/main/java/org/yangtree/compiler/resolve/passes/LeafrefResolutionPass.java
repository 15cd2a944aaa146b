package org.yangtree.compiler.resolve.passes;

import java.util.LinkedHashSet;
import java.util.Optional;
import java.util.Set;

import org.yangtree.compiler.api.InternalSchemaException;
import org.yangtree.compiler.frontend.builder.BuilderNode;
import org.yangtree.compiler.model.Identifier;
import org.yangtree.compiler.model.SchemaPath;
import org.yangtree.compiler.resolve.IResolutionPass;
import org.yangtree.compiler.resolve.ResolutionContext;
import org.yangtree.compiler.resolve.SchemaNavigator;
import org.yangtree.compiler.types.LeafRefType;
import org.yangtree.compiler.types.YangType;
import org.yangtree.compiler.types.YangTypes;

/**
 * Pass 8: substitutes every leafref with the type of the leaf its path points to.
 * <p>
 * Paths are walked over data nodes only. Unprefixed steps belong to the module of the node
 * reached so far. A leafref pointing at another leafref is resolved through the chain.
 */
public final class LeafrefResolutionPass implements IResolutionPass {

    @Override
    public String name() {
        return "leafref-resolution";
    }

    @Override
    public void apply(ResolutionContext context) {
        context.getRoot().walk(node -> resolveNode(node, new LinkedHashSet<>()));
        context.getRoot().walk(node -> {
            if (node.getType() != null && YangTypes.anyMatch(node.getType(), LeafRefType.class::isInstance)) {
                throw new InternalSchemaException("Leafref survived resolution: " + node.describe());
            }
        });
    }

    private YangType resolveNode(BuilderNode node, Set<BuilderNode> chain) {
        YangType type = node.getType();
        if (type == null || !YangTypes.anyMatch(type, LeafRefType.class::isInstance)) {
            return type;
        }
        if (!chain.add(node)) {
            throw new InternalSchemaException("Circular leafref chain through " + node.describe());
        }
        YangType resolved = YangTypes.rewrite(type, member -> {
            if (!(member instanceof LeafRefType leafref)) {
                return member;
            }
            BuilderNode target = navigate(node, leafref.path())
                    .orElseThrow(() -> new InternalSchemaException("Cannot resolve leafref path '" + leafref.path()
                            + "' of " + node.describe()));
            YangType targetType = resolveNode(target, chain);
            if (targetType == null) {
                throw new InternalSchemaException("Leafref path '" + leafref.path() + "' of " + node.describe()
                        + " points at " + target.describe() + ", which has no type");
            }
            return targetType;
        });
        chain.remove(node);
        node.setType(resolved);
        return resolved;
    }

    private static Optional<BuilderNode> navigate(BuilderNode origin, SchemaPath path) {
        BuilderNode current = path.absolute() ? SchemaNavigator.rootOf(origin) : origin;
        String module = moduleOf(origin, null);
        for (Identifier step : path.steps()) {
            if (step.equals(SchemaPath.PARENT)) {
                current = SchemaNavigator.parentOf(current, SchemaNavigator.Axis.DATA);
                if (current == null) {
                    return Optional.empty();
                }
                continue;
            }
            Identifier bound = module == null ? step : step.bindTo(module);
            Optional<BuilderNode> next = SchemaNavigator.findChild(current, bound, SchemaNavigator.Axis.DATA);
            if (next.isEmpty()) {
                return Optional.empty();
            }
            current = next.get();
            module = moduleOf(current, module);
        }
        return Optional.of(current);
    }

    private static String moduleOf(BuilderNode node, String fallback) {
        Identifier name = node.getName();
        return name.isExplicit() ? name.module() : fallback;
    }
}
