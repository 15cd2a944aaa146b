package org.yangtree.compiler.resolve;

import java.util.EnumSet;
import java.util.Optional;
import java.util.Set;

import org.yangtree.compiler.frontend.builder.BuilderNode;
import org.yangtree.compiler.model.Identifier;
import org.yangtree.compiler.model.SchemaPath;
import org.yangtree.compiler.model.StatementKind;

/**
 * Resolves schema paths over the mutable tree.
 * <p>
 * Two axes exist. The {@link Axis#SCHEMA} axis addresses schema nodes including
 * {@code choice} and {@code case}, as augment, deviation and refine targets do. The
 * {@link Axis#DATA} axis addresses instance-data nodes only and looks through choices and
 * cases, as leafref paths do. On both axes module and submodule nodes are transparent.
 * <p>
 * A lazy step, or a step compared against a node whose name is still lazy, matches on the
 * local name alone.
 */
public final class SchemaNavigator {

    /**
     * Which nodes a path step can address and which are looked through.
     */
    public enum Axis {
        SCHEMA(EnumSet.of(StatementKind.CONTAINER, StatementKind.LIST, StatementKind.LEAF, StatementKind.LEAF_LIST,
                StatementKind.CHOICE, StatementKind.CASE, StatementKind.ANYDATA, StatementKind.ANYXML,
                StatementKind.NOTIFICATION, StatementKind.RPC, StatementKind.ACTION,
                StatementKind.INPUT, StatementKind.OUTPUT),
                EnumSet.of(StatementKind.MODULE, StatementKind.SUBMODULE, StatementKind.USES)),
        DATA(EnumSet.of(StatementKind.CONTAINER, StatementKind.LIST, StatementKind.LEAF, StatementKind.LEAF_LIST,
                StatementKind.ANYDATA, StatementKind.ANYXML, StatementKind.NOTIFICATION, StatementKind.RPC,
                StatementKind.ACTION, StatementKind.INPUT, StatementKind.OUTPUT),
                EnumSet.of(StatementKind.MODULE, StatementKind.SUBMODULE, StatementKind.USES,
                        StatementKind.CHOICE, StatementKind.CASE));

        private final Set<StatementKind> addressable;
        private final Set<StatementKind> transparent;

        Axis(Set<StatementKind> addressable, Set<StatementKind> transparent) {
            this.addressable = addressable;
            this.transparent = transparent;
        }
    }

    private SchemaNavigator() {
    }

    /**
     * Resolves {@code path} starting at {@code context}; absolute paths start at the root of the
     * tree {@code context} belongs to.
     *
     * @return the addressed node, or empty if any step does not resolve.
     */
    public static Optional<BuilderNode> resolve(BuilderNode context, SchemaPath path, Axis axis) {
        BuilderNode node = path.absolute() ? rootOf(context) : context;
        for (Identifier step : path.steps()) {
            if (step.equals(SchemaPath.PARENT)) {
                node = parentOf(node, axis);
                if (node == null) {
                    return Optional.empty();
                }
                continue;
            }
            Optional<BuilderNode> child = findChild(node, step, axis);
            if (child.isEmpty()) {
                return Optional.empty();
            }
            node = child.get();
        }
        return Optional.of(node);
    }

    /**
     * Finds the first addressable descendant named {@code step}, looking through transparent
     * nodes in document order.
     */
    public static Optional<BuilderNode> findChild(BuilderNode parent, Identifier step, Axis axis) {
        for (BuilderNode child : parent.getChildren()) {
            if (axis.addressable.contains(child.getKind()) && matches(step, child.getName())) {
                return Optional.of(child);
            }
            if (axis.transparent.contains(child.getKind())) {
                Optional<BuilderNode> nested = findChild(child, step, axis);
                if (nested.isPresent()) {
                    return nested;
                }
            }
        }
        return Optional.empty();
    }

    /**
     * The nearest ancestor addressable on {@code axis}, or the root; {@code null} above the root.
     */
    public static BuilderNode parentOf(BuilderNode node, Axis axis) {
        BuilderNode parent = node.getParent();
        while (parent != null && parent.getParent() != null && !axis.addressable.contains(parent.getKind())) {
            parent = parent.getParent();
        }
        return parent;
    }

    public static BuilderNode rootOf(BuilderNode node) {
        BuilderNode root = node;
        while (root.getParent() != null) {
            root = root.getParent();
        }
        return root;
    }

    static boolean matches(Identifier step, Identifier name) {
        if (step.isLazy() || name.isLazy()) {
            return step.name().equals(name.name());
        }
        return step.equals(name);
    }
}
