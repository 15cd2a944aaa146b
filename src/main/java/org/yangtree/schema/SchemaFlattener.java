package org.yangtree.schema;

import it.unimi.dsi.fastutil.ints.IntArrayList;
import it.unimi.dsi.fastutil.objects.ObjectArrayList;
import org.yangtree.compiler.frontend.builder.BuilderNode;
import org.yangtree.compiler.resolve.ResolutionContext;

/**
 * Final step of compilation: copies the resolved mutable tree into the arena of a
 * {@link CompiledSchema} in one pre-order walk. The root lands at index 0 and every parent
 * precedes its children.
 */
public final class SchemaFlattener {

    /**
     * Flattens the tree of {@code context} together with its namespace and annotation tables.
     */
    public CompiledSchema flatten(ResolutionContext context) {
        ObjectArrayList<SchemaNodeData> arena = new ObjectArrayList<>();
        append(context.getRoot(), -1, arena);
        return new CompiledSchema(arena, context.getNamespaces(), context.getAnnotations());
    }

    private static int append(BuilderNode node, int parent, ObjectArrayList<SchemaNodeData> arena) {
        int index = arena.size();
        // reserve the slot so children get higher indices than their parent
        arena.add(null);
        IntArrayList children = new IntArrayList(node.getChildren().size());
        for (BuilderNode child : node.getChildren()) {
            children.add(append(child, index, arena));
        }
        int flags = NodeFlags.pack(node.getKind(), node.isPresence(), node.isUserOrdered(),
                Boolean.TRUE.equals(node.getConfig()), node.isMandatory(), node.getStatus());
        arena.set(index, new SchemaNodeData(node.getName(), parent, children, flags, node.getType(),
                node.getUnits(), node.getNamespace(), node.getDefaults(), node.getKeys(), node.getTargetPath(),
                node.getIdentityBases(), node.getArgument()));
        return index;
    }
}
