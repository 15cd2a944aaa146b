package org.yangtree.schema;

import java.util.List;

import it.unimi.dsi.fastutil.ints.IntArrayList;
import it.unimi.dsi.fastutil.ints.IntList;
import it.unimi.dsi.fastutil.ints.IntLists;
import org.yangtree.compiler.model.Identifier;
import org.yangtree.compiler.model.SchemaPath;
import org.yangtree.compiler.types.YangType;

/**
 * The stored fields of one compact schema node. Parent and children are arena indices.
 *
 * @param name          qualified node name.
 * @param parent        index of the parent, -1 for the root.
 * @param children      indices of the children, in order.
 * @param flags         packed kind, booleans and status (see {@link NodeFlags}).
 * @param type          the resolved type, or {@code null}.
 * @param units         units, or {@code null}.
 * @param namespace     namespace URI, or {@code null}.
 * @param defaults      default values, possibly empty.
 * @param keys          list keys, possibly empty.
 * @param targetPath    augment/deviation/refine target, or {@code null}.
 * @param identityBases identity bases, possibly empty.
 * @param argument      raw argument of extension statements, or {@code null}.
 */
record SchemaNodeData(Identifier name, int parent, IntList children, int flags, YangType type, String units,
                      String namespace, List<String> defaults, List<String> keys, SchemaPath targetPath,
                      List<Identifier> identityBases, String argument) {

    SchemaNodeData {
        children = IntLists.unmodifiable(new IntArrayList(children));
        defaults = List.copyOf(defaults);
        keys = List.copyOf(keys);
        identityBases = List.copyOf(identityBases);
    }

    SchemaNodeData withLinks(int newParent, IntList newChildren) {
        return new SchemaNodeData(name, newParent, newChildren, flags, type, units, namespace, defaults, keys,
                targetPath, identityBases, argument);
    }
}
