package org.yangtree.compiler.resolve.passes;

import java.util.Map;

import org.yangtree.compiler.resolve.IResolutionPass;
import org.yangtree.compiler.resolve.ResolutionContext;

/**
 * Pass 10: gives every node without a namespace the namespace of the module its name
 * belongs to.
 */
public final class NamespaceAssignmentPass implements IResolutionPass {

    @Override
    public String name() {
        return "namespace-assignment";
    }

    @Override
    public void apply(ResolutionContext context) {
        Map<String, String> namespaces = context.getNamespaces();
        context.getRoot().walk(node -> {
            if (node.getNamespace() == null && node.getName().isExplicit()) {
                node.setNamespace(namespaces.get(node.getName().module()));
            }
        });
    }
}
