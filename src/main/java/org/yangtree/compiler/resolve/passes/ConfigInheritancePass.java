package org.yangtree.compiler.resolve.passes;

import org.yangtree.compiler.frontend.builder.BuilderNode;
import org.yangtree.compiler.resolve.IResolutionPass;
import org.yangtree.compiler.resolve.ResolutionContext;

/**
 * Pass 9: settles the effective {@code config} of every node top-down. Unspecified nodes
 * inherit from their parent and the root is configuration. Once a node is
 * {@code config false} its whole subtree is false, whatever the descendants state.
 */
public final class ConfigInheritancePass implements IResolutionPass {

    @Override
    public String name() {
        return "config-inheritance";
    }

    @Override
    public void apply(ResolutionContext context) {
        BuilderNode root = context.getRoot();
        root.setConfig(Boolean.TRUE);
        for (BuilderNode child : root.getChildren()) {
            inherit(child, true);
        }
    }

    private static void inherit(BuilderNode node, boolean parentConfig) {
        if (!parentConfig) {
            node.walk(descendant -> descendant.setConfig(Boolean.FALSE));
            return;
        }
        if (node.getConfig() == null) {
            node.setConfig(Boolean.TRUE);
        }
        for (BuilderNode child : node.getChildren()) {
            inherit(child, node.getConfig());
        }
    }
}
