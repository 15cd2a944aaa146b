package org.yangtree.compiler.resolve.passes;

import org.yangtree.compiler.frontend.builder.BuilderNode;
import org.yangtree.compiler.resolve.IResolutionPass;
import org.yangtree.compiler.resolve.ResolutionContext;

/**
 * Pass 11: drops all blueprints once replay has consumed them.
 */
public final class InstructionCleanupPass implements IResolutionPass {

    @Override
    public String name() {
        return "instruction-cleanup";
    }

    @Override
    public void apply(ResolutionContext context) {
        context.getRoot().walk(node -> node.getBlueprint().clear());
        for (BuilderNode typedef : context.getTree().getTypedefs().values()) {
            typedef.getBlueprint().clear();
        }
    }
}
