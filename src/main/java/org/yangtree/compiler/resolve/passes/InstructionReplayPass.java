package org.yangtree.compiler.resolve.passes;

import org.yangtree.compiler.frontend.builder.BuilderNode;
import org.yangtree.compiler.resolve.IResolutionPass;
import org.yangtree.compiler.resolve.ResolutionContext;
import org.yangtree.compiler.resolve.replay.InstructionHandlerRegistry;
import org.yangtree.compiler.resolve.replay.InstructionReplayer;

/**
 * Pass 4: replays the blueprint of every node in the tree and of every typedef, turning the
 * recorded attribute statements into typed node fields. The tree has its final shape at this
 * point, so each instruction is interpreted exactly once where it ends up.
 */
public final class InstructionReplayPass implements IResolutionPass {

    private final InstructionReplayer replayer;

    public InstructionReplayPass() {
        this(InstructionHandlerRegistry.initializeWithDefaults());
    }

    public InstructionReplayPass(InstructionHandlerRegistry registry) {
        this.replayer = new InstructionReplayer(registry);
    }

    @Override
    public String name() {
        return "instruction-replay";
    }

    @Override
    public void apply(ResolutionContext context) {
        context.getRoot().walk(node -> replayer.replay(node, context));
        for (BuilderNode typedef : context.getTree().getTypedefs().values()) {
            replayer.replay(typedef, context);
        }
    }
}
