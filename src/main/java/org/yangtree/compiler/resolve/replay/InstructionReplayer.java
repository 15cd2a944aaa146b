package org.yangtree.compiler.resolve.replay;

import org.yangtree.compiler.frontend.builder.BuilderNode;
import org.yangtree.compiler.frontend.builder.Instruction;
import org.yangtree.compiler.resolve.ResolutionContext;

/**
 * Replays a node's blueprint through the handler registry, preserving statement nesting.
 */
public final class InstructionReplayer {

    private final InstructionHandlerRegistry registry;

    public InstructionReplayer(InstructionHandlerRegistry registry) {
        this.registry = registry;
    }

    public void replay(BuilderNode node, ResolutionContext resolution) {
        ReplayContext context = new ReplayContext(node, resolution);
        for (Instruction instruction : node.getBlueprint()) {
            IInstructionHandler handler = registry.resolve(instruction.keyword())
                    .orElseThrow(() -> new IllegalStateException("No handler for " + instruction.keyword()));
            if (instruction.enter()) {
                handler.enter(context, instruction);
                context.push(instruction);
            } else {
                handler.leave(context, context.pop());
            }
        }
    }
}
