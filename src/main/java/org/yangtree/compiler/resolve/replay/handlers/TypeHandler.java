package org.yangtree.compiler.resolve.replay.handlers;

import org.yangtree.compiler.frontend.builder.Instruction;
import org.yangtree.compiler.model.Identifier;
import org.yangtree.compiler.resolve.replay.IInstructionHandler;
import org.yangtree.compiler.resolve.replay.ReplayContext;
import org.yangtree.compiler.resolve.replay.TypeSpec;

/**
 * Handles {@code type}. A type nested in another open type is a union member; the outermost
 * type is materialized and assigned to the node when its statement closes. Each replayed
 * {@code type} statement replaces any type assigned before, so the last one wins.
 */
public final class TypeHandler implements IInstructionHandler {

    @Override
    public void enter(ReplayContext context, Instruction instruction) {
        if (!(instruction.argument() instanceof Identifier name)) {
            throw context.error(instruction, "'type' requires a type name");
        }
        TypeSpec spec = new TypeSpec(name, instruction.line());
        if (context.hasOpenType()) {
            context.currentType(instruction).addMember(spec);
        }
        context.pushType(spec);
    }

    @Override
    public void leave(ReplayContext context, Instruction instruction) {
        TypeSpec spec = context.popType();
        if (!context.hasOpenType()) {
            context.node().setType(spec.build());
        }
    }
}
