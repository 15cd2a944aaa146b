package org.yangtree.compiler.resolve.replay.handlers;

import org.yangtree.compiler.frontend.builder.Instruction;
import org.yangtree.compiler.model.Identifier;
import org.yangtree.compiler.model.StatementKind;
import org.yangtree.compiler.resolve.replay.IInstructionHandler;
import org.yangtree.compiler.resolve.replay.ReplayContext;

/**
 * Handles {@code base}: an identityref base inside a type, or a derivation base of an identity.
 */
public final class BaseHandler implements IInstructionHandler {

    @Override
    public void enter(ReplayContext context, Instruction instruction) {
        if (!(instruction.argument() instanceof Identifier base)) {
            throw context.error(instruction, "'base' requires an identity name");
        }
        if (context.hasOpenType()) {
            context.currentType(instruction).addBase(base);
        } else if (context.node().getKind() == StatementKind.IDENTITY && context.isTopLevel()) {
            context.node().getIdentityBases().add(base);
        } else {
            throw context.error(instruction, "'base' outside of a type or identity");
        }
    }
}
