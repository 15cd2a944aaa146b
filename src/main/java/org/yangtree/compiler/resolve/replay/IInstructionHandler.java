package org.yangtree.compiler.resolve.replay;

import org.yangtree.compiler.frontend.builder.Instruction;

/**
 * Interprets one attribute keyword during blueprint replay.
 */
public interface IInstructionHandler {

    /**
     * Handles the enter event of the statement.
     *
     * @param context     the replay state of the node.
     * @param instruction the enter instruction.
     */
    void enter(ReplayContext context, Instruction instruction);

    /**
     * Handles the leave event of the statement, after all nested instructions.
     *
     * @param context     the replay state of the node.
     * @param instruction the matching enter instruction.
     */
    default void leave(ReplayContext context, Instruction instruction) {
        // most attributes are complete on enter
    }
}
