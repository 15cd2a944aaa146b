package org.yangtree.compiler.resolve.replay.handlers;

import org.yangtree.compiler.frontend.builder.BuilderNode;
import org.yangtree.compiler.frontend.builder.Instruction;
import org.yangtree.compiler.model.Status;
import org.yangtree.compiler.resolve.replay.IInstructionHandler;
import org.yangtree.compiler.resolve.replay.ReplayContext;

/**
 * Handles the node flags {@code config}, {@code mandatory}, {@code presence},
 * {@code ordered-by} and {@code status}. Nested occurrences (e.g. {@code status} of an enum
 * member) do not describe the node and are skipped.
 */
public final class FlagAttributeHandler implements IInstructionHandler {

    @Override
    public void enter(ReplayContext context, Instruction instruction) {
        if (!context.isTopLevel()) {
            return;
        }
        BuilderNode node = context.node();
        String text = instruction.text();
        switch (instruction.keyword()) {
            case CONFIG -> node.setConfig(parseBoolean(context, instruction, "config"));
            case MANDATORY -> node.setMandatory(parseBoolean(context, instruction, "mandatory"));
            case PRESENCE -> node.setPresence(true);
            case ORDERED_BY -> {
                if (!"user".equals(text) && !"system".equals(text)) {
                    throw context.error(instruction, "Invalid ordered-by statement '" + text + "'");
                }
                node.setUserOrdered("user".equals(text));
            }
            case STATUS -> node.setStatus(Status.fromYang(text)
                    .orElseThrow(() -> context.error(instruction, "Invalid status statement '" + text + "'")));
            default -> throw new IllegalStateException("Not a flag attribute: " + instruction.keyword());
        }
    }

    private static boolean parseBoolean(ReplayContext context, Instruction instruction, String keyword) {
        String text = instruction.text();
        if ("true".equals(text)) {
            return true;
        }
        if ("false".equals(text)) {
            return false;
        }
        throw context.error(instruction, "Invalid " + keyword + " statement '" + text + "'");
    }
}
