package org.yangtree.compiler.resolve.replay.handlers;

import java.util.Arrays;

import org.yangtree.compiler.frontend.builder.BuilderNode;
import org.yangtree.compiler.frontend.builder.Instruction;
import org.yangtree.compiler.model.StatementKind;
import org.yangtree.compiler.resolve.replay.IInstructionHandler;
import org.yangtree.compiler.resolve.replay.ReplayContext;

/**
 * Handles the textual node attributes {@code default}, {@code key}, {@code units} and
 * {@code namespace}. A leaf-list collects every default; other nodes keep the last one.
 */
public final class ValueAttributeHandler implements IInstructionHandler {

    @Override
    public void enter(ReplayContext context, Instruction instruction) {
        if (!context.isTopLevel()) {
            return;
        }
        BuilderNode node = context.node();
        String text = instruction.text();
        switch (instruction.keyword()) {
            case DEFAULT -> {
                if (text == null) {
                    throw context.error(instruction, "'default' requires a value");
                }
                if (node.getKind() != StatementKind.LEAF_LIST) {
                    node.getDefaults().clear();
                }
                node.getDefaults().add(text);
            }
            case KEY -> {
                node.getKeys().clear();
                if (text != null && !text.isBlank()) {
                    node.getKeys().addAll(Arrays.asList(text.trim().split("\\s+")));
                }
            }
            case UNITS -> node.setUnits(text);
            case NAMESPACE -> {
                if (node.getKind() != StatementKind.MODULE) {
                    throw context.error(instruction, "'namespace' is only allowed in a module");
                }
                if (text == null) {
                    throw context.error(instruction, "'namespace' requires a URI");
                }
                node.setNamespace(text);
                context.resolution().registerNamespace(node.getName().name(), text);
            }
            default -> throw new IllegalStateException("Not a value attribute: " + instruction.keyword());
        }
    }
}
