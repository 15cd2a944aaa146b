package org.yangtree.compiler.resolve.replay.handlers;

import org.yangtree.compiler.frontend.builder.Instruction;
import org.yangtree.compiler.model.Keyword;
import org.yangtree.compiler.resolve.replay.IInstructionHandler;
import org.yangtree.compiler.resolve.replay.ReplayContext;
import org.yangtree.compiler.resolve.replay.TypeSpec;

/**
 * Handles {@code enum} and {@code bit} members and their {@code value} / {@code position}.
 * Members without an explicit value get one above the highest assigned so far.
 */
public final class EnumMemberHandler implements IInstructionHandler {

    @Override
    public void enter(ReplayContext context, Instruction instruction) {
        switch (instruction.keyword()) {
            case ENUM -> context.currentType(instruction).addEnum(requireName(context, instruction));
            case BIT -> context.currentType(instruction).addBit(requireName(context, instruction));
            case VALUE -> {
                TypeSpec spec = enclosingSpec(context, instruction, Keyword.ENUM);
                spec.setLastEnumValue(parse(context, instruction).intValue());
            }
            case POSITION -> {
                TypeSpec spec = enclosingSpec(context, instruction, Keyword.BIT);
                spec.setLastBitPosition(parse(context, instruction));
            }
            default -> throw new IllegalStateException("Not an enum member statement: " + instruction.keyword());
        }
    }

    private static TypeSpec enclosingSpec(ReplayContext context, Instruction instruction, Keyword expected) {
        if (context.enclosingKeyword().filter(keyword -> keyword == expected).isEmpty()) {
            throw context.error(instruction, "'" + instruction.keyword().text() + "' must be inside '" + expected.text() + "'");
        }
        return context.currentType(instruction);
    }

    private static String requireName(ReplayContext context, Instruction instruction) {
        if (instruction.text() == null) {
            throw context.error(instruction, "'" + instruction.keyword().text() + "' requires a name");
        }
        return instruction.text();
    }

    private static Long parse(ReplayContext context, Instruction instruction) {
        try {
            return Long.parseLong(instruction.text().trim());
        } catch (NumberFormatException | NullPointerException e) {
            throw context.error(instruction, "Invalid " + instruction.keyword().text() + " '" + instruction.text() + "'");
        }
    }
}
