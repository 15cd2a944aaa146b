package org.yangtree.compiler.resolve.replay.handlers;

import org.yangtree.compiler.frontend.builder.Instruction;
import org.yangtree.compiler.model.SchemaPath;
import org.yangtree.compiler.resolve.replay.IInstructionHandler;
import org.yangtree.compiler.resolve.replay.ReplayContext;
import org.yangtree.compiler.resolve.replay.TypeSpec;

/**
 * Handles the scalar restrictions of the innermost open type: {@code range}, {@code length},
 * {@code fraction-digits}, {@code path} and {@code require-instance}.
 */
public final class TypeRestrictionHandler implements IInstructionHandler {

    @Override
    public void enter(ReplayContext context, Instruction instruction) {
        TypeSpec spec = context.currentType(instruction);
        switch (instruction.keyword()) {
            case RANGE -> spec.setRange(instruction.text());
            case LENGTH -> spec.setLength(instruction.text());
            case FRACTION_DIGITS -> spec.setFractionDigits(parseFractionDigits(context, instruction));
            case PATH -> {
                if (!(instruction.argument() instanceof SchemaPath path)) {
                    throw context.error(instruction, "'path' requires a leafref path");
                }
                spec.setPath(path);
            }
            case REQUIRE_INSTANCE -> spec.setRequireInstance(!"false".equals(instruction.text()));
            default -> throw new IllegalStateException("Not a type restriction: " + instruction.keyword());
        }
    }

    private static int parseFractionDigits(ReplayContext context, Instruction instruction) {
        try {
            int digits = Integer.parseInt(instruction.text().trim());
            if (digits < 1 || digits > 18) {
                throw context.error(instruction, "fraction-digits must be between 1 and 18 but was " + digits);
            }
            return digits;
        } catch (NumberFormatException | NullPointerException e) {
            throw context.error(instruction, "Invalid fraction-digits '" + instruction.text() + "'");
        }
    }
}
