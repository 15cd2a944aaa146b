package org.yangtree.compiler.frontend.builder;

import java.util.ArrayList;
import java.util.List;
import java.util.function.Predicate;

/**
 * Operations on blueprints that respect the enter/leave nesting of instructions.
 */
public final class Blueprint {

    private Blueprint() {
    }

    /**
     * Removes every top-level statement whose enter instruction matches {@code selector},
     * together with all instructions nested inside it.
     *
     * @return the number of removed top-level statements.
     */
    public static int removeTopLevel(List<Instruction> blueprint, Predicate<Instruction> selector) {
        List<Instruction> kept = new ArrayList<>(blueprint.size());
        int depth = 0;
        int skipUntilDepth = -1;
        int removed = 0;
        for (Instruction instruction : blueprint) {
            if (instruction.enter()) {
                if (skipUntilDepth < 0 && depth == 0 && selector.test(instruction)) {
                    skipUntilDepth = depth;
                    removed++;
                }
                depth++;
                if (skipUntilDepth < 0) {
                    kept.add(instruction);
                }
            } else {
                depth--;
                if (skipUntilDepth < 0) {
                    kept.add(instruction);
                } else if (depth == skipUntilDepth) {
                    skipUntilDepth = -1;
                }
            }
        }
        blueprint.clear();
        blueprint.addAll(kept);
        return removed;
    }

    /**
     * The enter instructions at nesting depth zero, in order.
     */
    public static List<Instruction> topLevel(List<Instruction> blueprint) {
        List<Instruction> result = new ArrayList<>();
        int depth = 0;
        for (Instruction instruction : blueprint) {
            if (instruction.enter()) {
                if (depth == 0) {
                    result.add(instruction);
                }
                depth++;
            } else {
                depth--;
            }
        }
        return result;
    }
}
