package org.yangtree.compiler.resolve.passes;

import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yangtree.compiler.api.ModelProcessingException;
import org.yangtree.compiler.frontend.builder.Blueprint;
import org.yangtree.compiler.frontend.builder.BuilderNode;
import org.yangtree.compiler.frontend.builder.Instruction;
import org.yangtree.compiler.model.StatementKind;
import org.yangtree.compiler.resolve.IResolutionPass;
import org.yangtree.compiler.resolve.ResolutionContext;
import org.yangtree.compiler.resolve.SchemaNavigator;

/**
 * Pass 3: applies {@code deviation} statements to their targets by editing the targets'
 * blueprints, before any blueprint is replayed.
 * <ul>
 *   <li>{@code add} appends the deviate's instructions,</li>
 *   <li>{@code delete} removes the target's top-level instructions with the same keywords,</li>
 *   <li>{@code replace} removes them and then appends the deviate's instructions,</li>
 *   <li>{@code not-supported} removes the target and its subtree.</li>
 * </ul>
 */
public final class DeviationPass implements IResolutionPass {

    private static final Logger log = LoggerFactory.getLogger(DeviationPass.class);

    @Override
    public String name() {
        return "deviation";
    }

    @Override
    public void apply(ResolutionContext context) {
        List<BuilderNode> deviations = context.getTree().getDeviations();
        for (BuilderNode deviation : deviations) {
            BuilderNode target = SchemaNavigator.resolve(deviation, deviation.getTargetPath(), SchemaNavigator.Axis.SCHEMA)
                    .orElseThrow(() -> new ModelProcessingException("Deviation target '" + deviation.getTargetPath()
                            + "' not found (" + deviation.getSource() + ":" + deviation.getLine() + ")"));
            for (BuilderNode deviate : deviation.getChildren()) {
                if (deviate.getKind() == StatementKind.DEVIATE) {
                    applyDeviate(deviate, target);
                }
            }
            deviation.detach();
        }
        log.debug("Applied {} deviation(s)", deviations.size());
        deviations.clear();
    }

    private static void applyDeviate(BuilderNode deviate, BuilderNode target) {
        String kind = deviate.getName().name();
        List<Instruction> instructions = deviate.getBlueprint();
        switch (kind) {
            case "add" -> target.getBlueprint().addAll(instructions);
            case "delete" -> removeKeywords(target, instructions);
            case "replace" -> {
                removeKeywords(target, instructions);
                target.getBlueprint().addAll(instructions);
            }
            case "not-supported" -> target.detach();
            default -> throw new ModelProcessingException("Unknown deviate kind '" + kind + "' ("
                    + deviate.getSource() + ":" + deviate.getLine() + ")");
        }
    }

    private static void removeKeywords(BuilderNode target, List<Instruction> instructions) {
        for (Instruction statement : Blueprint.topLevel(instructions)) {
            Blueprint.removeTopLevel(target.getBlueprint(), existing -> existing.keyword() == statement.keyword());
        }
    }
}
