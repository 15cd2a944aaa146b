package org.yangtree.compiler.resolve.passes;

import java.util.Iterator;
import java.util.List;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yangtree.compiler.api.ModelProcessingException;
import org.yangtree.compiler.frontend.builder.BuilderNode;
import org.yangtree.compiler.resolve.IResolutionPass;
import org.yangtree.compiler.resolve.ResolutionContext;
import org.yangtree.compiler.resolve.SchemaNavigator;

/**
 * Pass 2: grafts the children of every module-level {@code augment} under its target.
 * <p>
 * An augment may target nodes that only exist once another augment has been applied, so
 * augments are retried in rounds until all are applied. A round without progress means the
 * remaining targets can never appear; compilation then fails naming the first of them.
 * The result is independent of the order in which augments were declared.
 */
public final class AugmentPass implements IResolutionPass {

    private static final Logger log = LoggerFactory.getLogger(AugmentPass.class);

    @Override
    public String name() {
        return "augment";
    }

    @Override
    public void apply(ResolutionContext context) {
        List<BuilderNode> pending = context.getTree().getAugments();
        int round = 0;
        while (!pending.isEmpty()) {
            round++;
            boolean progress = false;
            for (Iterator<BuilderNode> it = pending.iterator(); it.hasNext(); ) {
                BuilderNode augment = it.next();
                Optional<BuilderNode> target = SchemaNavigator.resolve(augment, augment.getTargetPath(),
                        SchemaNavigator.Axis.SCHEMA);
                if (target.isEmpty()) {
                    continue;
                }
                graft(augment, target.get());
                it.remove();
                progress = true;
            }
            if (!progress) {
                BuilderNode first = pending.get(0);
                throw new ModelProcessingException("Cannot resolve augment target '" + first.getTargetPath()
                        + "' declared in " + first.getSource() + ":" + first.getLine()
                        + " (" + pending.size() + " augment(s) unresolved)");
            }
        }
        log.debug("Applied all augments in {} round(s)", round);
    }

    private static void graft(BuilderNode augment, BuilderNode target) {
        for (BuilderNode child : List.copyOf(augment.getChildren())) {
            child.detach();
            target.addChild(BuilderNode.caseWrapped(target, child));
        }
        augment.detach();
    }
}
