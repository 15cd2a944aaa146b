package org.yangtree.compiler.frontend.builder;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yangtree.compiler.api.ModelProcessingException;
import org.yangtree.compiler.model.Identifier;
import org.yangtree.compiler.model.StatementKind;

/**
 * The mutable tree shared by all modules of one compilation, plus the definitions that live
 * outside of it: groupings and typedefs (detached once their block closes), and the
 * module-level augments and deviations in declaration order.
 */
public final class ModelTree {

    private static final Logger log = LoggerFactory.getLogger(ModelTree.class);

    /** Name of the synthetic root container. */
    public static final Identifier ROOT_NAME = Identifier.builtin("root");

    private final BuilderNode root = new BuilderNode(ROOT_NAME, StatementKind.CONTAINER, null, "<root>", 0);
    private final Map<Identifier, BuilderNode> groupings = new LinkedHashMap<>();
    private final Map<Identifier, BuilderNode> typedefs = new LinkedHashMap<>();
    private final List<BuilderNode> augments = new ArrayList<>();
    private final List<BuilderNode> deviations = new ArrayList<>();

    public BuilderNode getRoot() {
        return root;
    }

    /**
     * @throws ModelProcessingException if a grouping with the same qualified name exists.
     */
    public void registerGrouping(BuilderNode grouping) {
        BuilderNode previous = groupings.putIfAbsent(grouping.getName(), grouping);
        if (previous != null) {
            throw new ModelProcessingException("Duplicate grouping '" + grouping.getName() + "' at "
                    + grouping.getSource() + ":" + grouping.getLine() + ", first defined at "
                    + previous.getSource() + ":" + previous.getLine());
        }
    }

    /**
     * Registers a typedef. A later typedef with the same qualified name replaces the earlier one.
     */
    public void registerTypedef(BuilderNode typedef) {
        BuilderNode previous = typedefs.put(typedef.getName(), typedef);
        if (previous != null) {
            log.warn("Typedef '{}' at {}:{} replaces the one at {}:{}", typedef.getName(),
                    typedef.getSource(), typedef.getLine(), previous.getSource(), previous.getLine());
        }
    }

    public void registerAugment(BuilderNode augment) {
        augments.add(augment);
    }

    public void registerDeviation(BuilderNode deviation) {
        deviations.add(deviation);
    }

    public Map<Identifier, BuilderNode> getGroupings() {
        return Collections.unmodifiableMap(groupings);
    }

    public Map<Identifier, BuilderNode> getTypedefs() {
        return Collections.unmodifiableMap(typedefs);
    }

    /**
     * Module-level augments not yet applied; the augment pass removes them as they resolve.
     */
    public List<BuilderNode> getAugments() {
        return augments;
    }

    public List<BuilderNode> getDeviations() {
        return deviations;
    }
}
