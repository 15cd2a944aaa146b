package org.yangtree.compiler.resolve.passes;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import org.yangtree.compiler.api.InternalSchemaException;
import org.yangtree.compiler.api.ModelProcessingException;
import org.yangtree.compiler.frontend.builder.Blueprint;
import org.yangtree.compiler.frontend.builder.BuilderNode;
import org.yangtree.compiler.frontend.builder.Instruction;
import org.yangtree.compiler.model.Identifier;
import org.yangtree.compiler.model.StatementKind;
import org.yangtree.compiler.resolve.IResolutionPass;
import org.yangtree.compiler.resolve.ResolutionContext;
import org.yangtree.compiler.resolve.SchemaNavigator;

/**
 * Pass 1: replaces every {@code uses} with an independent copy of its grouping's body.
 * <p>
 * Groupings are expanded innermost-first: the body of a grouping is itself expanded once
 * (names still lazy) and kept as a template; each {@code uses} in the data tree receives a
 * fresh deep copy of that template, bound to the module the {@code uses} was written in.
 * {@code refine} and {@code augment} statements under the {@code uses} are applied to the copy
 * before it is spliced in at the position of the {@code uses}. A copy placed directly under a
 * {@code choice} gets an implicit {@code case} per shorthand node.
 */
public final class GroupingExpansionPass implements IResolutionPass {

    private static final Identifier SCOPE_NAME = Identifier.builtin("uses-scope");

    @Override
    public String name() {
        return "grouping-expansion";
    }

    @Override
    public void apply(ResolutionContext context) {
        Expansion expansion = new Expansion(context.getTree().getGroupings());
        expansion.expandAll(context.getRoot(), true);
        context.getRoot().walk(node -> {
            if (node.getKind() == StatementKind.USES) {
                throw new InternalSchemaException("uses survived grouping expansion: " + node.describe());
            }
        });
    }

    private static final class Expansion {

        private final Map<Identifier, BuilderNode> groupings;
        private final Map<Identifier, BuilderNode> templates = new HashMap<>();
        private final Set<Identifier> inProgress = new LinkedHashSet<>();

        Expansion(Map<Identifier, BuilderNode> groupings) {
            this.groupings = groupings;
        }

        /**
         * Expands all uses below {@code node}, children before parents.
         *
         * @param bind whether lazy names are bound (false while building a grouping template).
         */
        void expandAll(BuilderNode node, boolean bind) {
            for (BuilderNode child : List.copyOf(node.getChildren())) {
                expandAll(child, bind);
            }
            if (node.getKind() == StatementKind.USES) {
                expandUse(node, bind);
            }
        }

        private void expandUse(BuilderNode uses, boolean bind) {
            BuilderNode template = template(uses);
            BuilderNode scope = new BuilderNode(SCOPE_NAME, StatementKind.CONTAINER, uses.getModule(),
                    uses.getSource(), uses.getLine());
            for (BuilderNode body : template.getChildren()) {
                BuilderNode copy = body.deepCopy();
                if (bind) {
                    bindNames(copy, uses.getModule());
                }
                scope.addChild(copy);
            }

            for (BuilderNode statement : List.copyOf(uses.getChildren())) {
                switch (statement.getKind()) {
                    case REFINE -> refine(scope, statement);
                    case AUGMENT -> augment(scope, statement, bind);
                    default -> {
                    }
                }
            }

            BuilderNode parent = uses.getParent();
            int index = uses.indexInParent();
            uses.detach();
            List<BuilderNode> expanded = new ArrayList<>();
            for (BuilderNode copy : List.copyOf(scope.getChildren())) {
                copy.detach();
                expanded.add(BuilderNode.caseWrapped(parent, copy));
            }
            parent.insertChildren(index, expanded);
        }

        private BuilderNode template(BuilderNode uses) {
            Identifier name = uses.getName();
            BuilderNode cached = templates.get(name);
            if (cached != null) {
                return cached;
            }
            BuilderNode grouping = groupings.get(name);
            if (grouping == null) {
                throw new ModelProcessingException("Unknown grouping '" + name + "' in " + uses.describe());
            }
            if (!inProgress.add(name)) {
                throw new ModelProcessingException("Circular grouping reference: " + String.join(" -> ",
                        inProgress.stream().map(Identifier::toString).toList()) + " -> " + name);
            }
            BuilderNode template = grouping.deepCopy();
            expandAll(template, false);
            inProgress.remove(name);
            templates.put(name, template);
            return template;
        }

        private void refine(BuilderNode scope, BuilderNode refine) {
            BuilderNode target = SchemaNavigator.resolve(scope, refine.getTargetPath(), SchemaNavigator.Axis.SCHEMA)
                    .orElseThrow(() -> new ModelProcessingException("Refine target '" + refine.getTargetPath()
                            + "' not found in " + refine.describe()));
            List<Instruction> replacement = refine.getBlueprint();
            for (Instruction statement : Blueprint.topLevel(replacement)) {
                Blueprint.removeTopLevel(target.getBlueprint(), existing -> existing.keyword() == statement.keyword());
            }
            target.getBlueprint().addAll(replacement);
        }

        private void augment(BuilderNode scope, BuilderNode augment, boolean bind) {
            BuilderNode target = SchemaNavigator.resolve(scope, augment.getTargetPath(), SchemaNavigator.Axis.SCHEMA)
                    .orElseThrow(() -> new ModelProcessingException("Augment target '" + augment.getTargetPath()
                            + "' not found in " + augment.describe()));
            for (BuilderNode child : List.copyOf(augment.getChildren())) {
                child.detach();
                if (bind) {
                    bindNames(child, augment.getModule());
                }
                target.addChild(BuilderNode.caseWrapped(target, child));
            }
        }

        private static void bindNames(BuilderNode subtree, String module) {
            subtree.walk(node -> node.setName(node.getName().bindTo(module)));
        }
    }
}
