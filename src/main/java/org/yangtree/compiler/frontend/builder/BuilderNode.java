package org.yangtree.compiler.frontend.builder;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.function.Consumer;

import org.yangtree.compiler.model.Identifier;
import org.yangtree.compiler.model.SchemaPath;
import org.yangtree.compiler.model.StatementKind;
import org.yangtree.compiler.model.Status;
import org.yangtree.compiler.types.YangType;

/**
 * A node of the mutable schema tree that the builder creates and the resolution passes
 * reshape.
 * <p>
 * Every node has at most one parent and appears exactly once in that parent's children.
 * Moving a node therefore goes through {@link #detach()} followed by {@link #addChild} or
 * {@link #insertChildren}; attaching a node that still has a parent is rejected.
 * Attribute statements are kept as a blueprint of {@link Instruction}s until replay turns
 * them into the typed fields.
 */
public final class BuilderNode {

    private Identifier name;
    private final StatementKind kind;
    private final String module;
    private final String source;
    private final int line;

    private BuilderNode parent;
    private final List<BuilderNode> children = new ArrayList<>();
    private final List<Instruction> blueprint = new ArrayList<>();

    private String argument;
    private YangType type;
    private String units;
    private String namespace;
    private final List<String> defaults = new ArrayList<>();
    private boolean mandatory;
    private Status status = Status.CURRENT;
    private Boolean config;
    private boolean presence;
    private boolean userOrdered;
    private final List<String> keys = new ArrayList<>();
    private SchemaPath targetPath;
    private final List<Identifier> identityBases = new ArrayList<>();

    /**
     * @param name   the node name.
     * @param kind   the statement kind.
     * @param module the module whose text declared the node ({@code null} for the synthetic root).
     * @param source the source name for diagnostics.
     * @param line   the source line for diagnostics.
     */
    public BuilderNode(Identifier name, StatementKind kind, String module, String source, int line) {
        this.name = name;
        this.kind = kind;
        this.module = module;
        this.source = source;
        this.line = line;
    }

    /**
     * Appends {@code child} as the last child of this node.
     *
     * @throws IllegalStateException if {@code child} is still attached elsewhere.
     */
    public void addChild(BuilderNode child) {
        requireDetached(child);
        child.parent = this;
        children.add(child);
    }

    /**
     * Inserts detached nodes at {@code index}, keeping their order.
     *
     * @throws IllegalStateException if any node is still attached elsewhere.
     */
    public void insertChildren(int index, List<BuilderNode> nodes) {
        for (BuilderNode node : nodes) {
            requireDetached(node);
        }
        for (BuilderNode node : nodes) {
            node.parent = this;
        }
        children.addAll(index, nodes);
    }

    /**
     * Removes this node from its parent. Detaching a root is a no-op.
     */
    public void detach() {
        if (parent != null) {
            parent.children.remove(this);
            parent = null;
        }
    }

    /**
     * Position of this node among its parent's children, or -1 for a root.
     */
    public int indexInParent() {
        return parent == null ? -1 : parent.children.indexOf(this);
    }

    /**
     * Creates an independent copy of this subtree. The copy has no parent; blueprints and
     * collections are copied, immutable values (names, types, paths) are shared.
     */
    public BuilderNode deepCopy() {
        BuilderNode copy = new BuilderNode(name, kind, module, source, line);
        copy.blueprint.addAll(blueprint);
        copy.argument = argument;
        copy.type = type;
        copy.units = units;
        copy.namespace = namespace;
        copy.defaults.addAll(defaults);
        copy.mandatory = mandatory;
        copy.status = status;
        copy.config = config;
        copy.presence = presence;
        copy.userOrdered = userOrdered;
        copy.keys.addAll(keys);
        copy.targetPath = targetPath;
        copy.identityBases.addAll(identityBases);
        for (BuilderNode child : children) {
            copy.addChild(child.deepCopy());
        }
        return copy;
    }

    /**
     * Wraps a detached {@code child} in an implicit case named after it if it is a shorthand
     * node about to be placed under the choice {@code target}; otherwise returns it unchanged.
     */
    public static BuilderNode caseWrapped(BuilderNode target, BuilderNode child) {
        if (target.getKind() != StatementKind.CHOICE || !child.getKind().isShorthandCase()) {
            return child;
        }
        BuilderNode implicitCase = new BuilderNode(child.getName(), StatementKind.CASE, child.getModule(),
                child.getSource(), child.getLine());
        implicitCase.addChild(child);
        return implicitCase;
    }

    /**
     * Visits this node and all descendants in pre-order. The children list is snapshotted per
     * node, so the visitor may detach the node it is visiting.
     */
    public void walk(Consumer<BuilderNode> visitor) {
        visitor.accept(this);
        for (BuilderNode child : List.copyOf(children)) {
            child.walk(visitor);
        }
    }

    /**
     * Returns the first direct child of the given kind.
     */
    public Optional<BuilderNode> firstChild(StatementKind childKind) {
        return children.stream().filter(child -> child.kind == childKind).findFirst();
    }

    /**
     * A slash-separated path of names from the root, for diagnostics.
     */
    public String describe() {
        List<String> names = new ArrayList<>();
        for (BuilderNode node = this; node != null && node.parent != null; node = node.parent) {
            names.add(node.name.toString());
        }
        Collections.reverse(names);
        return kind.yangName() + " /" + String.join("/", names) + " (" + source + ":" + line + ")";
    }

    private static void requireDetached(BuilderNode node) {
        if (node.parent != null) {
            throw new IllegalStateException("Node " + node.describe() + " is already attached to "
                    + node.parent.describe());
        }
    }

    public Identifier getName() {
        return name;
    }

    public void setName(Identifier name) {
        this.name = name;
    }

    public StatementKind getKind() {
        return kind;
    }

    public String getModule() {
        return module;
    }

    public String getSource() {
        return source;
    }

    public int getLine() {
        return line;
    }

    public BuilderNode getParent() {
        return parent;
    }

    /**
     * The live children list; structural changes must go through the attach/detach methods.
     */
    public List<BuilderNode> getChildren() {
        return Collections.unmodifiableList(children);
    }

    public List<Instruction> getBlueprint() {
        return blueprint;
    }

    public String getArgument() {
        return argument;
    }

    public void setArgument(String argument) {
        this.argument = argument;
    }

    public YangType getType() {
        return type;
    }

    public void setType(YangType type) {
        this.type = type;
    }

    public String getUnits() {
        return units;
    }

    public void setUnits(String units) {
        this.units = units;
    }

    public String getNamespace() {
        return namespace;
    }

    public void setNamespace(String namespace) {
        this.namespace = namespace;
    }

    public List<String> getDefaults() {
        return defaults;
    }

    public boolean isMandatory() {
        return mandatory;
    }

    public void setMandatory(boolean mandatory) {
        this.mandatory = mandatory;
    }

    public Status getStatus() {
        return status;
    }

    public void setStatus(Status status) {
        this.status = status;
    }

    /**
     * The explicit or inherited config value; {@code null} until set by replay or inheritance.
     */
    public Boolean getConfig() {
        return config;
    }

    public void setConfig(Boolean config) {
        this.config = config;
    }

    public boolean isPresence() {
        return presence;
    }

    public void setPresence(boolean presence) {
        this.presence = presence;
    }

    public boolean isUserOrdered() {
        return userOrdered;
    }

    public void setUserOrdered(boolean userOrdered) {
        this.userOrdered = userOrdered;
    }

    public List<String> getKeys() {
        return keys;
    }

    public SchemaPath getTargetPath() {
        return targetPath;
    }

    public void setTargetPath(SchemaPath targetPath) {
        this.targetPath = targetPath;
    }

    public List<Identifier> getIdentityBases() {
        return identityBases;
    }

    @Override
    public String toString() {
        return kind.yangName() + " " + name;
    }
}
