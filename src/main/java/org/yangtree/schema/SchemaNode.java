package org.yangtree.schema;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import org.yangtree.compiler.model.Identifier;
import org.yangtree.compiler.model.SchemaPath;
import org.yangtree.compiler.model.StatementKind;
import org.yangtree.compiler.model.Status;
import org.yangtree.compiler.types.YangType;

/**
 * Read-only view of one node of a {@link CompiledSchema}.
 * <p>
 * Two views are equal when they refer to the same index of the same schema instance.
 */
public final class SchemaNode {

    private final CompiledSchema schema;
    private final int index;

    SchemaNode(CompiledSchema schema, int index) {
        this.schema = schema;
        this.index = index;
    }

    public CompiledSchema schema() {
        return schema;
    }

    public int index() {
        return index;
    }

    private SchemaNodeData data() {
        return schema.data(index);
    }

    public Identifier name() {
        return data().name();
    }

    public StatementKind kind() {
        return NodeFlags.kind(data().flags());
    }

    public Optional<SchemaNode> parent() {
        int parent = data().parent();
        return parent < 0 ? Optional.empty() : Optional.of(new SchemaNode(schema, parent));
    }

    public List<SchemaNode> children() {
        List<SchemaNode> children = new ArrayList<>();
        for (int child : data().children()) {
            children.add(new SchemaNode(schema, child));
        }
        return children;
    }

    public YangType type() {
        return data().type();
    }

    public boolean isConfig() {
        return NodeFlags.isConfig(data().flags());
    }

    public boolean isPresence() {
        return NodeFlags.isPresence(data().flags());
    }

    public boolean isUserOrdered() {
        return NodeFlags.isUserOrdered(data().flags());
    }

    public boolean isMandatory() {
        return NodeFlags.isMandatory(data().flags());
    }

    public Status status() {
        return NodeFlags.status(data().flags());
    }

    public String units() {
        return data().units();
    }

    public String namespace() {
        return data().namespace();
    }

    public List<String> defaults() {
        return data().defaults();
    }

    /**
     * The single default of a leaf, or {@code null}.
     */
    public String defaultValue() {
        List<String> defaults = data().defaults();
        return defaults.isEmpty() ? null : defaults.get(defaults.size() - 1);
    }

    public List<String> keys() {
        return data().keys();
    }

    public SchemaPath targetPath() {
        return data().targetPath();
    }

    public List<Identifier> identityBases() {
        return data().identityBases();
    }

    public String argument() {
        return data().argument();
    }

    /**
     * Finds a data child by name, looking through modules, choices and cases. A lazy
     * (unqualified) name matches on the local name only.
     */
    public Optional<SchemaNode> findDataChild(Identifier childName) {
        for (SchemaNode child : children()) {
            StatementKind childKind = child.kind();
            if (childKind.isDataNode() && matches(childName, child.name())) {
                return Optional.of(child);
            }
            if (isTransparent(childKind)) {
                Optional<SchemaNode> nested = child.findDataChild(childName);
                if (nested.isPresent()) {
                    return nested;
                }
            }
        }
        return Optional.empty();
    }

    public Optional<SchemaNode> findDataChild(String childName) {
        return findDataChild(Identifier.parseModel(childName));
    }

    private static boolean isTransparent(StatementKind kind) {
        return switch (kind) {
            case MODULE, SUBMODULE, CHOICE, CASE -> true;
            default -> false;
        };
    }

    private static boolean matches(Identifier wanted, Identifier actual) {
        if (wanted.isLazy() || !actual.isExplicit()) {
            return wanted.name().equals(actual.name());
        }
        return wanted.equals(actual);
    }

    @Override
    public boolean equals(Object other) {
        return other instanceof SchemaNode node && node.schema == schema && node.index == index;
    }

    @Override
    public int hashCode() {
        return System.identityHashCode(schema) * 31 + index;
    }

    @Override
    public String toString() {
        return kind().yangName() + " " + name() + "#" + index;
    }
}
