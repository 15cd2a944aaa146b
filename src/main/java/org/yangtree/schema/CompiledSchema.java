package org.yangtree.schema;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import it.unimi.dsi.fastutil.ints.IntArrayList;
import it.unimi.dsi.fastutil.objects.ObjectArrayList;
import org.yangtree.compiler.model.Identifier;

/**
 * The compiled, immutable schema: all nodes stored in one arena and addressed by index.
 * <p>
 * Node 0 is the root. {@link SchemaNode} is a lightweight view of one index; views are only
 * valid for the schema that created them. A region of the tree is duplicated with
 * {@link #copySubtree(SchemaNode)}, which yields a new, independent schema; nodes are never
 * shared between schemas. Instances are safe to share between threads.
 * <p>
 * Usage:
 * <pre>
 *   CompiledSchema schema = compiler.compile(List.of("example"));
 *   SchemaNode port = schema.find("/example:interfaces/interface/port").orElseThrow();
 *   Object value = port.type().toValue("8080");
 * </pre>
 */
public final class CompiledSchema {

    private final ObjectArrayList<SchemaNodeData> nodes;
    private final Map<String, String> namespaces;
    private final Map<Identifier, AnnotationDefinition> annotations;

    CompiledSchema(ObjectArrayList<SchemaNodeData> nodes, Map<String, String> namespaces,
                   Map<Identifier, AnnotationDefinition> annotations) {
        if (nodes.isEmpty()) {
            throw new IllegalArgumentException("A schema needs at least a root node");
        }
        this.nodes = new ObjectArrayList<>(nodes);
        this.namespaces = Collections.unmodifiableMap(new LinkedHashMap<>(namespaces));
        this.annotations = Collections.unmodifiableMap(new LinkedHashMap<>(annotations));
    }

    public SchemaNode root() {
        return new SchemaNode(this, 0);
    }

    public int size() {
        return nodes.size();
    }

    /**
     * The view of the node at {@code index}.
     *
     * @throws IndexOutOfBoundsException if no such node exists.
     */
    public SchemaNode node(int index) {
        if (index < 0 || index >= nodes.size()) {
            throw new IndexOutOfBoundsException("No schema node at index " + index + " (size " + nodes.size() + ")");
        }
        return new SchemaNode(this, index);
    }

    /**
     * Module name to namespace URI.
     */
    public Map<String, String> namespaces() {
        return namespaces;
    }

    /**
     * Metadata annotations that data nodes may carry, by qualified name.
     */
    public Map<Identifier, AnnotationDefinition> annotations() {
        return annotations;
    }

    /**
     * Looks up a data node by a slash-separated path such as {@code /mod:a/b/c}. A step without
     * module qualifier matches by local name. Choices and cases are looked through.
     *
     * @return the node, or empty if any step does not exist.
     */
    public Optional<SchemaNode> find(String path) {
        SchemaNode current = root();
        for (String step : path.split("/")) {
            if (step.isBlank()) {
                continue;
            }
            Optional<SchemaNode> next = current.findDataChild(Identifier.parseModel(step.trim()));
            if (next.isEmpty()) {
                return Optional.empty();
            }
            current = next.get();
        }
        return Optional.of(current);
    }

    /**
     * Copies the subtree rooted at {@code node} into a new schema whose root is the copy of
     * {@code node}. Namespaces and annotations are carried over.
     *
     * @throws IllegalArgumentException if {@code node} belongs to another schema.
     */
    public CompiledSchema copySubtree(SchemaNode node) {
        int start = requireOwn(node);
        ObjectArrayList<SchemaNodeData> copy = new ObjectArrayList<>();
        copyInto(start, -1, copy);
        return new CompiledSchema(copy, namespaces, annotations);
    }

    private int copyInto(int index, int parent, ObjectArrayList<SchemaNodeData> target) {
        int copyIndex = target.size();
        target.add(null);
        SchemaNodeData original = nodes.get(index);
        IntArrayList children = new IntArrayList(original.children().size());
        for (int child : original.children()) {
            children.add(copyInto(child, copyIndex, target));
        }
        target.set(copyIndex, original.withLinks(parent, children));
        return copyIndex;
    }

    int requireOwn(SchemaNode node) {
        if (node.schema() != this) {
            throw new IllegalArgumentException("Schema node " + node + " belongs to a different schema");
        }
        return node.index();
    }

    SchemaNodeData data(int index) {
        return nodes.get(index);
    }

    List<SchemaNodeData> nodeData() {
        return Collections.unmodifiableList(nodes);
    }
}
