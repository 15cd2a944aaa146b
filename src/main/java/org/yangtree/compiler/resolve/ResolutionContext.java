package org.yangtree.compiler.resolve;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

import org.yangtree.compiler.frontend.builder.BuilderNode;
import org.yangtree.compiler.frontend.builder.ModelTree;
import org.yangtree.compiler.model.Identifier;
import org.yangtree.schema.AnnotationDefinition;

/**
 * State shared by the resolution passes of one compilation: the tree with its side
 * registries, the module namespaces collected during replay and the annotation table.
 */
public final class ResolutionContext {

    private final ModelTree tree;
    private final Map<String, String> namespaces = new LinkedHashMap<>();
    private final Map<Identifier, AnnotationDefinition> annotations = new LinkedHashMap<>();

    public ResolutionContext(ModelTree tree) {
        this.tree = tree;
    }

    public ModelTree getTree() {
        return tree;
    }

    public BuilderNode getRoot() {
        return tree.getRoot();
    }

    public void registerNamespace(String module, String namespace) {
        namespaces.put(module, namespace);
    }

    /**
     * Module name to namespace URI, in the order the modules were replayed.
     */
    public Map<String, String> getNamespaces() {
        return Collections.unmodifiableMap(namespaces);
    }

    public void registerAnnotation(AnnotationDefinition annotation) {
        annotations.put(annotation.name(), annotation);
    }

    public Map<Identifier, AnnotationDefinition> getAnnotations() {
        return Collections.unmodifiableMap(annotations);
    }
}
