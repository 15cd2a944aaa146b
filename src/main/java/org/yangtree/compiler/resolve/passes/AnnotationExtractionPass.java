package org.yangtree.compiler.resolve.passes;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.yangtree.compiler.api.ModelProcessingException;
import org.yangtree.compiler.frontend.builder.BuilderNode;
import org.yangtree.compiler.model.Identifier;
import org.yangtree.compiler.model.StatementKind;
import org.yangtree.compiler.resolve.IResolutionPass;
import org.yangtree.compiler.resolve.ResolutionContext;
import org.yangtree.compiler.types.EnumerationType;
import org.yangtree.schema.AnnotationDefinition;

/**
 * Pass 12: moves metadata annotation definitions out of the tree into the annotation table
 * and registers the NETCONF {@code operation} attribute every edit may carry.
 */
public final class AnnotationExtractionPass implements IResolutionPass {

    public static final String NETCONF_MODULE = "ietf-netconf";
    public static final String NETCONF_NAMESPACE = "urn:ietf:params:xml:ns:netconf:base:1.0";
    public static final Identifier OPERATION = Identifier.of(NETCONF_MODULE, "operation");

    @Override
    public String name() {
        return "annotation-extraction";
    }

    @Override
    public void apply(ResolutionContext context) {
        context.registerAnnotation(operationAnnotation());

        List<BuilderNode> annotations = new ArrayList<>();
        context.getRoot().walk(node -> {
            if (node.getKind() == StatementKind.ANNOTATE) {
                annotations.add(node);
            }
        });
        for (BuilderNode node : annotations) {
            if (node.getType() == null) {
                throw new ModelProcessingException("Annotation without a type: " + node.describe());
            }
            String namespace = node.getNamespace() != null
                    ? node.getNamespace()
                    : context.getNamespaces().get(node.getName().module());
            context.registerAnnotation(new AnnotationDefinition(node.getName(), node.getType(), namespace, node.getUnits()));
            node.detach();
        }
    }

    private static AnnotationDefinition operationAnnotation() {
        Map<String, Integer> operations = new LinkedHashMap<>();
        operations.put("merge", 0);
        operations.put("replace", 1);
        operations.put("create", 2);
        operations.put("delete", 3);
        operations.put("remove", 4);
        return new AnnotationDefinition(OPERATION, new EnumerationType(operations), NETCONF_NAMESPACE, null);
    }
}
