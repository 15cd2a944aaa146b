package org.yangtree.schema;

import org.yangtree.compiler.model.Identifier;
import org.yangtree.compiler.types.YangType;

/**
 * A metadata annotation (RFC 7952) that instance data may carry as an attribute.
 *
 * @param name      the qualified annotation name.
 * @param type      the resolved value type.
 * @param namespace the namespace of the defining module.
 * @param units     the units of the value, or {@code null}.
 */
public record AnnotationDefinition(Identifier name, YangType type, String namespace, String units) {
}
