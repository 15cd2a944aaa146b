package org.yangtree.schema;

import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.yangtree.compiler.SchemaCompiler;
import org.yangtree.compiler.frontend.io.ClasspathModuleSource;
import org.yangtree.compiler.model.Identifier;
import org.yangtree.compiler.model.StatementKind;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@Tag("integration")
class CompiledSchemaTest {

    private static CompiledSchema schema;

    @BeforeAll
    static void compile() {
        schema = new SchemaCompiler(new ClasspathModuleSource("yang")).compile(List.of("example"));
    }

    @Test
    void rootIsIndexZeroAndParentsPrecedeChildren() {
        assertThat(schema.root().index()).isZero();
        assertThat(schema.root().parent()).isEmpty();
        for (int i = 1; i < schema.size(); i++) {
            SchemaNode node = schema.node(i);
            assertThat(node.parent().orElseThrow().index()).isLessThan(i);
            assertThat(node.parent().orElseThrow().children()).contains(node);
        }
    }

    @Test
    void findAcceptsQualifiedAndUnqualifiedSteps() {
        SchemaNode qualified = schema.find("/example:interfaces/example:interface/example:mtu").orElseThrow();
        SchemaNode unqualified = schema.find("/interfaces/interface/mtu").orElseThrow();

        assertThat(qualified).isEqualTo(unqualified);
        assertThat(qualified.name()).isEqualTo(Identifier.of("example", "mtu"));
    }

    @Test
    void findOfUnknownOrForeignModuleNodeIsEmpty() {
        assertThat(schema.find("/example:interfaces/nothing")).isEmpty();
        assertThat(schema.find("/example-types:interfaces")).isEmpty();
    }

    @Test
    void nodeOutsideTheArenaIsRejected() {
        assertThatThrownBy(() -> schema.node(schema.size())).isInstanceOf(IndexOutOfBoundsException.class);
        assertThatThrownBy(() -> schema.node(-1)).isInstanceOf(IndexOutOfBoundsException.class);
    }

    @Test
    void copySubtreeProducesAnIndependentSchema() {
        SchemaNode list = schema.find("/example:interfaces/interface").orElseThrow();

        CompiledSchema copy = schema.copySubtree(list);

        assertThat(copy).isNotSameAs(schema);
        assertThat(copy.root().kind()).isEqualTo(StatementKind.LIST);
        assertThat(copy.root().parent()).isEmpty();
        assertThat(copy.root().keys()).containsExactly("name");
        assertThat(copy.find("/source/port").orElseThrow().type())
                .isEqualTo(schema.find("/example:interfaces/interface/source/port").orElseThrow().type());
        assertThat(copy.namespaces()).isEqualTo(schema.namespaces());
        assertThat(copy.size()).isLessThan(schema.size());
    }

    @Test
    void viewsOfAnotherSchemaAreRejected() {
        CompiledSchema copy = schema.copySubtree(schema.find("/example:settings").orElseThrow());

        assertThatThrownBy(() -> schema.copySubtree(copy.root()))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("different schema");
    }
}
