package org.yangtree.compiler.resolve;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.yangtree.compiler.frontend.builder.BuilderNode;
import org.yangtree.compiler.model.Identifier;
import org.yangtree.compiler.model.SchemaPath;
import org.yangtree.compiler.model.StatementKind;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

@Tag("unit")
class SchemaNavigatorTest {

    private BuilderNode root;
    private BuilderNode choice;
    private BuilderNode leaf;

    @BeforeEach
    void setUp() {
        root = node("root", null, StatementKind.CONTAINER);
        BuilderNode module = new BuilderNode(Identifier.builtin("m"), StatementKind.MODULE, "m", "m", 1);
        BuilderNode top = node("top", "m", StatementKind.CONTAINER);
        choice = node("ch", "m", StatementKind.CHOICE);
        BuilderNode caseNode = node("a", "m", StatementKind.CASE);
        leaf = node("x", "m", StatementKind.LEAF);
        root.addChild(module);
        module.addChild(top);
        top.addChild(choice);
        choice.addChild(caseNode);
        caseNode.addChild(leaf);
    }

    private static BuilderNode node(String name, String module, StatementKind kind) {
        Identifier id = module == null ? Identifier.builtin(name) : Identifier.of(module, name);
        return new BuilderNode(id, kind, module, "m", 1);
    }

    private static SchemaPath path(String... steps) {
        return new SchemaPath(true, List.of(steps).stream().map(s -> Identifier.of("m", s)).toList());
    }

    @Test
    void schemaAxisAddressesChoiceAndCase() {
        assertThat(SchemaNavigator.resolve(leaf, path("top", "ch", "a", "x"), SchemaNavigator.Axis.SCHEMA))
                .contains(leaf);
        assertThat(SchemaNavigator.resolve(leaf, path("top", "x"), SchemaNavigator.Axis.SCHEMA)).isEmpty();
    }

    @Test
    void dataAxisLooksThroughChoiceAndCase() {
        assertThat(SchemaNavigator.resolve(leaf, path("top", "x"), SchemaNavigator.Axis.DATA)).contains(leaf);
        assertThat(SchemaNavigator.resolve(leaf, path("top", "ch"), SchemaNavigator.Axis.DATA)).isEmpty();
    }

    @Test
    void parentOnDataAxisSkipsChoiceAndCase() {
        assertThat(SchemaNavigator.parentOf(leaf, SchemaNavigator.Axis.DATA).getName())
                .isEqualTo(Identifier.of("m", "top"));
        assertThat(SchemaNavigator.parentOf(leaf, SchemaNavigator.Axis.SCHEMA).getKind())
                .isEqualTo(StatementKind.CASE);
    }

    @Test
    void lazyStepMatchesByLocalName() {
        SchemaPath relative = new SchemaPath(false, List.of(Identifier.lazy("a")));

        assertThat(SchemaNavigator.resolve(choice, relative, SchemaNavigator.Axis.SCHEMA))
                .map(BuilderNode::getKind).contains(StatementKind.CASE);
    }
}
