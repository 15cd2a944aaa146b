package org.yangtree.compiler.frontend.builder;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.yangtree.compiler.api.ModelProcessingException;
import org.yangtree.compiler.frontend.lexer.Lexer;
import org.yangtree.compiler.frontend.module.ModuleQueue;
import org.yangtree.compiler.frontend.parser.StatementParser;
import org.yangtree.compiler.model.Identifier;
import org.yangtree.compiler.model.Keyword;
import org.yangtree.compiler.model.SchemaPath;
import org.yangtree.compiler.model.StatementKind;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@Tag("unit")
class StatementBuilderTest {

    private ModelTree tree;
    private ModuleQueue queue;

    @BeforeEach
    void setUp() {
        tree = new ModelTree();
        queue = new ModuleQueue();
    }

    private BuilderNode build(String text) {
        new StatementParser(new Lexer(text, "m").scanTokens(), "m").parse(new StatementBuilder(tree, queue, "m"));
        return tree.getRoot().getChildren().get(tree.getRoot().getChildren().size() - 1);
    }

    @Test
    void structuralStatementsBecomeNodesBoundToTheModule() {
        BuilderNode module = build("""
                module m {
                  namespace "urn:m";
                  prefix m;
                  container c { leaf x { type string; } }
                }
                """);

        assertThat(module.getKind()).isEqualTo(StatementKind.MODULE);
        BuilderNode container = module.firstChild(StatementKind.CONTAINER).orElseThrow();
        assertThat(container.getName()).isEqualTo(Identifier.of("m", "c"));
        BuilderNode leaf = container.getChildren().get(0);
        assertThat(leaf.getName()).isEqualTo(Identifier.of("m", "x"));
        assertThat(leaf.getBlueprint()).containsExactly(
                Instruction.enter(Keyword.TYPE, Identifier.builtin("string"), 4),
                Instruction.leave(Keyword.TYPE, 4));
        assertThat(module.getBlueprint().get(0)).isEqualTo(Instruction.enter(Keyword.NAMESPACE, "urn:m", 2));
    }

    @Test
    void importsAndIncludesAreQueuedAndPrefixesResolveTypeNames() {
        BuilderNode module = build("""
                module m {
                  prefix m;
                  import other { prefix o; }
                  include m-sub;
                  leaf x { type o:counter; }
                }
                """);

        assertThat(queue.registered()).containsExactly("other", "m-sub");
        BuilderNode leaf = module.firstChild(StatementKind.LEAF).orElseThrow();
        assertThat(leaf.getBlueprint().get(0).argument()).isEqualTo(Identifier.of("other", "counter"));
    }

    @Test
    void groupingsAreRegisteredDetachedAndKeepLazyNames() {
        BuilderNode module = build("""
                module m {
                  prefix m;
                  grouping g { leaf inner { type string; } }
                  uses g;
                }
                """);

        BuilderNode grouping = tree.getGroupings().get(Identifier.of("m", "g"));
        assertThat(grouping).isNotNull();
        assertThat(grouping.getParent()).isNull();
        assertThat(grouping.getChildren().get(0).getName().isLazy()).isTrue();
        assertThat(module.getChildren()).extracting(BuilderNode::getKind).containsExactly(StatementKind.USES);
        assertThat(module.getChildren().get(0).getName()).isEqualTo(Identifier.of("m", "g"));
    }

    @Test
    void shorthandNodeUnderChoiceGetsImplicitCase() {
        BuilderNode module = build("""
                module m {
                  prefix m;
                  choice c {
                    leaf a { type empty; }
                    case b { leaf b1 { type string; } }
                  }
                }
                """);

        BuilderNode choice = module.firstChild(StatementKind.CHOICE).orElseThrow();
        assertThat(choice.getChildren()).extracting(BuilderNode::getKind)
                .containsExactly(StatementKind.CASE, StatementKind.CASE);
        BuilderNode implicitCase = choice.getChildren().get(0);
        assertThat(implicitCase.getName()).isEqualTo(Identifier.of("m", "a"));
        assertThat(implicitCase.getChildren().get(0).getKind()).isEqualTo(StatementKind.LEAF);
    }

    @Test
    void rpcAlwaysHasInputAndOutput() {
        BuilderNode module = build("""
                module m {
                  prefix m;
                  rpc reset { input { leaf force { type boolean; } } }
                }
                """);

        BuilderNode rpc = module.firstChild(StatementKind.RPC).orElseThrow();
        assertThat(rpc.getChildren()).extracting(BuilderNode::getKind)
                .containsExactly(StatementKind.INPUT, StatementKind.OUTPUT);
    }

    @Test
    void augmentsAndDeviationsAreRegisteredWithParsedTargets() {
        build("""
                module m {
                  prefix m;
                  augment "/m:top" { leaf extra { type string; } }
                  deviation /m:top/m:old { deviate not-supported; }
                }
                """);

        assertThat(tree.getAugments()).hasSize(1);
        SchemaPath target = tree.getAugments().get(0).getTargetPath();
        assertThat(target.absolute()).isTrue();
        assertThat(target.steps()).containsExactly(Identifier.of("m", "top"));
        assertThat(tree.getDeviations()).hasSize(1);
    }

    @Test
    void unknownStatementsAreSkippedWithTheirSubstatements() {
        BuilderNode module = build("""
                module m {
                  prefix m;
                  description "text";
                  revision 2024-01-01 { description "first"; }
                  leaf x { type string; }
                }
                """);

        assertThat(module.getChildren()).extracting(BuilderNode::getKind).containsExactly(StatementKind.LEAF);
    }

    @Test
    void invalidIdentifierIsRejectedWithLocation() {
        assertThatThrownBy(() -> build("module m { prefix m; leaf 9lives { type string; } }"))
                .isInstanceOf(ModelProcessingException.class)
                .hasMessageContaining("m:1")
                .hasMessageContaining("Invalid identifier '9lives'");
    }

    @Test
    void duplicateGroupingIsAnError() {
        assertThatThrownBy(() -> build("module m { prefix m; grouping g { } grouping g { } }"))
                .isInstanceOf(ModelProcessingException.class)
                .hasMessageContaining("Duplicate grouping 'm:g'");
    }
}
