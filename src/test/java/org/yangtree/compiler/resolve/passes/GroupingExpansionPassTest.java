package org.yangtree.compiler.resolve.passes;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.yangtree.compiler.InMemoryModuleSource;
import org.yangtree.compiler.SchemaCompiler;
import org.yangtree.compiler.api.ModelProcessingException;
import org.yangtree.compiler.model.Identifier;
import org.yangtree.compiler.model.StatementKind;
import org.yangtree.compiler.types.PrimitiveType;
import org.yangtree.schema.CompiledSchema;
import org.yangtree.schema.SchemaNode;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@Tag("unit")
class GroupingExpansionPassTest {

    private static CompiledSchema compile(String text) {
        return new SchemaCompiler(new InMemoryModuleSource().with("m", text)).compile(List.of("m"));
    }

    @Test
    void eachUseGetsItsOwnCopy() {
        CompiledSchema schema = compile("""
                module m {
                  namespace "urn:m"; prefix m;
                  grouping g { leaf x { type string; } }
                  container a { uses g { refine x { default "one"; } } }
                  container b { uses g; }
                }
                """);

        SchemaNode ax = schema.find("/m:a/x").orElseThrow();
        SchemaNode bx = schema.find("/m:b/x").orElseThrow();
        assertThat(ax.index()).isNotEqualTo(bx.index());
        assertThat(ax.defaultValue()).isEqualTo("one");
        assertThat(bx.defaultValue()).isNull();
    }

    @Test
    void nestedGroupingsExpandInnermostFirst() {
        CompiledSchema schema = compile("""
                module m {
                  namespace "urn:m"; prefix m;
                  grouping inner { leaf deep { type int32; } }
                  grouping outer { container wrap { uses inner; } }
                  container top { uses outer; }
                }
                """);

        assertThat(schema.find("/m:top/wrap/deep").orElseThrow().type()).isEqualTo(PrimitiveType.of("int32"));
    }

    @Test
    void namesBindToTheModuleOfTheUse() {
        InMemoryModuleSource source = new InMemoryModuleSource()
                .with("lib", "module lib { namespace \"urn:lib\"; prefix l; grouping g { leaf x { type string; } } }")
                .with("app", """
                        module app {
                          namespace "urn:app"; prefix a;
                          import lib { prefix l; }
                          container c { uses l:g; }
                        }
                        """);

        CompiledSchema schema = new SchemaCompiler(source).compile(List.of("app"));

        SchemaNode x = schema.find("/app:c/x").orElseThrow();
        assertThat(x.name()).isEqualTo(Identifier.of("app", "x"));
        assertThat(x.namespace()).isEqualTo("urn:app");
    }

    @Test
    void useUnderChoiceWrapsShorthandNodesInCases() {
        CompiledSchema schema = compile("""
                module m {
                  namespace "urn:m"; prefix m;
                  grouping g { leaf x { type string; } leaf y { type string; } }
                  container top { choice ch { uses g; } }
                }
                """);

        SchemaNode choice = schema.find("/m:top").orElseThrow().children().get(0);
        assertThat(choice.children()).extracting(SchemaNode::kind)
                .containsExactly(StatementKind.CASE, StatementKind.CASE);
        assertThat(choice.children()).extracting(node -> node.name().name()).containsExactly("x", "y");
    }

    @Test
    void augmentInsideUseTargetsTheCopy() {
        CompiledSchema schema = compile("""
                module m {
                  namespace "urn:m"; prefix m;
                  grouping g { container box { leaf x { type string; } } }
                  container top { uses g { augment box { leaf added { type uint8; } } } }
                  container other { uses g; }
                }
                """);

        assertThat(schema.find("/m:top/box/added")).isPresent();
        assertThat(schema.find("/m:other/box/added")).isEmpty();
    }

    @Test
    void unknownGroupingIsAnError() {
        assertThatThrownBy(() -> compile("module m { namespace \"urn:m\"; prefix m; container c { uses nope; } }"))
                .isInstanceOf(ModelProcessingException.class)
                .hasMessageContaining("Unknown grouping 'm:nope'");
    }

    @Test
    void circularGroupingsAreAnError() {
        assertThatThrownBy(() -> compile("""
                module m {
                  namespace "urn:m"; prefix m;
                  grouping a { container ca { uses b; } }
                  grouping b { container cb { uses a; } }
                  container c { uses a; }
                }
                """))
                .isInstanceOf(ModelProcessingException.class)
                .hasMessageContaining("Circular grouping reference: m:a -> m:b -> m:a");
    }

    @Test
    void refineOfMissingNodeIsAnError() {
        assertThatThrownBy(() -> compile("""
                module m {
                  namespace "urn:m"; prefix m;
                  grouping g { leaf x { type string; } }
                  container c { uses g { refine y { default "1"; } } }
                }
                """))
                .isInstanceOf(ModelProcessingException.class)
                .hasMessageContaining("Refine target 'y' not found");
    }
}
