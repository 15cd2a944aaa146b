package org.yangtree.compiler.resolve.passes;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.yangtree.compiler.InMemoryModuleSource;
import org.yangtree.compiler.SchemaCompiler;
import org.yangtree.compiler.api.ModelProcessingException;
import org.yangtree.compiler.types.PrimitiveType;
import org.yangtree.schema.CompiledSchema;
import org.yangtree.schema.SchemaNode;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@Tag("unit")
class DeviationPassTest {

    private static final String BASE = """
            module base {
              namespace "urn:base"; prefix b;
              container top {
                leaf speed { type uint32 { range "1..1000"; } default 10; units "mbps"; }
                leaf legacy { type string; }
              }
            }
            """;

    private static CompiledSchema compile(String deviations) {
        InMemoryModuleSource source = new InMemoryModuleSource().with("base", BASE)
                .with("dev", "module dev { namespace \"urn:dev\"; prefix d; import base { prefix b; } "
                        + deviations + " }");
        return new SchemaCompiler(source).compile(List.of("base", "dev"));
    }

    @Test
    void replaceChangesOnlyTheNamedAttribute() {
        CompiledSchema schema = compile("deviation /b:top/b:speed { deviate replace { default 100; } }");

        SchemaNode speed = schema.find("/base:top/speed").orElseThrow();
        assertThat(speed.defaultValue()).isEqualTo("100");
        assertThat(speed.defaults()).hasSize(1);
        assertThat(speed.type()).isEqualTo(new PrimitiveType("uint32", "1..1000", null, null));
        assertThat(speed.units()).isEqualTo("mbps");
    }

    @Test
    void deleteRemovesTheAttribute() {
        CompiledSchema schema = compile("deviation /b:top/b:speed { deviate delete { units \"mbps\"; } }");

        assertThat(schema.find("/base:top/speed").orElseThrow().units()).isNull();
    }

    @Test
    void addOfAnExistingAttributeIsLastWins() {
        CompiledSchema schema = compile("deviation /b:top/b:speed { deviate add { default 20; } }");

        assertThat(schema.find("/base:top/speed").orElseThrow().defaultValue()).isEqualTo("20");
    }

    @Test
    void notSupportedRemovesTheSubtree() {
        CompiledSchema schema = compile("deviation /b:top/b:legacy { deviate not-supported; }");

        assertThat(schema.find("/base:top/legacy")).isEmpty();
        assertThat(schema.find("/base:top/speed")).isPresent();
    }

    @Test
    void unknownDeviateKindIsAnError() {
        assertThatThrownBy(() -> compile("deviation /b:top/b:legacy { deviate rename; }"))
                .isInstanceOf(ModelProcessingException.class)
                .hasMessageContaining("Unknown deviate kind 'rename'");
    }

    @Test
    void missingTargetIsAnError() {
        assertThatThrownBy(() -> compile("deviation /b:top/b:gone { deviate not-supported; }"))
                .isInstanceOf(ModelProcessingException.class)
                .hasMessageContaining("Deviation target '/base:top/base:gone' not found");
    }
}
