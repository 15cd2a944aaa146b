package org.yangtree.compiler.resolve.replay;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.yangtree.compiler.InMemoryModuleSource;
import org.yangtree.compiler.SchemaCompiler;
import org.yangtree.compiler.api.ModelProcessingException;
import org.yangtree.compiler.model.Keyword;
import org.yangtree.compiler.model.Status;
import org.yangtree.compiler.resolve.replay.handlers.TypeHandler;
import org.yangtree.compiler.types.BitsType;
import org.yangtree.schema.CompiledSchema;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.entry;

@Tag("unit")
class InstructionReplayTest {

    private static CompiledSchema compile(String body) {
        String text = "module m { namespace \"urn:m\"; prefix m; " + body + " }";
        return new SchemaCompiler(new InMemoryModuleSource().with("m", text)).compile(List.of("m"));
    }

    @Test
    void defaultRegistryCoversEveryAttributeKeyword() {
        InstructionHandlerRegistry registry = InstructionHandlerRegistry.initializeWithDefaults();

        for (Keyword keyword : Keyword.values()) {
            if (keyword.role() == Keyword.Role.ATTRIBUTE) {
                assertThat(registry.resolve(keyword)).as(keyword.text()).isPresent();
            }
        }
        assertThat(registry.resolve(Keyword.TYPE)).containsInstanceOf(TypeHandler.class);
    }

    @Test
    void onlyAttributeKeywordsCanBeRegistered() {
        InstructionHandlerRegistry registry = new InstructionHandlerRegistry();

        assertThatThrownBy(() -> registry.register(Keyword.CONTAINER, new TypeHandler()))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void flagsAndStatusAreReplayed() {
        CompiledSchema schema = compile("""
                leaf old { type string; status deprecated; mandatory true; }
                """);

        assertThat(schema.find("/m:old").orElseThrow().status()).isEqualTo(Status.DEPRECATED);
        assertThat(schema.find("/m:old").orElseThrow().isMandatory()).isTrue();
    }

    @Test
    void bitPositionsFollowTheHighestAssigned() {
        CompiledSchema schema = compile("""
                leaf flags { type bits { bit a; bit b { position 5; } bit c; } }
                """);

        BitsType bits = (BitsType) schema.find("/m:flags").orElseThrow().type();
        assertThat(bits.positions()).containsExactly(entry("a", 0L), entry("b", 5L), entry("c", 6L));
    }

    @Test
    void invalidConfigArgumentIsReportedWithLocation() {
        assertThatThrownBy(() -> compile("leaf x { type string; config maybe; }"))
                .isInstanceOf(ModelProcessingException.class)
                .hasMessageContaining("Invalid config statement 'maybe'")
                .hasMessageContaining("leaf /m/m:x");
    }

    @Test
    void invalidStatusIsRejected() {
        assertThatThrownBy(() -> compile("leaf x { type string; status retired; }"))
                .isInstanceOf(ModelProcessingException.class)
                .hasMessageContaining("Invalid status statement 'retired'");
    }

    @Test
    void unionWithoutMembersIsRejected() {
        assertThatThrownBy(() -> compile("leaf x { type union; }"))
                .isInstanceOf(ModelProcessingException.class)
                .hasMessageContaining("Union type without member types");
    }

    @Test
    void leafrefWithoutPathIsRejected() {
        assertThatThrownBy(() -> compile("leaf x { type leafref; }"))
                .isInstanceOf(ModelProcessingException.class)
                .hasMessageContaining("Leafref type without 'path'");
    }
}
