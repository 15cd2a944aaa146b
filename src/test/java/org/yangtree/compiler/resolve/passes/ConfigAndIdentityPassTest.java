package org.yangtree.compiler.resolve.passes;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.yangtree.compiler.InMemoryModuleSource;
import org.yangtree.compiler.SchemaCompiler;
import org.yangtree.compiler.model.Identifier;
import org.yangtree.compiler.types.IdentityRefType;
import org.yangtree.compiler.types.UnionType;
import org.yangtree.schema.CompiledSchema;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Config inheritance and identity closure, which both settle values across the whole tree.
 */
@Tag("unit")
class ConfigAndIdentityPassTest {

    private static CompiledSchema compile(String body) {
        String text = "module m { namespace \"urn:m\"; prefix m; " + body + " }";
        return new SchemaCompiler(new InMemoryModuleSource().with("m", text)).compile(List.of("m"));
    }

    @Test
    void explicitConfigTrueUnderConfigFalseIsIgnored() {
        CompiledSchema schema = compile("""
                container state {
                  config false;
                  container inner { config true; leaf x { type string; } }
                }
                container conf { leaf y { type string; } }
                """);

        assertThat(schema.find("/m:state/inner").orElseThrow().isConfig()).isFalse();
        assertThat(schema.find("/m:state/inner/x").orElseThrow().isConfig()).isFalse();
        assertThat(schema.find("/m:conf/y").orElseThrow().isConfig()).isTrue();
        assertThat(schema.root().isConfig()).isTrue();
    }

    @Test
    void identityClosureIsTransitiveAndExcludesTheBase() {
        CompiledSchema schema = compile("""
                identity animal;
                identity mammal { base animal; }
                identity dog { base mammal; }
                identity bird { base animal; }
                identity rock;
                leaf pet { type identityref { base animal; } }
                leaf fur { type identityref { base mammal; } }
                """);

        IdentityRefType pet = (IdentityRefType) schema.find("/m:pet").orElseThrow().type();
        assertThat(pet.values()).containsExactly(
                Identifier.of("m", "bird"), Identifier.of("m", "dog"), Identifier.of("m", "mammal"));
        IdentityRefType fur = (IdentityRefType) schema.find("/m:fur").orElseThrow().type();
        assertThat(fur.values()).containsExactly(Identifier.of("m", "dog"));
    }

    @Test
    void identityrefInsideUnionIsClosedToo() {
        CompiledSchema schema = compile("""
                identity base-id;
                identity derived { base base-id; }
                leaf u { type union { type identityref { base base-id; } type string; } }
                """);

        UnionType union = (UnionType) schema.find("/m:u").orElseThrow().type();
        IdentityRefType member = (IdentityRefType) union.members().get(0);
        assertThat(member.values()).containsExactly(Identifier.of("m", "derived"));
    }
}
