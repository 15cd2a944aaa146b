package org.yangtree.compiler.model;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.yangtree.compiler.api.ModelProcessingException;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@Tag("unit")
class IdentifierTest {

    private static final Map<String, String> PREFIXES = Map.of("ex", "example", "et", "example-types");

    @Test
    void prefixedNameResolvesThroughPrefixMap() {
        Identifier id = Identifier.parseYang("et:port-number", "example", PREFIXES);

        assertThat(id).isEqualTo(Identifier.of("example-types", "port-number"));
        assertThat(id.toString()).isEqualTo("example-types:port-number");
    }

    @Test
    void bareNameBindsToDefaultModuleOrStaysLazy() {
        assertThat(Identifier.parseYang("name", "example", PREFIXES)).isEqualTo(Identifier.of("example", "name"));
        assertThat(Identifier.parseYang("name", null, PREFIXES).isLazy()).isTrue();
    }

    @Test
    void unknownPrefixIsRejected() {
        assertThatThrownBy(() -> Identifier.parseYang("zz:name", "example", PREFIXES))
                .isInstanceOf(ModelProcessingException.class)
                .hasMessageContaining("Unknown prefix 'zz'");
    }

    @Test
    void moreThanOneColonIsRejected() {
        assertThatThrownBy(() -> Identifier.parseYang("a:b:c", "example", PREFIXES))
                .isInstanceOf(ModelProcessingException.class);
        assertThatThrownBy(() -> Identifier.parseModel("a:b:c"))
                .isInstanceOf(ModelProcessingException.class);
    }

    @Test
    void bindingOnlyChangesLazyIdentifiers() {
        Identifier lazy = Identifier.lazy("address");
        Identifier explicit = Identifier.of("other", "address");

        assertThat(lazy.bindTo("example")).isEqualTo(Identifier.of("example", "address"));
        assertThat(explicit.bindTo("example")).isSameAs(explicit);
        assertThat(Identifier.builtin("string").bindTo("example").isBuiltin()).isTrue();
    }

    @Test
    void identifiersWithDifferentBindingAreNotEqual() {
        assertThat(Identifier.lazy("a")).isNotEqualTo(Identifier.builtin("a"));
        assertThat(Identifier.of("m", "a")).isNotEqualTo(Identifier.lazy("a"));
    }

    @Test
    void validatesNameGrammar() {
        assertThat(Identifier.isValidName("if-name_2.x")).isTrue();
        assertThat(Identifier.isValidName("_hidden")).isTrue();
        assertThat(Identifier.isValidName("2fast")).isFalse();
        assertThat(Identifier.isValidName("a b")).isFalse();
    }
}
