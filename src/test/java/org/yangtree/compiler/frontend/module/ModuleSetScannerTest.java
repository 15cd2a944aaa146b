package org.yangtree.compiler.frontend.module;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.yangtree.compiler.InMemoryModuleSource;
import org.yangtree.compiler.api.ModelProcessingException;
import org.yangtree.compiler.frontend.io.ClasspathModuleSource;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@Tag("unit")
class ModuleSetScannerTest {

    @Test
    void scansImportsIncludesAndNewestRevisions() {
        List<ModuleIdentity> modules = new ModuleSetScanner(new ClasspathModuleSource("yang")).scan(List.of("example"));

        assertThat(modules).containsExactly(
                new ModuleIdentity("example", "2024-02-01", List.of(ModuleIdentity.of("example-sub", "2024-01-15"))),
                ModuleIdentity.of("example-types", "2024-01-10"),
                ModuleIdentity.of("ietf-yang-metadata", "2016-08-05"));
    }

    @Test
    void nestedRevisionStatementsAreIgnored() {
        InMemoryModuleSource source = new InMemoryModuleSource().with("m", """
                module m {
                  revision 2020-01-01;
                  container c { description "revision 2099-01-01"; }
                  extension e { revision 2099-01-01; }
                }
                """);

        assertThat(new ModuleSetScanner(source).scan(List.of("m")))
                .containsExactly(ModuleIdentity.of("m", "2020-01-01"));
    }

    @Test
    void eachModuleIsReadOnce() {
        InMemoryModuleSource source = new InMemoryModuleSource()
                .with("a", "module a { import b { prefix b; } import c { prefix c; } }")
                .with("b", "module b { import c { prefix c; } }")
                .with("c", "module c { }");

        List<ModuleIdentity> modules = new ModuleSetScanner(source).scan(List.of("a", "c"));

        assertThat(source.loads()).containsExactly("a", "c", "b");
        assertThat(modules).extracting(ModuleIdentity::name).containsExactly("a", "c", "b");
        assertThat(modules.get(0).revision()).isNull();
    }

    @Test
    void unknownModuleIsReported() {
        assertThatThrownBy(() -> new ModuleSetScanner(new InMemoryModuleSource()).scan(List.of("ghost")))
                .isInstanceOf(ModelProcessingException.class)
                .hasMessageContaining("Cannot find yang module 'ghost'");
    }
}
