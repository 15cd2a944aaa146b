package org.yangtree.cli.rendering;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.yangtree.compiler.SchemaCompiler;
import org.yangtree.schema.CompiledSchema;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

@Tag("unit")
class SchemaTreePrinterTest {

    private static CompiledSchema compile(String text) {
        return new SchemaCompiler(name -> text).compile(List.of("t"));
    }

    @Test
    void rendersNestedNodesWithFlagsAndConnectors() {
        CompiledSchema schema = compile("""
                module t {
                  namespace "urn:t"; prefix t;
                  container top {
                    presence "on";
                    list entry { key id; ordered-by user; leaf id { type uint8; } }
                    leaf state { type string; config false; }
                  }
                  rpc go;
                }
                """);

        String rendered = new SchemaTreePrinter().render(schema.root());

        assertThat(rendered).isEqualTo("""
                mp t [module]
                +-- rw t:top [container presence]
                |   +-- rw t:entry [list id user-ordered]
                |   |   +-- rw t:id [leaf uint8]
                |   +-- ro t:state [leaf string]
                +-- -x t:go [rpc]
                    +-- mp t:input [input]
                    +-- mp t:output [output]
                """);
    }
}
