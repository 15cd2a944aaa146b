package org.yangtree.compiler;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.yangtree.compiler.api.ModelProcessingException;
import org.yangtree.compiler.frontend.io.ClasspathModuleSource;
import org.yangtree.compiler.frontend.module.ModuleIdentity;
import org.yangtree.compiler.model.Identifier;
import org.yangtree.compiler.model.StatementKind;
import org.yangtree.compiler.resolve.passes.AnnotationExtractionPass;
import org.yangtree.compiler.types.EnumerationType;
import org.yangtree.compiler.types.IdentityRefType;
import org.yangtree.compiler.types.PrimitiveType;
import org.yangtree.compiler.types.UnionType;
import org.yangtree.schema.CompiledSchema;
import org.yangtree.schema.SchemaCache;
import org.yangtree.schema.SchemaNode;

import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.entry;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * Compiles the fixture modules under {@code src/test/resources/yang} end to end.
 */
@Tag("integration")
class SchemaCompilerTest {

    private SchemaCompiler compiler;

    @BeforeEach
    void setUp() {
        compiler = new SchemaCompiler(new ClasspathModuleSource("yang"));
    }

    private SchemaNode node(CompiledSchema schema, String path) {
        return schema.find(path).orElseThrow(() -> new AssertionError("No node at " + path));
    }

    @Test
    void compilesModuleWithImportsAndSubmodule() {
        CompiledSchema schema = compiler.compile(List.of("example"));

        assertThat(schema.namespaces()).containsEntry("example", "urn:example:main")
                .containsEntry("example-types", "urn:example:types")
                .containsKey("ietf-yang-metadata");
        SchemaNode contactPort = node(schema, "/example:system/contact-port");
        assertThat(contactPort.type()).isEqualTo(new PrimitiveType("uint16", "1..65535", null, null));
        assertThat(contactPort.namespace()).isEqualTo("urn:example:main");
    }

    @Test
    void listAndContainerFlagsAreCarried() {
        CompiledSchema schema = compiler.compile(List.of("example"));

        SchemaNode list = node(schema, "/example:interfaces/interface");
        assertThat(list.kind()).isEqualTo(StatementKind.LIST);
        assertThat(list.keys()).containsExactly("name");
        assertThat(list.isUserOrdered()).isTrue();
        assertThat(node(schema, "/example:settings").isPresence()).isTrue();
        assertThat(node(schema, "/example:interfaces").isPresence()).isFalse();
        assertThat(node(schema, "/example:interfaces/interface/tags").defaults()).containsExactly("a", "b");
        assertThat(node(schema, "/example:interfaces/interface/enabled").defaultValue()).isEqualTo("true");
    }

    @Test
    void typedefChainsMergeRestrictionsAndInheritDefaultsAndUnits() {
        CompiledSchema schema = compiler.compile(List.of("example"));

        SchemaNode port = node(schema, "/example:settings/port");
        assertThat(port.type()).isEqualTo(new PrimitiveType("uint16", "1..1023", null, null));
        assertThat(port.defaultValue()).isEqualTo("80");

        SchemaNode load = node(schema, "/example:interfaces/interface/load");
        assertThat(load.type()).isEqualTo(new PrimitiveType("uint8", "0..100", null, null));
        assertThat(load.units()).isEqualTo("percent");

        assertThat(node(schema, "/example:interfaces/interface/mtu").type())
                .isEqualTo(new PrimitiveType("uint16", "68..65535", null, null));
        assertThat(node(schema, "/example:interfaces/interface/name").type())
                .isEqualTo(new PrimitiveType("string", null, "1..64", null));
        assertThat(node(schema, "/example:settings/delay").type())
                .isEqualTo(new PrimitiveType("decimal64", null, null, 2));
    }

    @Test
    void enumerationKeepsExplicitAndImplicitValues() {
        CompiledSchema schema = compiler.compile(List.of("example"));

        EnumerationType state = (EnumerationType) node(schema, "/example:interfaces/interface/state").type();
        assertThat(state.values()).containsExactly(
                entry("up", 0),
                entry("down", 1),
                entry("testing", 7));
    }

    @Test
    void identityrefValuesAreTheTransitiveClosureInStableOrder() {
        CompiledSchema schema = compiler.compile(List.of("example"));

        IdentityRefType transport = (IdentityRefType) node(schema, "/example:settings/transport").type();
        assertThat(transport.bases()).containsExactly(Identifier.of("example-types", "transport"));
        assertThat(transport.values()).containsExactly(
                Identifier.of("example-types", "quic"),
                Identifier.of("example-types", "tcp"),
                Identifier.of("example-types", "udp"));
        assertThat(transport.checkFieldValue("quic")).isTrue();
        assertThat(transport.checkFieldValue("transport")).isFalse();
    }

    @Test
    void leafrefTakesTheTypeOfItsTarget() {
        CompiledSchema schema = compiler.compile(List.of("example"));

        assertThat(node(schema, "/example:settings/ref-port").type())
                .isEqualTo(node(schema, "/example:settings/port").type());
    }

    @Test
    void unionMembersAreDeduplicated() {
        CompiledSchema schema = compiler.compile(List.of("example"));

        assertThat(node(schema, "/example:settings/value").type())
                .isEqualTo(new UnionType(List.of(PrimitiveType.of("int8"), PrimitiveType.of("string"))));
    }

    @Test
    void configFalseForcesWholeSubtree() {
        CompiledSchema schema = compiler.compile(List.of("example"));

        assertThat(node(schema, "/example:stats").isConfig()).isFalse();
        assertThat(node(schema, "/example:stats/counter").isConfig()).isFalse();
        assertThat(node(schema, "/example:interfaces/interface/state").isConfig()).isFalse();
        assertThat(node(schema, "/example:interfaces/interface/mtu").isConfig()).isTrue();
    }

    @Test
    void groupingCopiesAreIndependent() {
        CompiledSchema schema = compiler.compile(List.of("example"));

        SchemaNode sourcePort = node(schema, "/example:interfaces/interface/source/port");
        SchemaNode destinationPort = node(schema, "/example:interfaces/interface/destination/port");
        assertThat(sourcePort).isNotEqualTo(destinationPort);
        assertThat(sourcePort.name()).isEqualTo(Identifier.of("example", "port"));
        assertThat(sourcePort.defaultValue()).isNull();
        assertThat(destinationPort.defaultValue()).isEqualTo("443");
        assertThat(destinationPort.type()).isEqualTo(sourcePort.type());
    }

    @Test
    void choiceCasesAreNamedAndTransparentForLookup() {
        CompiledSchema schema = compiler.compile(List.of("example"));

        SchemaNode fast = node(schema, "/example:settings/fast");
        SchemaNode implicitCase = fast.parent().orElseThrow();
        assertThat(implicitCase.kind()).isEqualTo(StatementKind.CASE);
        assertThat(implicitCase.name()).isEqualTo(Identifier.of("example", "fast"));
        assertThat(implicitCase.parent().orElseThrow().kind()).isEqualTo(StatementKind.CHOICE);
    }

    @Test
    void rpcGetsImplicitOutput() {
        CompiledSchema schema = compiler.compile(List.of("example"));

        assertThat(node(schema, "/example:reset/input/force").type()).isEqualTo(PrimitiveType.of("boolean"));
        assertThat(node(schema, "/example:reset/output").children()).isEmpty();
    }

    @Test
    void annotationsAreLiftedOutOfTheTree() {
        CompiledSchema schema = compiler.compile(List.of("example"));

        assertThat(schema.annotations()).containsOnlyKeys(AnnotationExtractionPass.OPERATION,
                Identifier.of("example", "last-modified"));
        assertThat(schema.annotations().get(Identifier.of("example", "last-modified")).namespace())
                .isEqualTo("urn:example:main");
        assertThat(schema.find("/example:last-modified")).isEmpty();
    }

    @Test
    void augmentsApplyRegardlessOfDeclarationOrder() {
        CompiledSchema schema = compiler.compile(List.of("example", "example-augment"));

        SchemaNode priority = node(schema, "/example:interfaces/interface/example-augment:vlan/priority");
        assertThat(priority.type()).isEqualTo(new PrimitiveType("uint8", "0..7", null, null));
        assertThat(priority.namespace()).isEqualTo("urn:example:augment");
        SchemaNode turbo = node(schema, "/example:settings/example-augment:turbo");
        assertThat(turbo.parent().orElseThrow().kind()).isEqualTo(StatementKind.CASE);
    }

    @Test
    void deviationsEditTargetsBeforeReplay() {
        CompiledSchema schema = compiler.compile(List.of("example", "example-deviations"));

        assertThat(schema.find("/example:stats")).isEmpty();
        SchemaNode port = node(schema, "/example:settings/port");
        assertThat(port.defaultValue()).isEqualTo("22");
        assertThat(port.type()).isEqualTo(new PrimitiveType("uint16", "1..1023", null, null));
        assertThat(node(schema, "/example:interfaces/interface/mtu").isMandatory()).isTrue();
    }

    @Test
    void missingModuleFailsTheCompilation() {
        assertThatThrownBy(() -> compiler.compile(List.of("does-not-exist")))
                .isInstanceOf(ModelProcessingException.class)
                .hasMessageContaining("Cannot find yang module 'does-not-exist'");
    }

    @Test
    void cacheHitSkipsCompilation() {
        InMemoryModuleSource source = new InMemoryModuleSource();
        SchemaCompiler counting = new SchemaCompiler(source);
        CompiledSchema cachedSchema = compiler.compile(List.of("example-types"));
        SchemaCache cache = mock(SchemaCache.class);
        when(cache.load(anyString())).thenReturn(Optional.of(cachedSchema));

        CompiledSchema result = counting.compile(List.of(ModuleIdentity.of("example-types", "2024-01-10")), cache);

        assertThat(result).isSameAs(cachedSchema);
        assertThat(source.loads()).isEmpty();
        verify(cache, never()).store(anyString(), any());
    }

    @Test
    void failedCompilationStoresNothing() {
        InMemoryModuleSource source = new InMemoryModuleSource()
                .with("broken", "module broken { prefix b; namespace \"urn:b\"; leaf x { type missing; } }");
        SchemaCache cache = mock(SchemaCache.class);
        when(cache.load(anyString())).thenReturn(Optional.empty());

        assertThatThrownBy(() -> new SchemaCompiler(source).compile(List.of(ModuleIdentity.of("broken", null)), cache))
                .isInstanceOf(ModelProcessingException.class)
                .hasMessageContaining("Unknown type 'broken:missing'");
        verify(cache, never()).store(anyString(), any());
    }

    @Test
    void successfulCompilationIsStored() {
        InMemoryModuleSource source = new InMemoryModuleSource()
                .with("small", "module small { prefix s; namespace \"urn:s\"; leaf x { type string; } }");
        SchemaCache cache = mock(SchemaCache.class);
        when(cache.load(anyString())).thenReturn(Optional.empty());
        List<ModuleIdentity> modules = List.of(ModuleIdentity.of("small", null));

        CompiledSchema schema = new SchemaCompiler(source).compile(modules, cache);

        verify(cache).store(SchemaCache.digest(modules), schema);
    }
}
