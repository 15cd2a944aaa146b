package org.yangtree.schema;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.DataInputStream;
import java.io.DataOutputStream;
import java.io.EOFException;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import it.unimi.dsi.fastutil.ints.IntArrayList;
import it.unimi.dsi.fastutil.objects.ObjectArrayList;
import org.yangtree.compiler.api.InternalSchemaException;
import org.yangtree.compiler.model.Identifier;
import org.yangtree.compiler.model.SchemaPath;
import org.yangtree.compiler.types.BitsType;
import org.yangtree.compiler.types.EnumerationType;
import org.yangtree.compiler.types.IdentityRefType;
import org.yangtree.compiler.types.PrimitiveType;
import org.yangtree.compiler.types.UnionType;
import org.yangtree.compiler.types.YangType;
import org.yangtree.schema.contracts.AnnotationEntry;
import org.yangtree.schema.contracts.BitEntry;
import org.yangtree.schema.contracts.BitsTypeDef;
import org.yangtree.schema.contracts.CompiledSchemaArena;
import org.yangtree.schema.contracts.EnumEntry;
import org.yangtree.schema.contracts.EnumerationTypeDef;
import org.yangtree.schema.contracts.IdentifierBinding;
import org.yangtree.schema.contracts.IdentityRefTypeDef;
import org.yangtree.schema.contracts.NamespaceEntry;
import org.yangtree.schema.contracts.NodeData;
import org.yangtree.schema.contracts.PrimitiveTypeDef;
import org.yangtree.schema.contracts.SchemaIdentifier;
import org.yangtree.schema.contracts.TargetPath;
import org.yangtree.schema.contracts.TypeDefinition;
import org.yangtree.schema.contracts.UnionTypeDef;

/**
 * Binary encoding of a {@link CompiledSchema}.
 * <p>
 * Layout: a fixed header (magic, format version) followed by one length-delimited
 * {@link CompiledSchemaArena} message holding the namespace table, the annotation table and the
 * node arena in index order. Only repeated fields are used, never protobuf maps, so equal
 * schemas produce identical bytes. Bump {@link #FORMAT_VERSION} whenever the message layout
 * changes incompatibly; the cache digest includes it, so old cache files are never addressed again.
 */
public final class SchemaCodec {

    public static final int MAGIC = 0x59414E47;
    public static final int FORMAT_VERSION = 2;

    public byte[] encode(CompiledSchema schema) {
        ByteArrayOutputStream buffer = new ByteArrayOutputStream();
        try {
            write(schema, buffer);
        } catch (IOException e) {
            throw new IllegalStateException("In-memory encoding failed", e);
        }
        return buffer.toByteArray();
    }

    public CompiledSchema decode(byte[] bytes) throws IOException {
        return read(new ByteArrayInputStream(bytes));
    }

    /**
     * Writes {@code schema} to {@code stream}. The stream is flushed but not closed.
     *
     * @throws InternalSchemaException if the schema still holds a placeholder type.
     */
    public void write(CompiledSchema schema, OutputStream stream) throws IOException {
        DataOutputStream header = new DataOutputStream(stream);
        header.writeInt(MAGIC);
        header.writeInt(FORMAT_VERSION);
        header.flush();
        toMessage(schema).writeDelimitedTo(stream);
        stream.flush();
    }

    /**
     * Reads a schema written by {@link #write}.
     *
     * @throws IOException if the stream is truncated, has a foreign magic or version, or is
     *                     otherwise malformed.
     */
    public CompiledSchema read(InputStream stream) throws IOException {
        DataInputStream header = new DataInputStream(stream);
        int magic = header.readInt();
        if (magic != MAGIC) {
            throw new IOException("Not a compiled schema (magic " + Integer.toHexString(magic) + ")");
        }
        int version = header.readInt();
        if (version != FORMAT_VERSION) {
            throw new IOException("Unsupported schema format version " + version + ", expected " + FORMAT_VERSION);
        }
        CompiledSchemaArena arena = CompiledSchemaArena.parseDelimitedFrom(stream);
        if (arena == null) {
            throw new EOFException("Compiled schema header without a body");
        }
        try {
            return fromMessage(arena);
        } catch (IllegalArgumentException | NullPointerException | IndexOutOfBoundsException e) {
            throw new IOException("Malformed compiled schema: " + e.getMessage(), e);
        }
    }

    private static CompiledSchemaArena toMessage(CompiledSchema schema) {
        CompiledSchemaArena.Builder arena = CompiledSchemaArena.newBuilder();
        for (Map.Entry<String, String> entry : schema.namespaces().entrySet()) {
            arena.addNamespaces(NamespaceEntry.newBuilder()
                    .setModule(entry.getKey())
                    .setNamespace(entry.getValue()));
        }
        for (AnnotationDefinition annotation : schema.annotations().values()) {
            AnnotationEntry.Builder entry = AnnotationEntry.newBuilder()
                    .setName(toMessage(annotation.name()))
                    .setType(toMessage(annotation.type()));
            if (annotation.namespace() != null) {
                entry.setNamespace(annotation.namespace());
            }
            if (annotation.units() != null) {
                entry.setUnits(annotation.units());
            }
            arena.addAnnotations(entry);
        }
        for (SchemaNodeData node : schema.nodeData()) {
            arena.addNodes(toMessage(node));
        }
        return arena.build();
    }

    private static NodeData toMessage(SchemaNodeData node) {
        NodeData.Builder data = NodeData.newBuilder()
                .setName(toMessage(node.name()))
                .setParent(node.parent())
                .setFlags(node.flags())
                .addAllDefaults(node.defaults())
                .addAllKeys(node.keys());
        for (int child : node.children()) {
            data.addChildren(child);
        }
        if (node.type() != null) {
            data.setType(toMessage(node.type()));
        }
        if (node.units() != null) {
            data.setUnits(node.units());
        }
        if (node.namespace() != null) {
            data.setNamespace(node.namespace());
        }
        if (node.targetPath() != null) {
            data.setTargetPath(TargetPath.newBuilder()
                    .setAbsolute(node.targetPath().absolute())
                    .addAllSteps(toMessages(node.targetPath().steps())));
        }
        data.addAllIdentityBases(toMessages(node.identityBases()));
        if (node.argument() != null) {
            data.setArgument(node.argument());
        }
        return data.build();
    }

    private static TypeDefinition toMessage(YangType type) {
        TypeDefinition.Builder definition = TypeDefinition.newBuilder();
        if (type instanceof PrimitiveType primitive) {
            PrimitiveTypeDef.Builder def = PrimitiveTypeDef.newBuilder().setName(primitive.name());
            if (primitive.range() != null) {
                def.setRange(primitive.range());
            }
            if (primitive.length() != null) {
                def.setLength(primitive.length());
            }
            if (primitive.fractionDigits() != null) {
                def.setFractionDigits(primitive.fractionDigits());
            }
            definition.setPrimitive(def);
        } else if (type instanceof UnionType union) {
            UnionTypeDef.Builder def = UnionTypeDef.newBuilder();
            for (YangType member : union.members()) {
                def.addMembers(toMessage(member));
            }
            definition.setUnion(def);
        } else if (type instanceof EnumerationType enumeration) {
            EnumerationTypeDef.Builder def = EnumerationTypeDef.newBuilder();
            enumeration.values().forEach((name, value) ->
                    def.addEntries(EnumEntry.newBuilder().setName(name).setValue(value)));
            definition.setEnumeration(def);
        } else if (type instanceof BitsType bits) {
            BitsTypeDef.Builder def = BitsTypeDef.newBuilder();
            bits.positions().forEach((name, position) ->
                    def.addEntries(BitEntry.newBuilder().setName(name).setPosition(position)));
            definition.setBits(def);
        } else if (type instanceof IdentityRefType identityRef) {
            definition.setIdentityRef(IdentityRefTypeDef.newBuilder()
                    .addAllBases(toMessages(identityRef.bases()))
                    .addAllValues(toMessages(new ArrayList<>(identityRef.values()))));
        } else {
            throw new InternalSchemaException("Type " + type + " cannot be part of a compiled schema");
        }
        return definition.build();
    }

    private static SchemaIdentifier toMessage(Identifier identifier) {
        SchemaIdentifier.Builder message = SchemaIdentifier.newBuilder()
                .setBinding(switch (identifier.binding()) {
                    case BUILTIN -> IdentifierBinding.IDENTIFIER_BINDING_BUILTIN;
                    case LAZY -> IdentifierBinding.IDENTIFIER_BINDING_LAZY;
                    case EXPLICIT -> IdentifierBinding.IDENTIFIER_BINDING_EXPLICIT;
                })
                .setName(identifier.name());
        if (identifier.module() != null) {
            message.setModule(identifier.module());
        }
        return message.build();
    }

    private static List<SchemaIdentifier> toMessages(List<Identifier> identifiers) {
        List<SchemaIdentifier> messages = new ArrayList<>(identifiers.size());
        for (Identifier identifier : identifiers) {
            messages.add(toMessage(identifier));
        }
        return messages;
    }

    private static CompiledSchema fromMessage(CompiledSchemaArena arena) throws IOException {
        Map<String, String> namespaces = new LinkedHashMap<>();
        for (NamespaceEntry entry : arena.getNamespacesList()) {
            namespaces.put(entry.getModule(), entry.getNamespace());
        }

        Map<Identifier, AnnotationDefinition> annotations = new LinkedHashMap<>();
        for (AnnotationEntry entry : arena.getAnnotationsList()) {
            if (!entry.hasName() || !entry.hasType()) {
                throw new IOException("Annotation entry without name or type");
            }
            AnnotationDefinition annotation = new AnnotationDefinition(fromMessage(entry.getName()),
                    fromMessage(entry.getType()),
                    entry.hasNamespace() ? entry.getNamespace() : null,
                    entry.hasUnits() ? entry.getUnits() : null);
            annotations.put(annotation.name(), annotation);
        }

        int nodeCount = arena.getNodesCount();
        ObjectArrayList<SchemaNodeData> nodes = new ObjectArrayList<>(nodeCount);
        for (NodeData data : arena.getNodesList()) {
            nodes.add(fromMessage(data, nodeCount));
        }
        return new CompiledSchema(nodes, namespaces, annotations);
    }

    private static SchemaNodeData fromMessage(NodeData data, int nodeCount) throws IOException {
        if (!data.hasName()) {
            throw new IOException("Node without a name");
        }
        IntArrayList children = new IntArrayList(data.getChildrenCount());
        for (int child : data.getChildrenList()) {
            if (child <= 0 || child >= nodeCount) {
                throw new IOException("Child index " + child + " out of bounds");
            }
            children.add(child);
        }
        SchemaPath targetPath = data.hasTargetPath()
                ? new SchemaPath(data.getTargetPath().getAbsolute(), fromMessages(data.getTargetPath().getStepsList()))
                : null;
        return new SchemaNodeData(fromMessage(data.getName()), data.getParent(), children, data.getFlags(),
                data.hasType() ? fromMessage(data.getType()) : null,
                data.hasUnits() ? data.getUnits() : null,
                data.hasNamespace() ? data.getNamespace() : null,
                data.getDefaultsList(), data.getKeysList(), targetPath,
                fromMessages(data.getIdentityBasesList()),
                data.hasArgument() ? data.getArgument() : null);
    }

    private static YangType fromMessage(TypeDefinition definition) throws IOException {
        switch (definition.getKindCase()) {
            case PRIMITIVE -> {
                PrimitiveTypeDef def = definition.getPrimitive();
                return new PrimitiveType(def.getName(),
                        def.hasRange() ? def.getRange() : null,
                        def.hasLength() ? def.getLength() : null,
                        def.hasFractionDigits() ? def.getFractionDigits() : null);
            }
            case UNION -> {
                List<YangType> members = new ArrayList<>(definition.getUnion().getMembersCount());
                for (TypeDefinition member : definition.getUnion().getMembersList()) {
                    members.add(fromMessage(member));
                }
                return new UnionType(members);
            }
            case ENUMERATION -> {
                Map<String, Integer> values = new LinkedHashMap<>();
                for (EnumEntry entry : definition.getEnumeration().getEntriesList()) {
                    values.put(entry.getName(), entry.getValue());
                }
                return new EnumerationType(values);
            }
            case BITS -> {
                Map<String, Long> positions = new LinkedHashMap<>();
                for (BitEntry entry : definition.getBits().getEntriesList()) {
                    positions.put(entry.getName(), entry.getPosition());
                }
                return new BitsType(positions);
            }
            case IDENTITY_REF -> {
                IdentityRefTypeDef def = definition.getIdentityRef();
                Set<Identifier> values = new LinkedHashSet<>(fromMessages(def.getValuesList()));
                return new IdentityRefType(fromMessages(def.getBasesList()), values);
            }
            default -> throw new IOException("Type definition without a kind");
        }
    }

    private static Identifier fromMessage(SchemaIdentifier message) throws IOException {
        Identifier.Binding binding = switch (message.getBinding()) {
            case IDENTIFIER_BINDING_BUILTIN -> Identifier.Binding.BUILTIN;
            case IDENTIFIER_BINDING_LAZY -> Identifier.Binding.LAZY;
            case IDENTIFIER_BINDING_EXPLICIT -> Identifier.Binding.EXPLICIT;
            default -> throw new IOException("Unknown identifier binding " + message.getBindingValue());
        };
        return new Identifier(binding, message.hasModule() ? message.getModule() : null, message.getName());
    }

    private static List<Identifier> fromMessages(List<SchemaIdentifier> messages) throws IOException {
        List<Identifier> identifiers = new ArrayList<>(messages.size());
        for (SchemaIdentifier message : messages) {
            identifiers.add(fromMessage(message));
        }
        return identifiers;
    }
}
