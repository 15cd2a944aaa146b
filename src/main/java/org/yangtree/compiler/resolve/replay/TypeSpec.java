package org.yangtree.compiler.resolve.replay;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import org.yangtree.compiler.api.ModelProcessingException;
import org.yangtree.compiler.model.Identifier;
import org.yangtree.compiler.model.SchemaPath;
import org.yangtree.compiler.types.BitsType;
import org.yangtree.compiler.types.BuiltinTypes;
import org.yangtree.compiler.types.EnumerationType;
import org.yangtree.compiler.types.IdentityRefType;
import org.yangtree.compiler.types.LeafRefType;
import org.yangtree.compiler.types.PrimitiveType;
import org.yangtree.compiler.types.UnionType;
import org.yangtree.compiler.types.UnresolvedType;
import org.yangtree.compiler.types.YangType;

/**
 * Mutable collector for one {@code type} statement while its substatements are replayed.
 * {@link #build()} turns it into an immutable {@link YangType}.
 */
public final class TypeSpec {

    private final Identifier name;
    private final int line;
    private String range;
    private String length;
    private Integer fractionDigits;
    private final Map<String, Integer> enums = new LinkedHashMap<>();
    private String lastEnum;
    private final Map<String, Long> bits = new LinkedHashMap<>();
    private String lastBit;
    private final List<Identifier> bases = new ArrayList<>();
    private SchemaPath path;
    private boolean requireInstance = true;
    private final List<TypeSpec> members = new ArrayList<>();

    public TypeSpec(Identifier name, int line) {
        this.name = name;
        this.line = line;
    }

    public Identifier getName() {
        return name;
    }

    public void setRange(String range) {
        this.range = range;
    }

    public void setLength(String length) {
        this.length = length;
    }

    public void setFractionDigits(int fractionDigits) {
        this.fractionDigits = fractionDigits;
    }

    public void setPath(SchemaPath path) {
        this.path = path;
    }

    public void setRequireInstance(boolean requireInstance) {
        this.requireInstance = requireInstance;
    }

    public void addBase(Identifier base) {
        bases.add(base);
    }

    public void addMember(TypeSpec member) {
        members.add(member);
    }

    /**
     * Adds an enum member valued one above the current maximum (0 for the first).
     */
    public void addEnum(String enumName) {
        int next = enums.isEmpty() ? 0 : Collections.max(enums.values()) + 1;
        enums.put(enumName, next);
        lastEnum = enumName;
    }

    /**
     * Overrides the value of the most recently added enum member.
     */
    public void setLastEnumValue(int value) {
        if (lastEnum == null) {
            throw new ModelProcessingException("'value' outside of an enum in type '" + name + "' (line " + line + ")");
        }
        enums.put(lastEnum, value);
    }

    public void addBit(String bitName) {
        long next = bits.isEmpty() ? 0 : Collections.max(bits.values()) + 1;
        bits.put(bitName, next);
        lastBit = bitName;
    }

    public void setLastBitPosition(long position) {
        if (lastBit == null) {
            throw new ModelProcessingException("'position' outside of a bit in type '" + name + "' (line " + line + ")");
        }
        bits.put(lastBit, position);
    }

    /**
     * Materializes the collected statement.
     *
     * @throws ModelProcessingException if a constructed type lacks its mandatory substatements.
     */
    public YangType build() {
        if (!name.isBuiltin()) {
            return new UnresolvedType(name, range, length, fractionDigits, enums, bits);
        }
        return switch (name.name()) {
            case BuiltinTypes.ENUMERATION -> new EnumerationType(enums);
            case BuiltinTypes.BITS -> new BitsType(bits);
            case BuiltinTypes.UNION -> {
                if (members.isEmpty()) {
                    throw new ModelProcessingException("Union type without member types (line " + line + ")");
                }
                yield new UnionType(members.stream().map(TypeSpec::build).toList());
            }
            case BuiltinTypes.IDENTITYREF -> new IdentityRefType(bases, Set.of());
            case BuiltinTypes.LEAFREF -> {
                if (path == null) {
                    throw new ModelProcessingException("Leafref type without 'path' (line " + line + ")");
                }
                yield new LeafRefType(path, requireInstance);
            }
            default -> new PrimitiveType(name.name(), range, length, fractionDigits);
        };
    }
}
