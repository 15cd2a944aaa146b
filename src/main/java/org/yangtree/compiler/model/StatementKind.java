package org.yangtree.compiler.model;

/**
 * The kind of a schema tree node. The ordinal is packed into the compact flag word,
 * so constants must only ever be appended.
 */
public enum StatementKind {
    CONTAINER("container"),
    LIST("list"),
    LEAF("leaf"),
    LEAF_LIST("leaf-list"),
    CHOICE("choice"),
    CASE("case"),
    AUGMENT("augment"),
    USES("uses"),
    TYPEDEF("typedef"),
    MODULE("module"),
    SUBMODULE("submodule"),
    GROUPING("grouping"),
    IMPORT("import"),
    IDENTITY("identity"),
    ACTION("action"),
    ANYDATA("anydata"),
    ANYXML("anyxml"),
    NOTIFICATION("notification"),
    RPC("rpc"),
    INPUT("input"),
    OUTPUT("output"),
    DEVIATION("deviation"),
    DEVIATE("deviate"),
    ANNOTATE("annotate"),
    BELONGS_TO("belongs-to"),
    REFINE("refine"),
    EXTENDED("extended");

    private static final StatementKind[] VALUES = values();

    private final String yangName;

    StatementKind(String yangName) {
        this.yangName = yangName;
    }

    public String yangName() {
        return yangName;
    }

    /**
     * Whether nodes of this kind are instance-data nodes (addressable in data paths).
     */
    public boolean isDataNode() {
        return switch (this) {
            case CONTAINER, LIST, LEAF, LEAF_LIST, ANYDATA, ANYXML, ACTION, INPUT, OUTPUT, NOTIFICATION, RPC -> true;
            default -> false;
        };
    }

    /**
     * Whether nodes of this kind may appear as direct children of a {@code choice}
     * without an enclosing {@code case}.
     */
    public boolean isShorthandCase() {
        return switch (this) {
            case CONTAINER, LIST, LEAF, LEAF_LIST, ANYDATA, ANYXML, CHOICE -> true;
            default -> false;
        };
    }

    public static StatementKind fromOrdinal(int ordinal) {
        if (ordinal < 0 || ordinal >= VALUES.length) {
            throw new IllegalArgumentException("Unknown statement kind ordinal: " + ordinal);
        }
        return VALUES[ordinal];
    }
}
