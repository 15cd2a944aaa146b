package org.yangtree.compiler.model;

import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

/**
 * The closed set of YANG keywords the compiler processes.
 * <p>
 * Every keyword has one {@link Role}:
 * <ul>
 *   <li>{@code STRUCTURAL} keywords create a tree node of {@link #kind()},</li>
 *   <li>{@code ATTRIBUTE} keywords are recorded as deferred instructions on the enclosing node,</li>
 *   <li>{@code DIRECTIVE} keywords are consumed by the builder itself and leave no trace.</li>
 * </ul>
 * Keywords outside this set (documentation, {@code when}, {@code must}, ...) are skipped
 * together with their sub-block.
 */
public enum Keyword {
    MODULE("module", StatementKind.MODULE),
    SUBMODULE("submodule", StatementKind.SUBMODULE),
    CONTAINER("container", StatementKind.CONTAINER),
    LIST("list", StatementKind.LIST),
    LEAF("leaf", StatementKind.LEAF),
    LEAF_LIST("leaf-list", StatementKind.LEAF_LIST),
    CHOICE("choice", StatementKind.CHOICE),
    CASE("case", StatementKind.CASE),
    AUGMENT("augment", StatementKind.AUGMENT),
    USES("uses", StatementKind.USES),
    TYPEDEF("typedef", StatementKind.TYPEDEF),
    GROUPING("grouping", StatementKind.GROUPING),
    IMPORT("import", StatementKind.IMPORT),
    IDENTITY("identity", StatementKind.IDENTITY),
    ACTION("action", StatementKind.ACTION),
    ANYDATA("anydata", StatementKind.ANYDATA),
    ANYXML("anyxml", StatementKind.ANYXML),
    NOTIFICATION("notification", StatementKind.NOTIFICATION),
    RPC("rpc", StatementKind.RPC),
    INPUT("input", StatementKind.INPUT),
    OUTPUT("output", StatementKind.OUTPUT),
    DEVIATION("deviation", StatementKind.DEVIATION),
    DEVIATE("deviate", StatementKind.DEVIATE),
    BELONGS_TO("belongs-to", StatementKind.BELONGS_TO),
    REFINE("refine", StatementKind.REFINE),

    INCLUDE("include", Role.DIRECTIVE),
    PREFIX("prefix", Role.DIRECTIVE),

    NAMESPACE("namespace", Role.ATTRIBUTE),
    TYPE("type", Role.ATTRIBUTE),
    RANGE("range", Role.ATTRIBUTE),
    LENGTH("length", Role.ATTRIBUTE),
    FRACTION_DIGITS("fraction-digits", Role.ATTRIBUTE),
    ENUM("enum", Role.ATTRIBUTE),
    VALUE("value", Role.ATTRIBUTE),
    BIT("bit", Role.ATTRIBUTE),
    POSITION("position", Role.ATTRIBUTE),
    BASE("base", Role.ATTRIBUTE),
    PATH("path", Role.ATTRIBUTE),
    REQUIRE_INSTANCE("require-instance", Role.ATTRIBUTE),
    CONFIG("config", Role.ATTRIBUTE),
    DEFAULT("default", Role.ATTRIBUTE),
    MANDATORY("mandatory", Role.ATTRIBUTE),
    PRESENCE("presence", Role.ATTRIBUTE),
    ORDERED_BY("ordered-by", Role.ATTRIBUTE),
    KEY("key", Role.ATTRIBUTE),
    UNITS("units", Role.ATTRIBUTE),
    STATUS("status", Role.ATTRIBUTE);

    /**
     * How the builder treats a keyword.
     */
    public enum Role {
        STRUCTURAL,
        ATTRIBUTE,
        DIRECTIVE
    }

    private static final Map<String, Keyword> BY_TEXT = new HashMap<>();

    static {
        for (Keyword keyword : values()) {
            BY_TEXT.put(keyword.text, keyword);
        }
    }

    private final String text;
    private final Role role;
    private final StatementKind kind;

    Keyword(String text, StatementKind kind) {
        this.text = text;
        this.role = Role.STRUCTURAL;
        this.kind = kind;
    }

    Keyword(String text, Role role) {
        this.text = text;
        this.role = role;
        this.kind = null;
    }

    public String text() {
        return text;
    }

    public Role role() {
        return role;
    }

    /**
     * The node kind created by a structural keyword, {@code null} for all other roles.
     */
    public StatementKind kind() {
        return kind;
    }

    public boolean isStructural() {
        return role == Role.STRUCTURAL;
    }

    public static Optional<Keyword> fromText(String text) {
        return Optional.ofNullable(BY_TEXT.get(text));
    }
}
