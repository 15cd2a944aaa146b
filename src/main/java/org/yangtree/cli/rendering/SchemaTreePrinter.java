package org.yangtree.cli.rendering;

import java.util.ArrayList;
import java.util.List;

import org.yangtree.compiler.model.StatementKind;
import org.yangtree.schema.SchemaNode;

/**
 * Renders a compiled schema as an indented text tree, one node per line:
 * <pre>
 * mp example [module]
 * +-- rw example:interfaces [container]
 *     +-- rw example:interface [list name user-ordered]
 *         +-- rw example:name [leaf string]
 * </pre>
 * The flag column is {@code rw}/{@code ro} for data nodes, {@code -x} for operations,
 * {@code -n} for notifications and {@code mp} otherwise.
 */
public final class SchemaTreePrinter {

    private static final String CHILD = "+-- ";
    private static final String VERTICAL_LINE = "|   ";
    private static final String SPACE = "    ";

    /**
     * Renders the children of {@code root} (the root node itself has no line).
     */
    public String render(SchemaNode root) {
        StringBuilder out = new StringBuilder();
        for (SchemaNode child : root.children()) {
            render(child, "", "", out);
        }
        return out.toString();
    }

    private void render(SchemaNode node, String linePrefix, String childPrefix, StringBuilder out) {
        out.append(linePrefix).append(flags(node)).append(' ').append(node.name()).append(" [")
                .append(String.join(" ", describe(node))).append("]\n");
        List<SchemaNode> children = node.children();
        for (int i = 0; i < children.size(); i++) {
            boolean last = i == children.size() - 1;
            render(children.get(i), childPrefix + CHILD, childPrefix + (last ? SPACE : VERTICAL_LINE), out);
        }
    }

    static String flags(SchemaNode node) {
        return switch (node.kind()) {
            case CONTAINER, LIST, LEAF, LEAF_LIST, CHOICE, CASE, ANYDATA, ANYXML -> node.isConfig() ? "rw" : "ro";
            case RPC, ACTION -> "-x";
            case NOTIFICATION -> "-n";
            default -> "mp";
        };
    }

    static List<String> describe(SchemaNode node) {
        List<String> parts = new ArrayList<>();
        StatementKind kind = node.kind();
        parts.add(kind.yangName());
        switch (kind) {
            case LEAF, LEAF_LIST -> {
                if (node.type() != null) {
                    parts.add(node.type().wireTypeName());
                }
            }
            case LIST -> {
                if (!node.keys().isEmpty()) {
                    parts.add(String.join(",", node.keys()));
                }
                if (node.isUserOrdered()) {
                    parts.add("user-ordered");
                }
            }
            case CONTAINER -> {
                if (node.isPresence()) {
                    parts.add("presence");
                }
            }
            case IDENTITY -> {
                if (!node.identityBases().isEmpty()) {
                    parts.add("base=" + node.identityBases());
                }
            }
            default -> {
            }
        }
        return parts;
    }
}
