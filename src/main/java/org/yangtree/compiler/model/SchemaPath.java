package org.yangtree.compiler.model;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

import org.yangtree.compiler.api.ModelProcessingException;

/**
 * A parsed schema path: a sequence of identifier steps, absolute or relative.
 * Relative leafref paths start with one or more {@link #PARENT} steps.
 *
 * @param absolute whether the path starts at the schema root.
 * @param steps    the path steps in order.
 */
public record SchemaPath(boolean absolute, List<Identifier> steps) {

    /** The {@code ..} step of a relative leafref path. */
    public static final Identifier PARENT = Identifier.builtin("..");

    /**
     * The syntactic flavour a path argument is parsed with.
     */
    public enum Style {
        /** Absolute schema node identifier ({@code augment}, {@code deviation}); bare names bind to the current module. */
        ABSOLUTE,
        /** Descendant schema node identifier ({@code refine}, {@code augment} inside {@code uses}); bare names stay lazy. */
        DESCENDANT,
        /** Leafref {@code path} argument; predicates are dropped and bare names stay lazy. */
        LEAFREF
    }

    public SchemaPath {
        steps = List.copyOf(steps);
    }

    /**
     * Parses a path argument.
     *
     * @param text          the argument as written in the module.
     * @param style         the path flavour.
     * @param defaultModule the module for bare names in {@link Style#ABSOLUTE} paths.
     * @param prefixes      the prefix scope in force where the path was written.
     * @return the parsed path.
     * @throws ModelProcessingException if the path is malformed or uses an unknown prefix.
     */
    public static SchemaPath parse(String text, Style style, String defaultModule, Map<String, String> prefixes) {
        String source = style == Style.LEAFREF ? stripPredicates(text) : text;
        source = source.replaceAll("\\s+", "");
        boolean absolute = source.startsWith("/");
        switch (style) {
            case ABSOLUTE -> {
                if (!absolute) {
                    throw new ModelProcessingException("Expected an absolute schema path but got '" + text + "'");
                }
            }
            case DESCENDANT -> {
                if (absolute) {
                    throw new ModelProcessingException("Expected a descendant schema path but got '" + text + "'");
                }
            }
            case LEAFREF -> {
                if (!absolute && !source.startsWith("../")) {
                    throw new ModelProcessingException("Leafref path must start with '/' or '../': '" + text + "'");
                }
            }
        }

        List<Identifier> steps = new ArrayList<>();
        String body = absolute ? source.substring(1) : source;
        for (String part : body.split("/")) {
            if (part.isEmpty()) {
                throw new ModelProcessingException("Empty step in schema path '" + text + "'");
            }
            if (part.equals("..")) {
                if (style != Style.LEAFREF || absolute || steps.stream().anyMatch(s -> !s.equals(PARENT))) {
                    throw new ModelProcessingException("Misplaced '..' in schema path '" + text + "'");
                }
                steps.add(PARENT);
                continue;
            }
            String module = style == Style.ABSOLUTE ? defaultModule : null;
            steps.add(Identifier.parseYang(part, module, prefixes));
        }
        return new SchemaPath(absolute, steps);
    }

    private static String stripPredicates(String text) {
        StringBuilder result = new StringBuilder(text.length());
        int depth = 0;
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (c == '[') {
                depth++;
            } else if (c == ']') {
                depth--;
            } else if (depth == 0) {
                result.append(c);
            }
        }
        if (depth != 0) {
            throw new ModelProcessingException("Unbalanced predicate brackets in path '" + text + "'");
        }
        return result.toString();
    }

    @Override
    public String toString() {
        String joined = steps.stream().map(Identifier::toString).collect(Collectors.joining("/"));
        return absolute ? "/" + joined : joined;
    }
}
