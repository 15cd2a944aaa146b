package org.yangtree.compiler.model;

import java.util.Map;
import java.util.Objects;
import java.util.regex.Pattern;

import org.yangtree.compiler.api.ModelProcessingException;

/**
 * A schema-qualified name: a local name plus the module it belongs to.
 * <p>
 * The module part is a closed variant expressed by {@link Binding}:
 * <ul>
 *   <li>{@link Binding#BUILTIN} for built-in names (primitive type names, the synthetic root),</li>
 *   <li>{@link Binding#LAZY} for names declared inside a grouping, bound to a module only when
 *       the grouping is instantiated,</li>
 *   <li>{@link Binding#EXPLICIT} for names owned by a named module.</li>
 * </ul>
 * Identifiers are immutable. Lazy binding produces a new instance via {@link #bindTo(String)}.
 *
 * @param binding how the module part is determined.
 * @param module  the owning module, non-null exactly when {@code binding == EXPLICIT}.
 * @param name    the local name.
 */
public record Identifier(Binding binding, String module, String name) {

    private static final Pattern VALID_NAME = Pattern.compile("[a-zA-Z_][a-zA-Z0-9_\\-.]*");

    /**
     * Module-part variants of an {@link Identifier}.
     */
    public enum Binding {
        BUILTIN,
        LAZY,
        EXPLICIT
    }

    public Identifier {
        Objects.requireNonNull(binding, "binding");
        Objects.requireNonNull(name, "name");
        if (binding == Binding.EXPLICIT) {
            Objects.requireNonNull(module, "module");
        } else if (module != null) {
            throw new IllegalArgumentException("Only explicit identifiers carry a module: " + module + ":" + name);
        }
    }

    public static Identifier builtin(String name) {
        return new Identifier(Binding.BUILTIN, null, name);
    }

    public static Identifier lazy(String name) {
        return new Identifier(Binding.LAZY, null, name);
    }

    public static Identifier of(String module, String name) {
        return new Identifier(Binding.EXPLICIT, module, name);
    }

    /**
     * Parses a name as written in YANG source, where an optional prefix selects the module.
     *
     * @param text          the source text, {@code name} or {@code prefix:name}.
     * @param defaultModule the module for unprefixed names; {@code null} leaves them lazy.
     * @param prefixes      the prefix-to-module mapping in scope.
     * @return the parsed identifier.
     * @throws ModelProcessingException if the prefix is unknown or the text has more than one colon.
     */
    public static Identifier parseYang(String text, String defaultModule, Map<String, String> prefixes) {
        String trimmed = text.trim();
        int colon = trimmed.indexOf(':');
        if (colon < 0) {
            return defaultModule == null ? lazy(trimmed) : of(defaultModule, trimmed);
        }
        if (trimmed.indexOf(':', colon + 1) >= 0) {
            throw new ModelProcessingException("Identifier must not contain more than one colon: '" + text + "'");
        }
        String prefix = trimmed.substring(0, colon);
        String module = prefixes.get(prefix);
        if (module == null) {
            throw new ModelProcessingException("Unknown prefix '" + prefix + "' in '" + text + "'");
        }
        return of(module, trimmed.substring(colon + 1));
    }

    /**
     * Parses a model-qualified name, {@code module:name}, or a bare name as a lazy identifier.
     */
    public static Identifier parseModel(String text) {
        int colon = text.indexOf(':');
        if (colon < 0) {
            return lazy(text);
        }
        if (text.indexOf(':', colon + 1) >= 0) {
            throw new ModelProcessingException("Identifier must not contain more than one colon: '" + text + "'");
        }
        return of(text.substring(0, colon), text.substring(colon + 1));
    }

    /**
     * Checks a local name against the YANG identifier grammar.
     */
    public static boolean isValidName(String name) {
        return name != null && VALID_NAME.matcher(name).matches();
    }

    public boolean isLazy() {
        return binding == Binding.LAZY;
    }

    public boolean isBuiltin() {
        return binding == Binding.BUILTIN;
    }

    public boolean isExplicit() {
        return binding == Binding.EXPLICIT;
    }

    /**
     * Returns this identifier bound to {@code targetModule} if it is lazy, otherwise itself.
     */
    public Identifier bindTo(String targetModule) {
        return isLazy() ? of(targetModule, name) : this;
    }

    @Override
    public String toString() {
        return isExplicit() ? module + ":" + name : name;
    }
}
