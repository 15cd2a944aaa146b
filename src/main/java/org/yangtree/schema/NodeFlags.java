package org.yangtree.schema;

import org.yangtree.compiler.model.StatementKind;
import org.yangtree.compiler.model.Status;

/**
 * Packing of per-node booleans, status and kind into one {@code int}.
 * <pre>
 *   bits 0-7   statement kind ordinal
 *   bit  8     presence
 *   bit  9     user-ordered
 *   bit  10    config
 *   bit  11    mandatory
 *   bits 12-13 status ordinal
 * </pre>
 */
public final class NodeFlags {

    private static final int KIND_MASK = 0xFF;
    private static final int PRESENCE = 1 << 8;
    private static final int USER_ORDERED = 1 << 9;
    private static final int CONFIG = 1 << 10;
    private static final int MANDATORY = 1 << 11;
    private static final int STATUS_SHIFT = 12;
    private static final int STATUS_MASK = 0x3;

    private NodeFlags() {
    }

    public static int pack(StatementKind kind, boolean presence, boolean userOrdered, boolean config,
                           boolean mandatory, Status status) {
        int flags = kind.ordinal() & KIND_MASK;
        if (presence) {
            flags |= PRESENCE;
        }
        if (userOrdered) {
            flags |= USER_ORDERED;
        }
        if (config) {
            flags |= CONFIG;
        }
        if (mandatory) {
            flags |= MANDATORY;
        }
        return flags | (status.ordinal() & STATUS_MASK) << STATUS_SHIFT;
    }

    public static StatementKind kind(int flags) {
        return StatementKind.fromOrdinal(flags & KIND_MASK);
    }

    public static boolean isPresence(int flags) {
        return (flags & PRESENCE) != 0;
    }

    public static boolean isUserOrdered(int flags) {
        return (flags & USER_ORDERED) != 0;
    }

    public static boolean isConfig(int flags) {
        return (flags & CONFIG) != 0;
    }

    public static boolean isMandatory(int flags) {
        return (flags & MANDATORY) != 0;
    }

    public static Status status(int flags) {
        return Status.values()[(flags >>> STATUS_SHIFT) & STATUS_MASK];
    }
}
