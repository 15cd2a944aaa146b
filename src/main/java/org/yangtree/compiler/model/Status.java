package org.yangtree.compiler.model;

import java.util.Optional;

/**
 * Value of the YANG {@code status} statement.
 */
public enum Status {
    CURRENT("current"),
    DEPRECATED("deprecated"),
    OBSOLETE("obsolete");

    private final String yangName;

    Status(String yangName) {
        this.yangName = yangName;
    }

    public String yangName() {
        return yangName;
    }

    public static Optional<Status> fromYang(String text) {
        for (Status status : values()) {
            if (status.yangName.equals(text)) {
                return Optional.of(status);
            }
        }
        return Optional.empty();
    }
}
