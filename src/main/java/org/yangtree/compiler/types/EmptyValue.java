package org.yangtree.compiler.types;

/**
 * Native value of the YANG {@code empty} type.
 */
public enum EmptyValue {
    INSTANCE;

    @Override
    public String toString() {
        return "";
    }
}
