package org.yangtree.compiler.types;

/**
 * Thrown when a value cannot be converted to or from the wire form of a {@link YangType}.
 */
public class TypeMismatchException extends RuntimeException {

    public TypeMismatchException(String message) {
        super(message);
    }

    public TypeMismatchException(String message, Throwable cause) {
        super(message, cause);
    }
}
