package org.yangtree.compiler.api;

/**
 * Thrown when the compiler reaches a state that a well-formed pass sequence can never produce,
 * e.g. an unresolved type reference or leafref that survives the pass meant to eliminate it,
 * or a placeholder type that is asked to convert a value.
 */
public class InternalSchemaException extends RuntimeException {

    public InternalSchemaException(String message) {
        super(message);
    }

    public InternalSchemaException(String message, Throwable cause) {
        super(message, cause);
    }
}
