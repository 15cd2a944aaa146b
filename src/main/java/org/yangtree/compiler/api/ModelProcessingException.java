package org.yangtree.compiler.api;

/**
 * Thrown when a set of modules cannot be compiled into a schema.
 * <p>
 * Possible causes include:
 * <ul>
 *   <li>a module cannot be retrieved from its {@link ModuleSource}</li>
 *   <li>grammar errors in the module text (unterminated strings, unbalanced blocks)</li>
 *   <li>unknown prefixes, groupings or typedefs</li>
 *   <li>augment or deviation targets that never resolve</li>
 *   <li>invalid arguments to {@code config}, {@code mandatory}, {@code status} or {@code deviate}</li>
 * </ul>
 * <p>
 * Any of these aborts the whole compilation; no partial schema is returned or cached.
 */
public class ModelProcessingException extends RuntimeException {

    /**
     * Creates a ModelProcessingException with the specified message.
     *
     * @param message Description of the failure, naming the module, path or statement involved
     */
    public ModelProcessingException(String message) {
        super(message);
    }

    /**
     * Creates a ModelProcessingException with the specified message and cause.
     *
     * @param message Description of the failure
     * @param cause The underlying exception that caused the failure
     */
    public ModelProcessingException(String message, Throwable cause) {
        super(message, cause);
    }
}
