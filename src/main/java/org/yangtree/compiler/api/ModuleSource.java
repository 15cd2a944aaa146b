package org.yangtree.compiler.api;

import java.io.IOException;

/**
 * Retrieves the text of a YANG module or submodule by name.
 * <p>
 * Implementations may read from a directory, the classpath or a remote device. The compiler
 * calls {@link #load(String)} at most once per module and compilation.
 */
@FunctionalInterface
public interface ModuleSource {

    /**
     * Loads the source text of a module.
     *
     * @param moduleName the module or submodule name, without revision or file suffix.
     * @return the complete module text.
     * @throws IOException if the module cannot be found or read.
     */
    String load(String moduleName) throws IOException;
}
