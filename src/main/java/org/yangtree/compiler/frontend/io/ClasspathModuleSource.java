package org.yangtree.compiler.frontend.io;

import java.io.IOException;

import org.yangtree.compiler.api.ModuleSource;

/**
 * Loads {@code <prefix>/<name>.yang} resources from the classpath, e.g. modules bundled with
 * an application.
 */
public final class ClasspathModuleSource implements ModuleSource {

    private final String prefix;

    /**
     * @param prefix the resource directory, without leading or trailing slash.
     */
    public ClasspathModuleSource(String prefix) {
        this.prefix = prefix;
    }

    @Override
    public String load(String moduleName) throws IOException {
        return SourceLoader.loadClasspath(prefix + "/" + moduleName + ".yang").content();
    }
}
