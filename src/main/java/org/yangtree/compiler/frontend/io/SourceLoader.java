package org.yangtree.compiler.frontend.io;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.stream.Collectors;

/**
 * Reads module text from the file system or the classpath. Line endings are normalized to
 * {@code \n} so line numbers in diagnostics do not depend on the platform a module was
 * written on.
 */
public final class SourceLoader {

    /**
     * Result of loading a module file.
     *
     * @param content     the text, line endings normalized.
     * @param logicalName the path or resource name, for diagnostics.
     */
    public record LoadResult(String content, String logicalName) {}

    private SourceLoader() {}

    /**
     * Loads a file.
     *
     * @throws IOException if the file cannot be read.
     */
    public static LoadResult loadFile(Path path) throws IOException {
        String logicalName = path.toString().replace('\\', '/');
        String content = String.join("\n", Files.readAllLines(path, StandardCharsets.UTF_8)) + "\n";
        return new LoadResult(content, logicalName);
    }

    /**
     * Loads a classpath resource through the context class loader.
     *
     * @throws IOException if the resource does not exist or cannot be read.
     */
    public static LoadResult loadClasspath(String resourcePath) throws IOException {
        try (InputStream is = Thread.currentThread().getContextClassLoader().getResourceAsStream(resourcePath)) {
            if (is == null) {
                throw new IOException("Resource not found in classpath: " + resourcePath);
            }
            try (BufferedReader br = new BufferedReader(new InputStreamReader(is, StandardCharsets.UTF_8))) {
                String content = br.lines().collect(Collectors.joining("\n")) + "\n";
                return new LoadResult(content, resourcePath);
            }
        }
    }
}
