package org.yangtree.compiler.frontend.io;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.Comparator;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Stream;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yangtree.compiler.api.ModuleSource;

/**
 * Finds modules in a directory tree by file name: {@code <name>.yang} or
 * {@code <name>@<YYYY-MM-DD>.yang}. When several revisions of a module exist, the newest
 * revision wins; an unrevisioned file is taken only if no revisioned one exists.
 */
public final class DirectoryModuleSource implements ModuleSource {

    private static final Logger log = LoggerFactory.getLogger(DirectoryModuleSource.class);

    private static final Pattern FILE_NAME = Pattern.compile("(.+?)(?:@(\\d{4}-\\d{2}-\\d{2}))?\\.yang");

    private final Path root;

    public DirectoryModuleSource(Path root) {
        this.root = root;
    }

    @Override
    public String load(String moduleName) throws IOException {
        Path file = locate(moduleName)
                .orElseThrow(() -> new NoSuchFileException(root.resolve(moduleName + ".yang").toString(), null,
                        "No file for module '" + moduleName + "' below " + root));
        log.debug("Loading module {} from {}", moduleName, file);
        return SourceLoader.loadFile(file).content();
    }

    /**
     * The file holding the newest revision of {@code moduleName}, if any.
     */
    public Optional<Path> locate(String moduleName) throws IOException {
        if (!Files.isDirectory(root)) {
            throw new NoSuchFileException(root.toString(), null, "Module directory does not exist");
        }
        try (Stream<Path> files = Files.walk(root)) {
            return files
                    .filter(Files::isRegularFile)
                    .map(path -> Candidate.parse(path, moduleName))
                    .flatMap(Optional::stream)
                    .max(Comparator.comparing(Candidate::revision))
                    .map(Candidate::path);
        }
    }

    private record Candidate(Path path, String revision) {

        static Optional<Candidate> parse(Path path, String moduleName) {
            Matcher matcher = FILE_NAME.matcher(path.getFileName().toString());
            if (!matcher.matches() || !matcher.group(1).equals(moduleName)) {
                return Optional.empty();
            }
            String revision = matcher.group(2);
            return Optional.of(new Candidate(path, revision == null ? "" : revision));
        }
    }
}
