package org.yangtree.schema;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.Collection;
import java.util.Comparator;
import java.util.HexFormat;
import java.util.List;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yangtree.compiler.frontend.module.ModuleIdentity;

/**
 * File-system cache of compiled schemas, addressed by a digest of the module set.
 * <p>
 * Entries are written to a temporary file in the cache directory and moved into place
 * atomically, so concurrent readers see either nothing or a complete file. Any problem
 * reading an entry counts as a miss; any problem writing one is logged and ignored. The cache
 * never makes a compilation fail.
 */
public final class SchemaCache {

    private static final Logger log = LoggerFactory.getLogger(SchemaCache.class);

    private static final String FILE_PREFIX = "schema_";
    private static final String FILE_SUFFIX = ".bin";

    private final Path directory;
    private final SchemaCodec codec;

    public SchemaCache(Path directory) {
        this(directory, new SchemaCodec());
    }

    public SchemaCache(Path directory, SchemaCodec codec) {
        this.directory = directory;
        this.codec = codec;
    }

    /**
     * Computes the cache key of a module set: a hex SHA-256 over the codec format version and,
     * sorted by name, every module's name and revision followed by its submodules' names and
     * revisions. Input order does not matter.
     */
    public static String digest(Collection<ModuleIdentity> modules) {
        StringBuilder text = new StringBuilder("yangtree-schema-v").append(SchemaCodec.FORMAT_VERSION).append(';');
        List<ModuleIdentity> sorted = modules.stream().sorted(Comparator.comparing(ModuleIdentity::name)).toList();
        for (ModuleIdentity module : sorted) {
            text.append("mod:").append(module.name()).append(";rev:").append(revisionText(module)).append(';');
            for (ModuleIdentity submodule : module.submodules()) {
                text.append(" smod:").append(submodule.name()).append(";srev:").append(revisionText(submodule)).append(';');
            }
        }
        try {
            MessageDigest sha = MessageDigest.getInstance("SHA-256");
            return HexFormat.of().formatHex(sha.digest(text.toString().getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }

    private static String revisionText(ModuleIdentity module) {
        return module.revision() == null ? "" : module.revision();
    }

    public Path directory() {
        return directory;
    }

    public Path fileFor(String digest) {
        return directory.resolve(FILE_PREFIX + digest + FILE_SUFFIX);
    }

    /**
     * Loads the entry for {@code digest}.
     *
     * @return the schema, or empty if there is no readable, well-formed entry.
     */
    public Optional<CompiledSchema> load(String digest) {
        Path file = fileFor(digest);
        byte[] bytes;
        try {
            bytes = Files.readAllBytes(file);
        } catch (NoSuchFileException e) {
            log.debug("No cached schema at {}", file);
            return Optional.empty();
        } catch (IOException e) {
            log.warn("Cannot read cached schema {}: {}", file, e.getMessage());
            return Optional.empty();
        }
        try {
            CompiledSchema schema = codec.decode(bytes);
            log.info("Loaded cached schema {} ({} nodes)", file.getFileName(), schema.size());
            return Optional.of(schema);
        } catch (IOException e) {
            log.warn("Ignoring corrupt cached schema {}: {}", file, e.getMessage());
            return Optional.empty();
        }
    }

    /**
     * Stores {@code schema} under {@code digest}, replacing any previous entry.
     *
     * @return {@code true} if the entry was written.
     */
    public boolean store(String digest, CompiledSchema schema) {
        Path target = fileFor(digest);
        Path temp = null;
        try {
            Files.createDirectories(directory);
            temp = Files.createTempFile(directory, "temp_", ".tmp");
            Files.write(temp, codec.encode(schema));
            try {
                Files.move(temp, target, StandardCopyOption.ATOMIC_MOVE);
            } catch (AtomicMoveNotSupportedException e) {
                log.debug("Atomic move not supported in {}, replacing non-atomically", directory);
                Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING);
            }
            log.info("Stored compiled schema {} ({} nodes)", target.getFileName(), schema.size());
            return true;
        } catch (IOException e) {
            log.warn("Failed to store compiled schema {}: {}", target, e.getMessage());
            deleteQuietly(temp);
            return false;
        }
    }

    private static void deleteQuietly(Path temp) {
        if (temp == null) {
            return;
        }
        try {
            Files.deleteIfExists(temp);
        } catch (IOException cleanupEx) {
            log.warn("Failed to clean up temp file {}", temp, cleanupEx);
        }
    }
}
