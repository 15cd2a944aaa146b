package org.yangtree.compiler;

import java.io.IOException;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yangtree.compiler.api.ModelProcessingException;
import org.yangtree.compiler.api.ModuleSource;
import org.yangtree.compiler.frontend.builder.ModelTree;
import org.yangtree.compiler.frontend.builder.StatementBuilder;
import org.yangtree.compiler.frontend.lexer.Lexer;
import org.yangtree.compiler.frontend.module.ModuleIdentity;
import org.yangtree.compiler.frontend.module.ModuleQueue;
import org.yangtree.compiler.frontend.parser.StatementParser;
import org.yangtree.compiler.resolve.ResolutionContext;
import org.yangtree.compiler.resolve.ResolutionPipeline;
import org.yangtree.schema.CompiledSchema;
import org.yangtree.schema.SchemaCache;

/**
 * Compiles a set of YANG modules into a {@link CompiledSchema}.
 * <p>
 * The requested modules and everything they import or include are fetched through the
 * {@link ModuleSource}, each exactly once, and built into one shared tree. The tree is then
 * resolved by the {@link ResolutionPipeline}. Any error aborts the whole compilation: there is
 * no partial result, and nothing is written to a cache.
 * <p>
 * A compiler instance holds no per-compilation state and may be reused.
 */
public final class SchemaCompiler {

    private static final Logger log = LoggerFactory.getLogger(SchemaCompiler.class);

    private final ModuleSource source;
    private final ResolutionPipeline pipeline;

    public SchemaCompiler(ModuleSource source) {
        this(source, new ResolutionPipeline());
    }

    public SchemaCompiler(ModuleSource source, ResolutionPipeline pipeline) {
        this.source = source;
        this.pipeline = pipeline;
    }

    /**
     * Compiles the named modules and their dependencies.
     *
     * @param moduleNames the modules to compile.
     * @return the compiled schema.
     * @throws ModelProcessingException if a module cannot be loaded or the model is invalid.
     */
    public CompiledSchema compile(Collection<String> moduleNames) {
        long start = System.nanoTime();
        ModelTree tree = new ModelTree();
        ModuleQueue queue = new ModuleQueue();
        moduleNames.forEach(queue::register);

        for (Optional<String> next = queue.next(); next.isPresent(); next = queue.next()) {
            String name = next.get();
            String text;
            try {
                text = source.load(name);
            } catch (IOException e) {
                throw new ModelProcessingException("Cannot find yang module '" + name + "': " + e.getMessage(), e);
            }
            log.debug("Building module {}", name);
            new StatementParser(new Lexer(text, name).scanTokens(), name)
                    .parse(new StatementBuilder(tree, queue, name));
        }

        CompiledSchema schema = pipeline.run(new ResolutionContext(tree));
        log.info("Compiled {} module(s) into {} schema nodes in {} ms", queue.registered().size(), schema.size(),
                (System.nanoTime() - start) / 1_000_000);
        return schema;
    }

    /**
     * Compiles the given module set, using {@code cache} when it holds an entry for the set.
     * A fresh result is stored only after the compilation has fully succeeded.
     *
     * @param modules the module set, as determined by a
     *                {@link org.yangtree.compiler.frontend.module.ModuleSetScanner}.
     * @param cache   the schema cache.
     * @return the cached or freshly compiled schema.
     * @throws ModelProcessingException if compilation fails.
     */
    public CompiledSchema compile(Collection<ModuleIdentity> modules, SchemaCache cache) {
        String digest = SchemaCache.digest(modules);
        Optional<CompiledSchema> cached = cache.load(digest);
        if (cached.isPresent()) {
            return cached.get();
        }
        List<String> names = modules.stream().map(ModuleIdentity::name).toList();
        CompiledSchema schema = compile(names);
        cache.store(digest, schema);
        return schema;
    }
}
