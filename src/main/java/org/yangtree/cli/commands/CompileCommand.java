package org.yangtree.cli.commands;

import java.io.PrintWriter;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.Callable;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yangtree.cli.CommandLineInterface;
import org.yangtree.cli.rendering.SchemaTreePrinter;
import org.yangtree.compiler.SchemaCompiler;
import org.yangtree.compiler.api.InternalSchemaException;
import org.yangtree.compiler.api.ModelProcessingException;
import org.yangtree.compiler.frontend.io.DirectoryModuleSource;
import org.yangtree.compiler.frontend.module.ModuleIdentity;
import org.yangtree.compiler.frontend.module.ModuleSetScanner;
import org.yangtree.schema.CompiledSchema;
import org.yangtree.schema.SchemaCache;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigException;

import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.ParentCommand;
import picocli.CommandLine.Spec;

/**
 * CLI command that compiles YANG modules from a directory.
 * <p>
 * By default the compiled schema is looked up in and written to the schema cache configured
 * under {@code yangtree.cache}. The exit code is 0 on success and 1 if the modules cannot be
 * loaded or do not form a valid model.
 */
@Command(
    name = "compile",
    description = "Compile YANG modules and their dependencies"
)
public class CompileCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(CompileCommand.class);

    @Parameters(
        arity = "1..*",
        paramLabel = "MODULE",
        description = "Names of the modules to compile (without revision or .yang suffix)"
    )
    private List<String> modules;

    @Option(
        names = {"-d", "--dir"},
        description = "Directory searched for <name>.yang and <name>@<revision>.yang (default: yangtree.modules.directory)"
    )
    private Path directory;

    @Option(
        names = {"--cache-dir"},
        description = "Schema cache directory (default: yangtree.cache.directory)"
    )
    private Path cacheDirectory;

    @Option(
        names = {"--no-cache"},
        description = "Neither read nor write the schema cache"
    )
    private boolean noCache;

    @Option(
        names = {"--rebuild"},
        description = "Ignore a cached schema, compile and replace the cache entry"
    )
    private boolean rebuild;

    @Option(
        names = {"--tree"},
        description = "Print the compiled schema tree"
    )
    private boolean printTree;

    @ParentCommand
    private CommandLineInterface parent;

    @Spec
    private CommandSpec spec;

    @Override
    public Integer call() {
        PrintWriter out = spec.commandLine().getOut();
        PrintWriter err = spec.commandLine().getErr();

        Config config;
        try {
            config = parent.getConfig();
        } catch (IllegalArgumentException | ConfigException e) {
            err.println("Error: " + e.getMessage());
            return 1;
        }

        Path moduleDir = directory != null ? directory : Path.of(config.getString("yangtree.modules.directory"));
        DirectoryModuleSource source = new DirectoryModuleSource(moduleDir);
        SchemaCompiler compiler = new SchemaCompiler(source);
        boolean useCache = !noCache && config.getBoolean("yangtree.cache.enabled");

        CompiledSchema schema;
        try {
            if (useCache) {
                Path cacheDir = cacheDirectory != null ? cacheDirectory : Path.of(config.getString("yangtree.cache.directory"));
                schema = compileCached(compiler, source, new SchemaCache(cacheDir));
            } else {
                schema = compiler.compile(modules);
            }
        } catch (ModelProcessingException e) {
            err.println("Error: " + e.getMessage());
            return 1;
        } catch (InternalSchemaException e) {
            log.error("Internal compiler error", e);
            err.println("Internal error: " + e.getMessage());
            return 1;
        }

        out.println("Compiled " + String.join(", ", modules) + ": " + schema.size() + " schema nodes, "
                + schema.namespaces().size() + " namespaces");
        if (printTree) {
            out.print(new SchemaTreePrinter().render(schema.root()));
        }
        out.flush();
        return 0;
    }

    private CompiledSchema compileCached(SchemaCompiler compiler, DirectoryModuleSource source, SchemaCache cache) {
        List<ModuleIdentity> identities = new ModuleSetScanner(source).scan(modules);
        if (!rebuild) {
            return compiler.compile(identities, cache);
        }
        CompiledSchema schema = compiler.compile(modules);
        cache.store(SchemaCache.digest(identities), schema);
        return schema;
    }
}
