package org.yangtree.compiler.frontend.module;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yangtree.compiler.api.ModelProcessingException;
import org.yangtree.compiler.api.ModuleSource;
import org.yangtree.compiler.frontend.lexer.Lexer;
import org.yangtree.compiler.frontend.parser.IStatementListener;
import org.yangtree.compiler.frontend.parser.StatementParser;

/**
 * Determines the identity of a module set without compiling it: starting from the requested
 * modules, reads only the header statements of each module ({@code revision}, {@code import},
 * {@code include}, {@code belongs-to}) and follows imports and includes through a
 * {@link ModuleQueue}.
 * <p>
 * The result addresses the schema cache, so a hit avoids building and resolving the tree.
 */
public final class ModuleSetScanner {

    private static final Logger log = LoggerFactory.getLogger(ModuleSetScanner.class);

    private final ModuleSource source;

    public ModuleSetScanner(ModuleSource source) {
        this.source = source;
    }

    /**
     * Scans {@code moduleNames} and everything they import or include.
     *
     * @return one identity per module (submodules are listed under their owning module), in
     *         discovery order.
     * @throws ModelProcessingException if a module cannot be loaded or its header does not parse.
     */
    public List<ModuleIdentity> scan(Collection<String> moduleNames) {
        ModuleQueue queue = new ModuleQueue();
        moduleNames.forEach(queue::register);

        Map<String, Header> headers = new LinkedHashMap<>();
        for (Optional<String> next = queue.next(); next.isPresent(); next = queue.next()) {
            String name = next.get();
            Header header = readHeader(name);
            headers.put(name, header);
            header.imports.forEach(queue::register);
            header.includes.forEach(queue::register);
        }

        List<ModuleIdentity> identities = new ArrayList<>();
        for (Header header : headers.values()) {
            if (header.belongsTo != null) {
                continue;
            }
            List<ModuleIdentity> submodules = new ArrayList<>();
            for (Header candidate : headers.values()) {
                if (header.name.equals(candidate.belongsTo)) {
                    submodules.add(ModuleIdentity.of(candidate.name, candidate.revision));
                }
            }
            identities.add(new ModuleIdentity(header.name, header.revision, submodules));
        }
        return identities;
    }

    private Header readHeader(String name) {
        String text;
        try {
            text = source.load(name);
        } catch (IOException e) {
            throw new ModelProcessingException("Cannot find yang module '" + name + "'", e);
        }
        Header header = new Header(name);
        new StatementParser(new Lexer(text, name).scanTokens(), name).parse(header);
        log.debug("Scanned {} revision {} ({} imports, {} includes)", name, header.revision,
                header.imports.size(), header.includes.size());
        return header;
    }

    /**
     * Collects the header statements directly below the module statement.
     */
    private static final class Header implements IStatementListener {

        private final String name;
        private final List<String> imports = new ArrayList<>();
        private final List<String> includes = new ArrayList<>();
        private String revision;
        private String belongsTo;
        private int depth = 0;

        Header(String name) {
            this.name = name;
        }

        @Override
        public void enterStatement(String keyword, String argument, int line) {
            if (depth == 1 && argument != null) {
                switch (keyword) {
                    case "import" -> imports.add(argument);
                    case "include" -> includes.add(argument);
                    case "belongs-to" -> belongsTo = argument;
                    // revision dates compare lexically
                    case "revision" -> {
                        if (revision == null || argument.compareTo(revision) > 0) {
                            revision = argument;
                        }
                    }
                    default -> {
                    }
                }
            }
            depth++;
        }

        @Override
        public void leaveStatement(String keyword) {
            depth--;
        }
    }
}
