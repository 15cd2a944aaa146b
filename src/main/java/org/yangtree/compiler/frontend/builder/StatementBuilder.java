package org.yangtree.compiler.frontend.builder;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import org.yangtree.compiler.api.ModelProcessingException;
import org.yangtree.compiler.frontend.module.ModuleQueue;
import org.yangtree.compiler.frontend.parser.IStatementListener;
import org.yangtree.compiler.model.Identifier;
import org.yangtree.compiler.model.Keyword;
import org.yangtree.compiler.model.SchemaPath;
import org.yangtree.compiler.model.StatementKind;
import org.yangtree.compiler.types.BuiltinTypes;

/**
 * Builds the mutable schema tree of one module (or submodule) from statement events.
 * <p>
 * Structural statements become {@link BuilderNode}s under the innermost open node. Attribute
 * statements are not interpreted here: they are appended to the open node's blueprint as
 * {@link Instruction}s and replayed after the tree has its final shape, because groupings,
 * augments and deviations still move and copy nodes. Arguments that depend on the prefix
 * scope ({@code type}, {@code base}, {@code path}, target paths) are converted immediately,
 * since the scope only exists while the module is being read.
 * <p>
 * Names declared inside a grouping stay lazy until the grouping is instantiated; grouping,
 * typedef, identity, uses and type names always bind to the module being read.
 * <p>
 * Imports and includes are only registered with the {@link ModuleQueue}; the caller drains
 * the queue and feeds each module through a new builder over the same {@link ModelTree}.
 */
public final class StatementBuilder implements IStatementListener {

    private static final String METADATA_MODULE = "ietf-yang-metadata";
    private static final String ANNOTATION_EXTENSION = "annotation";
    private static final String UNNAMED_CASE = "unnamed";

    private final ModelTree tree;
    private final ModuleQueue queue;
    private final String sourceName;

    private final Deque<BuilderNode> nodes = new ArrayDeque<>();
    private final Deque<Frame> frames = new ArrayDeque<>();
    private final Deque<Map<String, String>> prefixScopes = new ArrayDeque<>();

    private String currentModule;
    private int groupingDepth = 0;
    private int ignoreDepth = 0;

    /**
     * An open statement: either a node-creating one or an attribute being recorded.
     */
    private record Frame(Keyword keyword, boolean structural) {
    }

    /**
     * @param tree       the tree shared by the compilation.
     * @param queue      receives imported and included module names.
     * @param sourceName the module name used in diagnostics.
     */
    public StatementBuilder(ModelTree tree, ModuleQueue queue, String sourceName) {
        this.tree = tree;
        this.queue = queue;
        this.sourceName = sourceName;
        this.nodes.push(tree.getRoot());
        this.prefixScopes.push(new HashMap<>());
    }

    @Override
    public void enterStatement(String keywordText, String argument, int line) {
        if (ignoreDepth > 0) {
            ignoreDepth++;
            return;
        }
        if (keywordText.indexOf(':') >= 0) {
            enterExtension(keywordText, argument, line);
            return;
        }
        Keyword keyword = Keyword.fromText(keywordText).orElse(null);
        if (keyword == null) {
            ignoreDepth = 1;
            return;
        }
        switch (keyword.role()) {
            case DIRECTIVE -> {
                handleDirective(keyword, argument, line);
                ignoreDepth = 1;
            }
            case STRUCTURAL -> enterNode(keyword, argument, line);
            case ATTRIBUTE -> {
                nodes.peek().getBlueprint().add(Instruction.enter(keyword, convertArgument(keyword, argument, line), line));
                frames.push(new Frame(keyword, false));
            }
        }
    }

    @Override
    public void leaveStatement(String keywordText) {
        if (ignoreDepth > 0) {
            ignoreDepth--;
            return;
        }
        Frame frame = frames.pop();
        if (!frame.structural()) {
            BuilderNode owner = nodes.peek();
            owner.getBlueprint().add(Instruction.leave(frame.keyword(), owner.getLine()));
            return;
        }
        leaveNode(nodes.pop());
    }

    private void handleDirective(Keyword keyword, String argument, int line) {
        switch (keyword) {
            case INCLUDE -> queue.register(requireArgument(keyword.text(), argument, line));
            case PREFIX -> bindPrefix(requireArgument(keyword.text(), argument, line), line);
            default -> throw new IllegalStateException("Unhandled directive " + keyword);
        }
    }

    private void bindPrefix(String prefix, int line) {
        BuilderNode owner = nodes.peek();
        String module = switch (owner.getKind()) {
            case MODULE -> currentModule;
            case IMPORT, BELONGS_TO -> owner.getName().name();
            default -> throw error("'prefix' is not allowed inside " + owner.getKind().yangName(), line);
        };
        prefixScopes.peek().put(prefix, module);
    }

    private void enterNode(Keyword keyword, String argument, int line) {
        StatementKind kind = keyword.kind();
        BuilderNode parent = nodes.peek();
        if (!frames.isEmpty() && !frames.peek().structural()) {
            throw error("'" + keyword.text() + "' is not allowed inside '" + frames.peek().keyword().text() + "'", line);
        }

        switch (kind) {
            case MODULE -> {
                currentModule = requireArgument(keyword.text(), argument, line);
                prefixScopes.push(new HashMap<>());
            }
            case SUBMODULE -> prefixScopes.push(new HashMap<>());
            case BELONGS_TO -> currentModule = requireArgument(keyword.text(), argument, line);
            case IMPORT -> queue.register(requireArgument(keyword.text(), argument, line));
            default -> {
            }
        }

        BuilderNode node = new BuilderNode(nameFor(keyword, argument, line), kind, currentModule, sourceName, line);
        node.setArgument(argument);
        switch (kind) {
            case AUGMENT -> node.setTargetPath(parsePath(argument,
                    parent.getKind() == StatementKind.USES ? SchemaPath.Style.DESCENDANT : SchemaPath.Style.ABSOLUTE,
                    keyword, line));
            case REFINE -> node.setTargetPath(parsePath(argument, SchemaPath.Style.DESCENDANT, keyword, line));
            case DEVIATION -> node.setTargetPath(parsePath(argument, SchemaPath.Style.ABSOLUTE, keyword, line));
            default -> {
            }
        }
        parent.addChild(node);
        nodes.push(node);
        frames.push(new Frame(keyword, true));

        switch (kind) {
            case GROUPING -> {
                groupingDepth++;
                tree.registerGrouping(node);
            }
            case TYPEDEF -> tree.registerTypedef(node);
            case AUGMENT -> {
                if (parent.getKind() != StatementKind.USES) {
                    tree.registerAugment(node);
                }
            }
            case DEVIATION -> tree.registerDeviation(node);
            default -> {
            }
        }
    }

    private void leaveNode(BuilderNode node) {
        switch (node.getKind()) {
            case RPC, ACTION -> {
                ensureChild(node, Keyword.INPUT);
                ensureChild(node, Keyword.OUTPUT);
            }
            case GROUPING -> {
                groupingDepth--;
                node.detach();
            }
            case TYPEDEF -> node.detach();
            case MODULE, SUBMODULE -> {
                prefixScopes.pop();
                currentModule = null;
            }
            default -> {
            }
        }
        wrapShorthandCase(node);
    }

    private static void wrapShorthandCase(BuilderNode node) {
        BuilderNode parent = node.getParent();
        if (parent == null || parent.getKind() != StatementKind.CHOICE || !node.getKind().isShorthandCase()) {
            return;
        }
        int index = node.indexInParent();
        node.detach();
        parent.insertChildren(index, List.of(BuilderNode.caseWrapped(parent, node)));
    }

    private void ensureChild(BuilderNode node, Keyword keyword) {
        if (node.firstChild(keyword.kind()).isEmpty()) {
            node.addChild(new BuilderNode(nameFor(keyword, null, node.getLine()), keyword.kind(),
                    currentModule, sourceName, node.getLine()));
        }
    }

    private void enterExtension(String keywordText, String argument, int line) {
        if (!frames.isEmpty() && !frames.peek().structural()) {
            ignoreDepth = 1;
            return;
        }
        Identifier extension = Identifier.parseYang(keywordText, currentModule, prefixScopes.peek());
        BuilderNode node;
        if (METADATA_MODULE.equals(extension.module()) && ANNOTATION_EXTENSION.equals(extension.name())) {
            node = new BuilderNode(forcedName(requireArgument(keywordText, argument, line)),
                    StatementKind.ANNOTATE, currentModule, sourceName, line);
        } else {
            node = new BuilderNode(extension, StatementKind.EXTENDED, currentModule, sourceName, line);
        }
        node.setArgument(argument);
        nodes.peek().addChild(node);
        nodes.push(node);
        frames.push(new Frame(null, true));
    }

    private Identifier nameFor(Keyword keyword, String argument, int line) {
        return switch (keyword) {
            case MODULE, SUBMODULE, IMPORT, BELONGS_TO, DEVIATE ->
                    Identifier.builtin(requireArgument(keyword.text(), argument, line));
            case AUGMENT, DEVIATION, REFINE -> forcedName(keyword.text());
            case INPUT, OUTPUT -> dataName(keyword.text(), line);
            case CASE -> dataName(argument == null ? UNNAMED_CASE : argument, line);
            case GROUPING, TYPEDEF, IDENTITY -> validated(forcedName(requireArgument(keyword.text(), argument, line)), line);
            case USES -> Identifier.parseYang(requireArgument(keyword.text(), argument, line), currentModule, prefixScopes.peek());
            default -> dataName(requireArgument(keyword.text(), argument, line), line);
        };
    }

    private Identifier forcedName(String name) {
        return currentModule == null ? Identifier.builtin(name) : Identifier.of(currentModule, name);
    }

    private Identifier dataName(String name, int line) {
        String module = groupingDepth > 0 ? null : currentModule;
        return validated(Identifier.parseYang(name, module, prefixScopes.peek()), line);
    }

    private Identifier validated(Identifier identifier, int line) {
        if (!Identifier.isValidName(identifier.name())) {
            throw error("Invalid identifier '" + identifier.name() + "'", line);
        }
        return identifier;
    }

    private Object convertArgument(Keyword keyword, String argument, int line) {
        if (argument == null) {
            return null;
        }
        return switch (keyword) {
            case TYPE -> BuiltinTypes.isBuiltin(argument)
                    ? Identifier.builtin(argument)
                    : Identifier.parseYang(argument, currentModule, prefixScopes.peek());
            case BASE -> Identifier.parseYang(argument, currentModule, prefixScopes.peek());
            case PATH -> parsePath(argument, SchemaPath.Style.LEAFREF, keyword, line);
            default -> argument;
        };
    }

    private SchemaPath parsePath(String argument, SchemaPath.Style style, Keyword keyword, int line) {
        try {
            return SchemaPath.parse(requireArgument(keyword.text(), argument, line), style, currentModule, prefixScopes.peek());
        } catch (ModelProcessingException e) {
            throw new ModelProcessingException(sourceName + ":" + line + ": " + e.getMessage(), e);
        }
    }

    private String requireArgument(String keywordText, String argument, int line) {
        if (argument == null) {
            throw error("'" + keywordText + "' requires an argument", line);
        }
        return argument;
    }

    private ModelProcessingException error(String message, int line) {
        return new ModelProcessingException(sourceName + ":" + line + ": " + message);
    }
}
