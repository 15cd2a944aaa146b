package org.yangtree.compiler.resolve.replay;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Optional;

import org.yangtree.compiler.api.ModelProcessingException;
import org.yangtree.compiler.frontend.builder.BuilderNode;
import org.yangtree.compiler.frontend.builder.Instruction;
import org.yangtree.compiler.model.Keyword;
import org.yangtree.compiler.resolve.ResolutionContext;

/**
 * State of replaying one node's blueprint: the node, the enclosing attribute statements and
 * the {@code type} statements currently open.
 */
public final class ReplayContext {

    private final BuilderNode node;
    private final ResolutionContext resolution;
    private final Deque<Instruction> open = new ArrayDeque<>();
    private final Deque<TypeSpec> types = new ArrayDeque<>();

    public ReplayContext(BuilderNode node, ResolutionContext resolution) {
        this.node = node;
        this.resolution = resolution;
    }

    public BuilderNode node() {
        return node;
    }

    public ResolutionContext resolution() {
        return resolution;
    }

    /**
     * Whether the instruction being handled is a direct substatement of the node.
     */
    public boolean isTopLevel() {
        return open.isEmpty();
    }

    /**
     * Keyword of the attribute statement directly enclosing the one being handled.
     */
    public Optional<Keyword> enclosingKeyword() {
        return Optional.ofNullable(open.peek()).map(Instruction::keyword);
    }

    void push(Instruction instruction) {
        open.push(instruction);
    }

    Instruction pop() {
        return open.pop();
    }

    public boolean hasOpenType() {
        return !types.isEmpty();
    }

    /**
     * The innermost open {@code type} statement.
     *
     * @throws ModelProcessingException if no type statement is open.
     */
    public TypeSpec currentType(Instruction instruction) {
        TypeSpec spec = types.peek();
        if (spec == null) {
            throw new ModelProcessingException("'" + instruction.keyword().text() + "' outside of a type statement in "
                    + node.describe());
        }
        return spec;
    }

    public void pushType(TypeSpec spec) {
        types.push(spec);
    }

    public TypeSpec popType() {
        return types.pop();
    }

    public ModelProcessingException error(Instruction instruction, String message) {
        return new ModelProcessingException(node.getSource() + ":" + instruction.line() + ": " + message
                + " in " + node.describe());
    }
}
