package org.yangtree.compiler.resolve;

/**
 * One whole-tree transformation of the resolution pipeline.
 * <p>
 * A pass may rely on every invariant established by the passes before it and must leave the
 * tree consistent for the passes after it. Failures are reported by throwing; the pipeline
 * never continues after a failed pass.
 */
public interface IResolutionPass {

    /**
     * A short name for logging and diagnostics.
     */
    String name();

    /**
     * Applies the pass to the whole tree.
     *
     * @param context the shared compilation state.
     */
    void apply(ResolutionContext context);
}
