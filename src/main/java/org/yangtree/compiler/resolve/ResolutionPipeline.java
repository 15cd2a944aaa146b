package org.yangtree.compiler.resolve;

import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yangtree.compiler.resolve.passes.AnnotationExtractionPass;
import org.yangtree.compiler.resolve.passes.AugmentPass;
import org.yangtree.compiler.resolve.passes.ConfigInheritancePass;
import org.yangtree.compiler.resolve.passes.DeviationPass;
import org.yangtree.compiler.resolve.passes.GroupingExpansionPass;
import org.yangtree.compiler.resolve.passes.IdentityClosurePass;
import org.yangtree.compiler.resolve.passes.InstructionCleanupPass;
import org.yangtree.compiler.resolve.passes.InstructionReplayPass;
import org.yangtree.compiler.resolve.passes.LeafrefResolutionPass;
import org.yangtree.compiler.resolve.passes.NamespaceAssignmentPass;
import org.yangtree.compiler.resolve.passes.RangeNormalizationPass;
import org.yangtree.compiler.resolve.passes.TypedefResolutionPass;
import org.yangtree.schema.CompiledSchema;
import org.yangtree.schema.SchemaFlattener;

/**
 * Runs the resolution passes in their fixed order and flattens the result.
 * <p>
 * Each pass relies on the ones before it: replay needs the final tree shape, typedef
 * resolution needs replayed types, leafref resolution needs concrete types at the target, and
 * so on. The first failure aborts the run.
 */
public final class ResolutionPipeline {

    private static final Logger log = LoggerFactory.getLogger(ResolutionPipeline.class);

    private final List<IResolutionPass> passes;
    private final SchemaFlattener flattener = new SchemaFlattener();

    public ResolutionPipeline() {
        this(List.of(
                new GroupingExpansionPass(),
                new AugmentPass(),
                new DeviationPass(),
                new InstructionReplayPass(),
                new TypedefResolutionPass(),
                new RangeNormalizationPass(),
                new IdentityClosurePass(),
                new LeafrefResolutionPass(),
                new ConfigInheritancePass(),
                new NamespaceAssignmentPass(),
                new InstructionCleanupPass(),
                new AnnotationExtractionPass()));
    }

    ResolutionPipeline(List<IResolutionPass> passes) {
        this.passes = List.copyOf(passes);
    }

    /**
     * The passes in execution order.
     */
    public List<IResolutionPass> passes() {
        return passes;
    }

    /**
     * Resolves the tree held by {@code context} in place and returns its compact form.
     */
    public CompiledSchema run(ResolutionContext context) {
        for (IResolutionPass pass : passes) {
            long start = System.nanoTime();
            pass.apply(context);
            log.debug("Pass {} finished in {} ms", pass.name(), (System.nanoTime() - start) / 1_000_000);
        }
        return flattener.flatten(context);
    }
}
