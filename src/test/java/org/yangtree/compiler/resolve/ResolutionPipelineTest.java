package org.yangtree.compiler.resolve;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.mockito.InOrder;
import org.yangtree.compiler.api.ModelProcessingException;
import org.yangtree.compiler.frontend.builder.ModelTree;
import org.yangtree.schema.CompiledSchema;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;

@Tag("unit")
class ResolutionPipelineTest {

    @Test
    void defaultPassesRunInDependencyOrder() {
        assertThat(new ResolutionPipeline().passes()).extracting(IResolutionPass::name).containsExactly(
                "grouping-expansion",
                "augment",
                "deviation",
                "instruction-replay",
                "typedef-resolution",
                "range-normalization",
                "identity-closure",
                "leafref-resolution",
                "config-inheritance",
                "namespace-assignment",
                "instruction-cleanup",
                "annotation-extraction");
    }

    @Test
    void runsEachPassOnceThenFlattens() {
        IResolutionPass first = mock(IResolutionPass.class);
        IResolutionPass second = mock(IResolutionPass.class);
        ResolutionContext context = new ResolutionContext(new ModelTree());

        CompiledSchema schema = new ResolutionPipeline(List.of(first, second)).run(context);

        InOrder order = inOrder(first, second);
        order.verify(first).apply(context);
        order.verify(second).apply(context);
        assertThat(schema.size()).isEqualTo(1);
        assertThat(schema.root().name()).isEqualTo(ModelTree.ROOT_NAME);
    }

    @Test
    void firstFailureAbortsTheRun() {
        IResolutionPass failing = mock(IResolutionPass.class);
        IResolutionPass skipped = mock(IResolutionPass.class);
        doThrow(new ModelProcessingException("boom")).when(failing).apply(any());

        assertThatThrownBy(() -> new ResolutionPipeline(List.of(failing, skipped))
                .run(new ResolutionContext(new ModelTree())))
                .isInstanceOf(ModelProcessingException.class)
                .hasMessage("boom");
        verify(skipped, never()).apply(any());
    }
}
