package org.yangtree.compiler.types;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

@Tag("unit")
class RangeMergerTest {

    @Test
    void minInRefinementTakesParentLowerBound() {
        assertThat(RangeMerger.merge("1..200", "min..100")).isEqualTo("1..100");
    }

    @Test
    void maxInRefinementTakesParentUpperBound() {
        assertThat(RangeMerger.merge("1..200", "100..max")).isEqualTo("100..200");
    }

    @Test
    void withoutParentTheRefinementIsUsedVerbatim() {
        assertThat(RangeMerger.merge(null, "5..10")).isEqualTo("5..10");
        assertThat(RangeMerger.merge("5..10", null)).isEqualTo("5..10");
        assertThat(RangeMerger.merge(null, null)).isNull();
    }

    @Test
    void multiPartParentUsesOuterBounds() {
        assertThat(RangeMerger.merge("1..10|20..30", "min|max")).isEqualTo("1|30");
    }
}
