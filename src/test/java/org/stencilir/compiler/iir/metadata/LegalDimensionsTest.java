package org.stencilir.compiler.iir.metadata;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@Tag("unit")
class LegalDimensionsTest {

    @Test
    void fromFlags_defaultsToAllDimensions() {
        assertThat(LegalDimensions.fromFlags(List.of())).isEqualTo(LegalDimensions.IJK);
    }

    @Test
    void fromFlags_treatsNonZeroAsLegal() {
        LegalDimensions dimensions = LegalDimensions.fromFlags(List.of(1, 2, 0));

        assertThat(dimensions).isEqualTo(new LegalDimensions(true, true, false));
        assertThat(dimensions.toFlags()).containsExactly(1, 1, 0);
    }

    @Test
    void fromFlags_needsOneFlagPerDimension() {
        assertThatThrownBy(() -> LegalDimensions.fromFlags(List.of(1, 1))).isInstanceOf(IllegalArgumentException.class);
    }
}
