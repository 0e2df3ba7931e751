package org.stencilir.compiler.iir.access;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertEquals;

@Tag("unit")
class ExtentsTest {

    @Test
    void extentMerge_takesTheUnion() {
        assertEquals(new Extent(-1, 2), new Extent(-1, 0).merge(new Extent(0, 2)));
        assertEquals(new Extent(-1, 2), new Extent(0, 2).merge(new Extent(-1, 0)));
    }

    @Test
    void at_placesTheOffsetInBothBounds() {
        Extents extents = Extents.at(List.of(1, -2, 0));

        assertThat(extents.toList()).containsExactly(new Extent(1, 1), new Extent(-2, -2), Extent.ZERO);
    }

    @Test
    void shift_movesEveryDimension() {
        Extents shifted = new Extents(new Extent(-1, 1), Extent.ZERO, Extent.ZERO).shift(List.of(0, 1, -1));

        assertThat(shifted).isEqualTo(new Extents(new Extent(-1, 1), new Extent(1, 1), new Extent(-1, -1)));
    }

    @Test
    void contains_comparesEachDimension() {
        Extents wide = new Extents(new Extent(-2, 2), new Extent(-1, 1), Extent.ZERO);

        assertThat(wide.contains(Extents.at(1, -1, 0))).isTrue();
        assertThat(wide.contains(Extents.at(0, 0, 1))).isFalse();
    }

    @Test
    void isPointwiseInK_onlyForZeroVerticalExtent() {
        assertThat(Extents.at(3, -3, 0).isPointwiseInK()).isTrue();
        assertThat(Extents.at(0, 0, 1).isPointwiseInK()).isFalse();
    }
}
