package org.stencilir.compiler.iir.access;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

@Tag("unit")
class AccessesTest {

    private static Accesses reads(int id, Extents extents) {
        Accesses accesses = new Accesses();
        accesses.addRead(id, extents);
        return accesses;
    }

    private static Accesses writes(int id, Extents extents) {
        Accesses accesses = new Accesses();
        accesses.addWrite(id, extents);
        return accesses;
    }

    private static Extents inI(int minus, int plus) {
        return new Extents(new Extent(minus, plus), Extent.ZERO, Extent.ZERO);
    }

    @Test
    void merge_unitesExtentsPerDimension() {
        Accesses merged = Accesses.merge(reads(1, inI(-1, 0)), reads(1, inI(0, 2)));

        assertThat(merged.findRead(1)).contains(inI(-1, 2));
        assertThat(merged.getWrites()).isEmpty();
    }

    @Test
    void merge_isCommutative() {
        Accesses a = reads(1, inI(-1, 0));
        a.addWrite(2, Extents.ZERO);
        Accesses b = reads(1, inI(0, 2));
        b.addRead(3, Extents.at(0, 1, 0));

        assertThat(Accesses.merge(a, b)).isEqualTo(Accesses.merge(b, a));
    }

    @Test
    void merge_isAssociative() {
        Accesses a = reads(1, inI(-1, 0));
        Accesses b = reads(1, inI(0, 2));
        b.addWrite(5, Extents.at(0, 0, -1));
        Accesses c = writes(5, Extents.at(0, 0, 1));
        c.addRead(1, new Extents(Extent.ZERO, new Extent(-3, 3), Extent.ZERO));

        assertThat(Accesses.merge(Accesses.merge(a, b), c)).isEqualTo(Accesses.merge(a, Accesses.merge(b, c)));
    }

    @Test
    void merge_leavesInputsUntouched() {
        Accesses a = reads(1, inI(-1, 0));
        Accesses b = reads(1, inI(0, 2));

        Accesses.merge(a, b);

        assertThat(a.findRead(1)).contains(inI(-1, 0));
        assertThat(b.findRead(1)).contains(inI(0, 2));
    }

    @Test
    void addRead_mergesRepeatedAccesses() {
        Accesses accesses = new Accesses();
        accesses.addRead(7, Extents.at(1, 0, 0));
        accesses.addRead(7, Extents.at(-2, 0, 0));

        assertThat(accesses.getReads()).containsOnlyKeys(7);
        assertThat(accesses.findRead(7)).contains(inI(-2, 1));
    }

    @Test
    void isSubsetOf_requiresContainedExtentsInTheSameMap() {
        Accesses small = reads(1, inI(0, 1));
        Accesses large = reads(1, inI(-1, 2));

        assertThat(Accesses.isSubsetOf(small, large)).isTrue();
        assertThat(Accesses.isSubsetOf(large, small)).isFalse();
        assertThat(Accesses.isSubsetOf(small, writes(1, inI(-1, 2)))).isFalse();
        assertThat(Accesses.isSubsetOf(new Accesses(), small)).isTrue();
    }

    @Test
    void overlaps_detectsAnySharedAccessId() {
        assertThat(Accesses.overlaps(reads(1, Extents.ZERO), reads(1, Extents.ZERO))).isTrue();
        assertThat(Accesses.overlaps(reads(1, Extents.ZERO), writes(1, Extents.ZERO))).isTrue();
        assertThat(Accesses.overlaps(reads(1, Extents.ZERO), reads(2, Extents.ZERO))).isFalse();
    }

    @Test
    void conflicts_requiresAWriteOnOneSide() {
        assertThat(Accesses.conflicts(reads(1, Extents.ZERO), reads(1, Extents.ZERO))).isFalse();
        assertThat(Accesses.conflicts(reads(1, Extents.ZERO), writes(1, Extents.ZERO))).isTrue();
        assertThat(Accesses.conflicts(writes(1, Extents.ZERO), reads(1, Extents.ZERO))).isTrue();
        assertThat(Accesses.conflicts(writes(1, Extents.ZERO), writes(2, Extents.ZERO))).isFalse();
    }

    @Test
    void copyConstructor_isIndependentOfTheOriginal() {
        Accesses original = reads(1, inI(0, 1));
        Accesses copy = new Accesses(original);

        copy.addRead(1, inI(-4, 0));
        copy.addWrite(2, Extents.ZERO);

        assertThat(original.findRead(1)).contains(inI(0, 1));
        assertThat(original.hasWrite(2)).isFalse();
    }
}
