package org.stencilir.compiler.iir.access;

import java.util.Collections;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * The read and write footprints of a statement: two maps from AccessID to {@link Extents}.
 * <p>
 * Each AccessID appears at most once per map; recording it again widens its extents to cover both
 * accesses. The maps are sorted by AccessID so that iteration and encoding are deterministic.
 */
public final class Accesses {

    private final SortedMap<Integer, Extents> writes = new TreeMap<>();
    private final SortedMap<Integer, Extents> reads = new TreeMap<>();

    public Accesses() {
    }

    /**
     * Creates a copy of another access set.
     * @param other The accesses to copy.
     */
    public Accesses(Accesses other) {
        writes.putAll(other.writes);
        reads.putAll(other.reads);
    }

    /**
     * Records a write, merging with an existing write of the same AccessID.
     * @param accessId The AccessID.
     * @param extents The extents of the write.
     */
    public void addWrite(int accessId, Extents extents) {
        writes.merge(accessId, Objects.requireNonNull(extents), Extents::merge);
    }

    /**
     * Records a read, merging with an existing read of the same AccessID.
     * @param accessId The AccessID.
     * @param extents The extents of the read.
     */
    public void addRead(int accessId, Extents extents) {
        reads.merge(accessId, Objects.requireNonNull(extents), Extents::merge);
    }

    public Map<Integer, Extents> getWrites() {
        return Collections.unmodifiableSortedMap(writes);
    }

    public Map<Integer, Extents> getReads() {
        return Collections.unmodifiableSortedMap(reads);
    }

    public Optional<Extents> findWrite(int accessId) {
        return Optional.ofNullable(writes.get(accessId));
    }

    public Optional<Extents> findRead(int accessId) {
        return Optional.ofNullable(reads.get(accessId));
    }

    public boolean hasWrite(int accessId) {
        return writes.containsKey(accessId);
    }

    public boolean hasRead(int accessId) {
        return reads.containsKey(accessId);
    }

    public boolean isEmpty() {
        return writes.isEmpty() && reads.isEmpty();
    }

    /**
     * Merges two access sets. For an AccessID present in both, the result's extents are the
     * per-dimension union. The operation is commutative and associative.
     *
     * @param a The first access set.
     * @param b The second access set.
     * @return A new access set; the inputs are unchanged.
     */
    public static Accesses merge(Accesses a, Accesses b) {
        Accesses result = new Accesses(a);
        b.writes.forEach(result::addWrite);
        b.reads.forEach(result::addRead);
        return result;
    }

    /**
     * @param a The candidate subset.
     * @param b The candidate superset.
     * @return {@code true} if every write and read of {@code a} is a write or read, respectively,
     *         of {@code b} whose extents contain those of {@code a}.
     */
    public static boolean isSubsetOf(Accesses a, Accesses b) {
        return isCovered(a.writes, b.writes) && isCovered(a.reads, b.reads);
    }

    /**
     * @param a The first access set.
     * @param b The second access set.
     * @return {@code true} if both sets touch a common AccessID, in any map.
     */
    public static boolean overlaps(Accesses a, Accesses b) {
        return touches(a.writes, b) || touches(a.reads, b);
    }

    /**
     * @param a The first access set.
     * @param b The second access set.
     * @return {@code true} if a common AccessID is written by at least one side.
     */
    public static boolean conflicts(Accesses a, Accesses b) {
        return touches(a.writes, b) || a.reads.keySet().stream().anyMatch(b.writes::containsKey);
    }

    private static boolean isCovered(Map<Integer, Extents> sub, Map<Integer, Extents> sup) {
        for (Map.Entry<Integer, Extents> entry : sub.entrySet()) {
            Extents covering = sup.get(entry.getKey());
            if (covering == null || !covering.contains(entry.getValue())) {
                return false;
            }
        }
        return true;
    }

    private static boolean touches(Map<Integer, Extents> accesses, Accesses other) {
        return accesses.keySet().stream().anyMatch(id -> other.writes.containsKey(id) || other.reads.containsKey(id));
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Accesses that)) return false;
        return writes.equals(that.writes) && reads.equals(that.reads);
    }

    @Override
    public int hashCode() {
        return Objects.hash(writes, reads);
    }

    @Override
    public String toString() {
        return "Accesses{writes=" + writes + ", reads=" + reads + '}';
    }
}
