package org.stencilir.compiler.iir.metadata;

import org.stencilir.compiler.api.InvariantViolationException;
import org.stencilir.compiler.api.IrErrorCode;
import org.stencilir.compiler.api.LookupFailureException;
import org.stencilir.compiler.diagnostics.DiagnosticsEngine;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.SortedMap;
import java.util.SortedSet;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Lineage of versioned variables: for each original AccessID the ordered list of the AccessIDs that
 * version it, the reverse map, and the set of every version ID.
 * <p>
 * Lineage is flat. A version always points at a root original, never at another version.
 */
public final class VariableVersions {

    private final SortedMap<Integer, List<Integer>> versionsByOriginal = new TreeMap<>();
    private final SortedMap<Integer, Integer> originalByVersion = new TreeMap<>();
    private final SortedSet<Integer> versionIds = new TreeSet<>();

    /**
     * Restores the three tables as they were persisted, without checking them.
     * Use {@link #validate(DiagnosticsEngine)} to check the result.
     *
     * @param versionsByOriginal Original ID to ordered version IDs.
     * @param versionIds All version IDs.
     * @param originalByVersion Version ID to original ID.
     * @return The restored lineage.
     */
    public static VariableVersions fromRaw(Map<Integer, List<Integer>> versionsByOriginal,
                                           Iterable<Integer> versionIds,
                                           Map<Integer, Integer> originalByVersion) {
        VariableVersions versions = new VariableVersions();
        versionsByOriginal.forEach((original, list) -> versions.versionsByOriginal.put(original, new ArrayList<>(list)));
        versionIds.forEach(versions.versionIds::add);
        versions.originalByVersion.putAll(originalByVersion);
        return versions;
    }

    /**
     * Records that {@code version} is a version of {@code original}. If {@code original} is itself a
     * version, the new version is attached to its root original instead. Registering the same pair
     * twice has no effect.
     *
     * @param original The versioned AccessID.
     * @param version The new version's AccessID.
     * @throws InvariantViolationException if {@code version} equals its original, already versions
     *         another original, or has versions of its own.
     */
    public void addVersion(int original, int version) {
        int root = originalByVersion.getOrDefault(original, original);
        if (version == original || version == root) {
            throw new InvariantViolationException(IrErrorCode.SELF_VERSION,
                    "AccessID " + version + " cannot be a version of itself");
        }
        Integer parent = originalByVersion.get(version);
        if (parent != null) {
            if (parent == root) {
                return;
            }
            throw new InvariantViolationException(IrErrorCode.VERSION_REPARENTED,
                    "AccessID " + version + " already versions " + parent + ", cannot re-parent it under " + root);
        }
        if (versionsByOriginal.containsKey(version)) {
            throw new InvariantViolationException(IrErrorCode.VERSION_REPARENTED,
                    "AccessID " + version + " is an original with versions and cannot become a version of " + root);
        }
        versionsByOriginal.computeIfAbsent(root, k -> new ArrayList<>()).add(version);
        originalByVersion.put(version, root);
        versionIds.add(version);
    }

    /**
     * @param id An AccessID.
     * @return {@code true} if {@code id} is a version or has versions.
     */
    public boolean isVersioned(int id) {
        return originalByVersion.containsKey(id) || versionsByOriginal.containsKey(id);
    }

    public boolean isVersion(int id) {
        return versionIds.contains(id);
    }

    /**
     * @param version A version ID.
     * @return The original it versions.
     * @throws LookupFailureException if {@code version} is not a version.
     */
    public int originalOf(int version) {
        return findOriginalOf(version).orElseThrow(() -> new LookupFailureException(IrErrorCode.UNKNOWN_ACCESS_ID,
                "AccessID " + version + " is not a version"));
    }

    public Optional<Integer> findOriginalOf(int version) {
        return Optional.ofNullable(originalByVersion.get(version));
    }

    /**
     * @param id An original or one of its versions.
     * @return The versions of the original, in creation order.
     * @throws LookupFailureException if {@code id} is not versioned.
     */
    public List<Integer> versionsOf(int id) {
        int root = originalByVersion.getOrDefault(id, id);
        List<Integer> versions = versionsByOriginal.get(root);
        if (versions == null) {
            throw new LookupFailureException(IrErrorCode.UNKNOWN_ACCESS_ID, "AccessID " + id + " is not versioned");
        }
        return Collections.unmodifiableList(versions);
    }

    public Map<Integer, List<Integer>> getVersionsByOriginal() {
        return Collections.unmodifiableSortedMap(versionsByOriginal);
    }

    public Map<Integer, Integer> getOriginalByVersion() {
        return Collections.unmodifiableSortedMap(originalByVersion);
    }

    public Set<Integer> getVersionIds() {
        return Collections.unmodifiableSortedSet(versionIds);
    }

    public boolean isEmpty() {
        return versionsByOriginal.isEmpty() && originalByVersion.isEmpty() && versionIds.isEmpty();
    }

    /**
     * @return The largest ID mentioned in the tables, or {@link Integer#MIN_VALUE} if empty.
     */
    int maxId() {
        int max = Integer.MIN_VALUE;
        for (Map.Entry<Integer, List<Integer>> entry : versionsByOriginal.entrySet()) {
            max = Math.max(max, entry.getKey());
            for (int v : entry.getValue()) {
                max = Math.max(max, v);
            }
        }
        for (int v : versionIds) {
            max = Math.max(max, v);
        }
        return max;
    }

    /**
     * Checks that the three tables describe the same flat lineage.
     * @param diagnostics Receives one error per inconsistency.
     */
    public void validate(DiagnosticsEngine diagnostics) {
        Set<Integer> listed = new TreeSet<>();
        versionsByOriginal.forEach((original, versions) -> {
            if (originalByVersion.containsKey(original)) {
                diagnostics.reportError(IrErrorCode.INCONSISTENT_VERSIONS,
                        "Original " + original + " is itself a version of " + originalByVersion.get(original));
            }
            for (int version : versions) {
                if (version == original) {
                    diagnostics.reportError(IrErrorCode.SELF_VERSION, "AccessID " + version + " is listed as a version of itself");
                }
                if (!listed.add(version)) {
                    diagnostics.reportError(IrErrorCode.VERSION_REPARENTED,
                            "AccessID " + version + " is listed as a version more than once");
                }
                if (!Objects.equals(originalByVersion.get(version), original)) {
                    diagnostics.reportError(IrErrorCode.INCONSISTENT_VERSIONS,
                            "Version " + version + " of " + original + " maps back to " + originalByVersion.get(version));
                }
            }
        });
        if (!listed.equals(versionIds)) {
            diagnostics.reportError(IrErrorCode.INCONSISTENT_VERSIONS,
                    "Version ID set " + versionIds + " differs from the listed versions " + listed);
        }
        if (!originalByVersion.keySet().equals(versionIds)) {
            diagnostics.reportError(IrErrorCode.INCONSISTENT_VERSIONS,
                    "Reverse map covers " + originalByVersion.keySet() + " but the version IDs are " + versionIds);
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof VariableVersions that)) return false;
        return versionsByOriginal.equals(that.versionsByOriginal)
                && originalByVersion.equals(that.originalByVersion)
                && versionIds.equals(that.versionIds);
    }

    @Override
    public int hashCode() {
        return Objects.hash(versionsByOriginal, originalByVersion, versionIds);
    }

    @Override
    public String toString() {
        return "VariableVersions" + versionsByOriginal;
    }
}
