package io.github.manjago.chimera.incremental;

import java.util.Map;
import java.util.Set;

/**
 * Result of comparing current forms with the previous run.
 *
 * @param digests   current digest of every form, by form id
 * @param changed   forms to rescan, with the reason
 * @param unchanged forms whose previous results are reused
 * @param removed   stored forms that no longer exist
 */
public record ChangeSet(
    Map<String, FormDigest> digests,
    Map<String, ChangeReason> changed,
    Set<String> unchanged,
    Set<String> removed
) {

    public ChangeSet {
        digests = Map.copyOf(digests);
        changed = Map.copyOf(changed);
        unchanged = Set.copyOf(unchanged);
        removed = Set.copyOf(removed);
    }

    public boolean isChanged(String formId) {
        return changed.containsKey(formId);
    }

    @Override
    public String toString() {
        return String.format("ChangeSet[changed=%d, unchanged=%d, removed=%d]",
                changed.size(), unchanged.size(), removed.size());
    }
}
