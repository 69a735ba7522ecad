// file: storage/src/main/java/io/monosync/storage/WorkingCopyEquivalence.java
package io.monosync.storage;

import io.monosync.core.ChangesetId;
import io.monosync.core.RepositoryId;
import io.monosync.core.sync.SyncConfigVersion;

import java.util.Objects;
import java.util.Optional;

/**
 * Records that a large-repo commit was not synced because it rewrites to no
 * changes, and which small-repo commit has the same working copy (empty when
 * nothing of the small repo exists yet at that point in history).
 */
public record WorkingCopyEquivalence(
        RepositoryId largeRepo,
        ChangesetId largeId,
        RepositoryId smallRepo,
        Optional<ChangesetId> smallId,
        SyncConfigVersion version
) {
    public WorkingCopyEquivalence {
        Objects.requireNonNull(largeRepo, "largeRepo");
        Objects.requireNonNull(largeId, "largeId");
        Objects.requireNonNull(smallRepo, "smallRepo");
        Objects.requireNonNull(smallId, "smallId");
        Objects.requireNonNull(version, "version");
    }
}
