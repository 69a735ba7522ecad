// file: storage/src/main/java/io/monosync/storage/SyncedCommitEntry.java
package io.monosync.storage;

import io.monosync.core.ChangesetId;
import io.monosync.core.RepositoryId;
import io.monosync.core.sync.SyncConfigVersion;

import java.util.Objects;

/** One synced pair: a small-repo commit and its large-repo counterpart under a config version. */
public record SyncedCommitEntry(
        RepositoryId smallRepo,
        ChangesetId smallId,
        RepositoryId largeRepo,
        ChangesetId largeId,
        SyncConfigVersion version
) {
    public SyncedCommitEntry {
        Objects.requireNonNull(smallRepo, "smallRepo");
        Objects.requireNonNull(smallId, "smallId");
        Objects.requireNonNull(largeRepo, "largeRepo");
        Objects.requireNonNull(largeId, "largeId");
        Objects.requireNonNull(version, "version");
    }
}
