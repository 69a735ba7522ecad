// file: storage/src/main/java/io/monosync/storage/SyncedCommitMapping.java
package io.monosync.storage;

import io.monosync.core.ChangesetId;
import io.monosync.core.RepositoryId;
import io.monosync.core.sync.SyncConfigVersion;

import java.util.Optional;

/**
 * Append-only relation between small-repo and large-repo commits.
 * <p>
 *  - insert() of an identical entry is a no-op; an entry that gives either
 *    side a different counterpart under the same repo pair and version fails
 *    with {@link io.monosync.core.MappingConflictException}.
 *  - lookups are O(1) in both directions.
 *  - entries are never changed or removed.
 */
public interface SyncedCommitMapping {

    /** @return true if the entry was new */
    boolean insert(SyncedCommitEntry entry);

    Optional<SyncedCommitEntry> getLarge(RepositoryId smallRepo, RepositoryId largeRepo,
                                         SyncConfigVersion version, ChangesetId smallId);

    Optional<SyncedCommitEntry> getSmall(RepositoryId smallRepo, RepositoryId largeRepo,
                                         SyncConfigVersion version, ChangesetId largeId);

    /** Newest entry for a small commit under any config version. */
    Optional<SyncedCommitEntry> findBySmall(RepositoryId smallRepo, RepositoryId largeRepo, ChangesetId smallId);

    /** Newest entry for a large commit under any config version. */
    Optional<SyncedCommitEntry> findByLarge(RepositoryId smallRepo, RepositoryId largeRepo, ChangesetId largeId);

    /**
     * Idempotent like {@link #insert}; a different equivalence for the same large
     * commit throws IllegalStateException.
     */
    boolean insertEquivalentWorkingCopy(WorkingCopyEquivalence equivalence);

    Optional<WorkingCopyEquivalence> getEquivalentWorkingCopy(RepositoryId smallRepo, RepositoryId largeRepo,
                                                              ChangesetId largeId);
}
