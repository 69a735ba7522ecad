// file: storage/src/main/java/io/monosync/storage/LegacyRevisionStore.java
package io.monosync.storage;

import io.monosync.core.ChangesetId;
import io.monosync.core.RepositoryId;

import java.util.Optional;
import java.util.OptionalLong;

/**
 * Sequential legacy revision numbers, per repository.
 * <p>
 * A commit gets at most one number, numbers are issued in strictly increasing
 * order starting at 1, and no number is ever reused.
 */
public interface LegacyRevisionStore {

    /** Number of {@code id}, issuing the next one if it has none yet. */
    long assign(RepositoryId repo, ChangesetId id);

    OptionalLong get(RepositoryId repo, ChangesetId id);

    Optional<ChangesetId> byRevision(RepositoryId repo, long revision);

    /** Highest number issued so far, 0 if none. */
    long latest(RepositoryId repo);
}
