// file: storage/src/main/java/io/monosync/storage/AltHashStore.java
package io.monosync.storage;

import io.monosync.core.AltHash;
import io.monosync.core.ChangesetId;
import io.monosync.core.RepositoryId;

import java.util.Optional;

/** Native id <-> alternate-system hash index, per repository. */
public interface AltHashStore {

    /**
     * Record the alternate hash of a commit. Re-recording the same pair is a
     * no-op; a different hash for the commit, or a hash already owned by
     * another commit, throws IllegalStateException.
     */
    void put(RepositoryId repo, ChangesetId id, AltHash hash);

    Optional<AltHash> get(RepositoryId repo, ChangesetId id);

    Optional<ChangesetId> byHash(RepositoryId repo, AltHash hash);
}
