// file: storage/src/main/java/io/monosync/storage/ChangesetStore.java
package io.monosync.storage;

import io.monosync.core.Changeset;
import io.monosync.core.ChangesetId;

import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Content-addressed store of immutable changesets for one repository.
 * <p>
 * put() is idempotent and requires every parent to be stored already, so the
 * graph is always closed under parents and each changeset has a generation
 * number: 1 for roots, otherwise 1 + the largest parent generation.
 */
public interface ChangesetStore {

    /**
     * Store a changeset (no-op if present).
     *
     * @return its id
     * @throws io.monosync.core.InvalidChangesetException if a parent is not stored
     */
    ChangesetId put(Changeset changeset);

    Optional<Changeset> get(ChangesetId id);

    /** Like {@link #get} but throws {@link io.monosync.core.NotFoundException}. */
    Changeset load(ChangesetId id);

    boolean exists(ChangesetId id);

    List<ChangesetId> parents(ChangesetId id);

    /** Generation number of a stored changeset. */
    long generation(ChangesetId id);

    /** Ids of every stored changeset. */
    Set<ChangesetId> ids();
}
