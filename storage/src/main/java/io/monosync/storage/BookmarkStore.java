// file: storage/src/main/java/io/monosync/storage/BookmarkStore.java
package io.monosync.storage;

import io.monosync.core.BookmarkName;
import io.monosync.core.ChangesetId;
import io.monosync.core.RepositoryId;

import java.util.List;
import java.util.Optional;

/**
 * Named mutable pointers, scoped per repository. Every mutation is a
 * compare-and-swap against the value the caller last read; this is the only
 * serialization point for publishing commits.
 */
public interface BookmarkStore {

    Optional<ChangesetId> read(RepositoryId repo, BookmarkName name);

    /**
     * Point {@code name} at {@code newTarget} if it currently points at
     * {@code expected} (empty = bookmark must not exist).
     *
     * @return true if the swap happened
     */
    boolean compareAndSwap(RepositoryId repo, BookmarkName name, Optional<ChangesetId> expected, ChangesetId newTarget);

    /** Remove {@code name} if it currently points at {@code expected}. */
    boolean delete(RepositoryId repo, BookmarkName name, ChangesetId expected);

    /**
     * Bookmarks of a repository whose name starts with {@code prefix}, sorted
     * by name, at most {@code limit} entries.
     */
    List<Bookmark> list(RepositoryId repo, String prefix, int limit);
}
