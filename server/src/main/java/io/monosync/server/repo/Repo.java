// file: server/src/main/java/io/monosync/server/repo/Repo.java
package io.monosync.server.repo;

import io.monosync.core.BookmarkName;
import io.monosync.core.Changeset;
import io.monosync.core.ChangesetId;
import io.monosync.core.RepositoryId;
import io.monosync.storage.AltHashStore;
import io.monosync.storage.Bookmark;
import io.monosync.storage.BookmarkStore;
import io.monosync.storage.ChangesetStore;
import io.monosync.storage.ContentStore;
import io.monosync.storage.LegacyRevisionStore;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * One repository and the stores that hold its state.
 * <p>
 * Changesets and content blobs are private to the repository; bookmarks and
 * identifier indices live in shared tables keyed by repository id, and this
 * class scopes them.
 */
public final class Repo {

    private final RepositoryId id;
    private final String name;
    private final ChangesetStore changesets;
    private final ContentStore contents;
    private final BookmarkStore bookmarks;
    private final LegacyRevisionStore legacyRevisions;
    private final AltHashStore altHashes;
    private final boolean assignsLegacyRevisions;

    public Repo(
            RepositoryId id,
            String name,
            ChangesetStore changesets,
            ContentStore contents,
            BookmarkStore bookmarks,
            LegacyRevisionStore legacyRevisions,
            AltHashStore altHashes,
            boolean assignsLegacyRevisions
    ) {
        this.id = Objects.requireNonNull(id, "id");
        this.name = Objects.requireNonNull(name, "name");
        this.changesets = Objects.requireNonNull(changesets, "changesets");
        this.contents = Objects.requireNonNull(contents, "contents");
        this.bookmarks = Objects.requireNonNull(bookmarks, "bookmarks");
        this.legacyRevisions = Objects.requireNonNull(legacyRevisions, "legacyRevisions");
        this.altHashes = Objects.requireNonNull(altHashes, "altHashes");
        this.assignsLegacyRevisions = assignsLegacyRevisions;
        if (name.isBlank()) throw new IllegalArgumentException("repo name must not be blank");
    }

    public RepositoryId id() { return id; }

    public String name() { return name; }

    public ChangesetStore changesets() { return changesets; }

    public ContentStore contents() { return contents; }

    public BookmarkStore bookmarkStore() { return bookmarks; }

    public LegacyRevisionStore legacyRevisions() { return legacyRevisions; }

    public AltHashStore altHashes() { return altHashes; }

    public boolean assignsLegacyRevisions() { return assignsLegacyRevisions; }

    public Changeset load(ChangesetId cs) {
        return changesets.load(cs);
    }

    public Optional<ChangesetId> bookmark(BookmarkName bookmark) {
        return bookmarks.read(id, bookmark);
    }

    public boolean compareAndSwapBookmark(BookmarkName bookmark, Optional<ChangesetId> expected, ChangesetId target) {
        return bookmarks.compareAndSwap(id, bookmark, expected, target);
    }

    public boolean deleteBookmark(BookmarkName bookmark, ChangesetId expected) {
        return bookmarks.delete(id, bookmark, expected);
    }

    public List<Bookmark> listBookmarks(String prefix, int limit) {
        return bookmarks.list(id, prefix, limit);
    }

    @Override
    public String toString() {
        return name + "(" + id + ")";
    }
}
