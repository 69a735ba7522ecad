// file: core/src/main/java/io/monosync/core/sync/BookmarkCorrespondence.java
package io.monosync.core.sync;

import io.monosync.core.BookmarkName;

import java.util.Objects;
import java.util.Optional;

/**
 * Decides how a small-repo bookmark appears in the large repository.
 * <p>
 *  - Common bookmarks keep their name on both sides.
 *  - Every other bookmark is mirrored as "{bookmarkPrefix}/{name}" in the large
 *    repository, so it cannot collide with an unrelated large-repo bookmark.
 * <p>
 * The small repository's bookmark names are never rewritten.
 */
public final class BookmarkCorrespondence {

    /** Outcome of {@link #resolve(BookmarkName)}. */
    public record Resolution(BookmarkName smallName, BookmarkName largeName, boolean common) {}

    private final CommitSyncConfig config;

    public BookmarkCorrespondence(CommitSyncConfig config) {
        this.config = Objects.requireNonNull(config, "config");
    }

    /** Large-repo name for a small-repo bookmark. */
    public Resolution resolve(BookmarkName smallName) {
        if (config.commonBookmarks().contains(smallName)) {
            return new Resolution(smallName, smallName, true);
        }
        return new Resolution(smallName, BookmarkName.of(config.bookmarkPrefix() + "/" + smallName.name()), false);
    }

    /**
     * Inverse of {@link #resolve}: the small-repo bookmark a large-repo bookmark
     * mirrors, or empty if it is local to the large repository.
     */
    public Optional<BookmarkName> smallNameFor(BookmarkName largeName) {
        if (config.commonBookmarks().contains(largeName)) {
            return Optional.of(largeName);
        }
        String ns = config.bookmarkPrefix() + "/";
        if (!largeName.startsWith(ns)) {
            return Optional.empty();
        }
        BookmarkName small = BookmarkName.of(largeName.name().substring(ns.length()));
        // A namespaced copy of a common name is not a mirror of anything.
        if (config.commonBookmarks().contains(small)) {
            return Optional.empty();
        }
        return Optional.of(small);
    }
}
