// file: core/src/main/java/io/monosync/core/RebaseConflictException.java
package io.monosync.core;

import java.util.List;
import java.util.Map;

/**
 * Pushed commits touch paths that also changed on the bookmark since the
 * push's base. Nothing was published; the client should rebase and retry.
 */
public final class RebaseConflictException extends MonosyncException {
    private final BookmarkName bookmark;
    private final List<MPath> conflicts;

    public RebaseConflictException(BookmarkName bookmark, List<MPath> conflicts) {
        super("pushrebase onto " + bookmark + " conflicts on " + conflicts);
        this.bookmark = bookmark;
        this.conflicts = List.copyOf(conflicts);
    }

    public BookmarkName bookmark() { return bookmark; }

    public List<MPath> conflicts() { return conflicts; }

    @Override
    public String kind() { return "RebaseConflict"; }

    @Override
    public Map<String, Object> context() {
        return Map.of(
                "bookmark", bookmark.name(),
                "paths", conflicts.stream().map(MPath::toString).toList()
        );
    }
}
