// file: core/src/main/java/io/monosync/core/StaleBookmarkException.java
package io.monosync.core;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * A bookmark compare-and-swap lost: the bookmark no longer has the value the
 * caller expected. Nothing was changed.
 */
public final class StaleBookmarkException extends MonosyncException {
    private final BookmarkName bookmark;
    private final Optional<ChangesetId> expected;
    private final Optional<ChangesetId> actual;

    public StaleBookmarkException(BookmarkName bookmark, Optional<ChangesetId> expected, Optional<ChangesetId> actual) {
        super("bookmark " + bookmark + " is at " + actual.map(ChangesetId::hex).orElse("<none>")
                + ", expected " + expected.map(ChangesetId::hex).orElse("<none>"));
        this.bookmark = bookmark;
        this.expected = expected;
        this.actual = actual;
    }

    public BookmarkName bookmark() { return bookmark; }

    public Optional<ChangesetId> expected() { return expected; }

    public Optional<ChangesetId> actual() { return actual; }

    @Override
    public String kind() { return "StaleBookmark"; }

    @Override
    public Map<String, Object> context() {
        Map<String, Object> ctx = new LinkedHashMap<>();
        ctx.put("bookmark", bookmark.name());
        expected.ifPresent(e -> ctx.put("expected", e.hex()));
        actual.ifPresent(a -> ctx.put("actual", a.hex()));
        return ctx;
    }
}
