// file: core/src/main/java/io/monosync/core/TooManyRetriesException.java
package io.monosync.core;

import java.util.Map;

/** The bookmark kept moving under us. Transient; safe to retry later. */
public final class TooManyRetriesException extends MonosyncException {
    private final BookmarkName bookmark;
    private final int attempts;

    public TooManyRetriesException(BookmarkName bookmark, int attempts) {
        super("gave up publishing to " + bookmark + " after " + attempts + " attempts");
        this.bookmark = bookmark;
        this.attempts = attempts;
    }

    public BookmarkName bookmark() { return bookmark; }

    public int attempts() { return attempts; }

    @Override
    public String kind() { return "TooManyRetries"; }

    @Override
    public Map<String, Object> context() {
        return Map.of("bookmark", bookmark.name(), "attempts", attempts);
    }
}
