// file: core/src/main/java/io/monosync/core/DivergedHistoryException.java
package io.monosync.core;

import java.util.Map;

/**
 * A push's base is neither an ancestor nor a descendant of the bookmark head,
 * so rebasing it would drop the base's own history. Nothing was published;
 * the client should push the missing ancestors as part of the stack.
 */
public final class DivergedHistoryException extends MonosyncException {
    private final BookmarkName bookmark;
    private final ChangesetId base;
    private final ChangesetId head;

    public DivergedHistoryException(BookmarkName bookmark, ChangesetId base, ChangesetId head) {
        super("push base " + base.hex() + " is not on " + bookmark + " at " + head.hex());
        this.bookmark = bookmark;
        this.base = base;
        this.head = head;
    }

    public BookmarkName bookmark() { return bookmark; }

    public ChangesetId base() { return base; }

    public ChangesetId head() { return head; }

    @Override
    public String kind() { return "DivergedHistory"; }

    @Override
    public Map<String, Object> context() {
        return Map.of(
                "bookmark", bookmark.name(),
                "base", base.hex(),
                "head", head.hex()
        );
    }
}
