// file: core/src/main/java/io/monosync/core/UnsyncedAncestorException.java
package io.monosync.core;

import java.util.Map;

/**
 * A commit was rewritten before one of its parents was synced.
 * The caller must backfill ancestors first (or treat the push as failed).
 */
public final class UnsyncedAncestorException extends MonosyncException {
    private final ChangesetId source;
    private final ChangesetId missingParent;

    public UnsyncedAncestorException(ChangesetId source, ChangesetId missingParent) {
        super("cannot rewrite " + source + ": parent " + missingParent + " has no synced counterpart");
        this.source = source;
        this.missingParent = missingParent;
    }

    public ChangesetId source() { return source; }

    public ChangesetId missingParent() { return missingParent; }

    @Override
    public String kind() { return "UnsyncedAncestor"; }

    @Override
    public Map<String, Object> context() {
        return Map.of("source", source.hex(), "missingParent", missingParent.hex());
    }
}
