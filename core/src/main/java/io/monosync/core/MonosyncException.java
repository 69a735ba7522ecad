// file: core/src/main/java/io/monosync/core/MonosyncException.java
package io.monosync.core;

import java.util.Map;

/**
 * Root of the typed failures the sync engine reports to callers.
 * <p>
 * Every subclass carries the context needed to diagnose it without access to
 * internal state; {@link #context()} exposes it as flat key/value pairs for
 * the HTTP layer.
 */
public abstract class MonosyncException extends RuntimeException {

    protected MonosyncException(String message) {
        super(message);
    }

    protected MonosyncException(String message, Throwable cause) {
        super(message, cause);
    }

    /** Short stable name of the failure kind, e.g. "RebaseConflict". */
    public abstract String kind();

    /** Diagnostic context (ids, paths, names) rendered as strings. */
    public abstract Map<String, Object> context();
}
