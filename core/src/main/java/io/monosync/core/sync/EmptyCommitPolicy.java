// file: core/src/main/java/io/monosync/core/sync/EmptyCommitPolicy.java
package io.monosync.core.sync;

/**
 * What to do with a commit whose file changes are all filtered out by path
 * rewriting (for example a large-repo commit touching only large-only paths).
 * <p>
 *  - SKIP: emit nothing and record working-copy equivalence instead of a mapping.
 *  - EMIT: emit a commit with no file changes and map it normally.
 * <p>
 * Commits that had no file changes to begin with, and merges, are always emitted.
 */
public enum EmptyCommitPolicy {
    SKIP,
    EMIT
}
