// file: core/src/main/java/io/monosync/core/sync/SyncDirection.java
package io.monosync.core.sync;

/** Which way a commit travels between the two repositories of a sync pair. */
public enum SyncDirection {
    SMALL_TO_LARGE,
    LARGE_TO_SMALL;

    public SyncDirection reverse() {
        return this == SMALL_TO_LARGE ? LARGE_TO_SMALL : SMALL_TO_LARGE;
    }
}
