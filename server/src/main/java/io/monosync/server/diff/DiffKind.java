// file: server/src/main/java/io/monosync/server/diff/DiffKind.java
package io.monosync.server.diff;

public enum DiffKind {
    ADDED,
    REMOVED,
    CHANGED,
    MOVED,
    COPIED
}
