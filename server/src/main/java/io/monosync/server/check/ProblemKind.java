// file: server/src/main/java/io/monosync/server/check/ProblemKind.java
package io.monosync.server.check;

public enum ProblemKind {
    /** bookmark points at a changeset that is not stored */
    DANGLING_BOOKMARK,
    /** stored changeset re-hashes to a different id */
    HASH_MISMATCH,
    MISSING_PARENT,
    INVALID_CHANGESET,
    MISSING_CONTENT,
    CONTENT_HASH_MISMATCH,
    CONTENT_SIZE_MISMATCH,
    MISSING_LEGACY_REVISION,
    ASYMMETRIC_LEGACY_REVISION,
    ASYMMETRIC_ALT_HASH,
    ASYMMETRIC_MAPPING
}
