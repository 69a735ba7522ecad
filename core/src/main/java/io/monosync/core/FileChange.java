// file: core/src/main/java/io/monosync/core/FileChange.java
package io.monosync.core;

import java.util.Objects;
import java.util.Optional;

/**
 * What a changeset does to one path.
 * <p>
 *  - Modified: the path now holds {@code content}. If {@code copyFrom} is set the
 *    new file was copied from another path in one of the changeset's parents.
 *  - Deleted: the path no longer exists.
 * <p>
 * A rename is a Deleted at the old path plus a Modified with copyFrom at the new
 * path, in the same changeset.
 */
public sealed interface FileChange permits FileChange.Modified, FileChange.Deleted {

    static Modified modified(ContentId content, FileType type, long size) {
        return new Modified(content, type, size, null);
    }

    static Deleted deleted() {
        return Deleted.INSTANCE;
    }

    /** Copy provenance: the source path and the parent changeset it is read from. */
    record CopyFrom(MPath path, ChangesetId changeset) {
        public CopyFrom {
            Objects.requireNonNull(path, "path");
            Objects.requireNonNull(changeset, "changeset");
        }
    }

    record Modified(ContentId content, FileType type, long size, CopyFrom copyFrom) implements FileChange {
        public Modified {
            Objects.requireNonNull(content, "content");
            Objects.requireNonNull(type, "type");
            if (size < 0) throw new IllegalArgumentException("size must be >= 0");
        }

        public Optional<CopyFrom> copySource() {
            return Optional.ofNullable(copyFrom);
        }

        public Modified withCopyFrom(CopyFrom newCopyFrom) {
            return new Modified(content, type, size, newCopyFrom);
        }
    }

    final class Deleted implements FileChange {
        private static final Deleted INSTANCE = new Deleted();

        private Deleted() {
        }

        @Override
        public String toString() {
            return "Deleted";
        }
    }
}
