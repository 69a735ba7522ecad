// file: server/src/main/java/io/monosync/server/diff/DiffEntry.java
package io.monosync.server.diff;

import io.monosync.core.MPath;

import java.util.Locale;
import java.util.Objects;
import java.util.Optional;

/**
 * One path-level difference.
 *
 * @param from   source path for MOVED and COPIED, empty otherwise
 * @param binary content (new side, or old side for REMOVED) has a NUL byte
 *               in its first 8000 bytes
 */
public record DiffEntry(MPath path, DiffKind kind, Optional<MPath> from, boolean binary) {
    public DiffEntry {
        Objects.requireNonNull(path, "path");
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(from, "from");
        if (from.isPresent() != (kind == DiffKind.MOVED || kind == DiffKind.COPIED)) {
            throw new IllegalArgumentException("source path is required exactly for moves and copies");
        }
    }

    public String describe() {
        return switch (kind) {
            case MOVED -> "rename from " + from.get() + " to " + path;
            case COPIED -> "copy from " + from.get() + " to " + path;
            default -> kind.name().toLowerCase(Locale.ROOT) + " " + path + (binary ? " (binary)" : "");
        };
    }
}
