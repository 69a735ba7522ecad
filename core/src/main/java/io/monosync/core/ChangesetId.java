// file: core/src/main/java/io/monosync/core/ChangesetId.java
package io.monosync.core;

import java.util.HexFormat;
import java.util.Objects;

/**
 * Content address of a {@link Changeset}: SHA-256 over its canonical serialization.
 * <p>
 * Rendered as 64 lowercase hex characters. Two changesets with identical parents,
 * file changes, author, date, message and extras always have the same id.
 */
public record ChangesetId(String hex) implements Comparable<ChangesetId> {

    public static final int BYTES = 32;

    public ChangesetId {
        Objects.requireNonNull(hex, "hex");
        if (!isValid(hex)) {
            throw new IllegalArgumentException("not a changeset id: " + hex);
        }
    }

    /** True if {@code text} has the shape of a changeset id (64 lowercase hex chars). */
    public static boolean isValid(String text) {
        return text != null && text.length() == BYTES * 2 && Hex.isLowerHex(text);
    }

    public static ChangesetId fromBytes(byte[] digest) {
        if (digest.length != BYTES) {
            throw new IllegalArgumentException("changeset id needs " + BYTES + " bytes, got " + digest.length);
        }
        return new ChangesetId(HexFormat.of().formatHex(digest));
    }

    public byte[] toBytes() {
        return HexFormat.of().parseHex(hex);
    }

    /** First 12 hex chars, for log lines. */
    public String shortHex() {
        return hex.substring(0, 12);
    }

    @Override
    public int compareTo(ChangesetId o) {
        return hex.compareTo(o.hex);
    }

    @Override
    public String toString() {
        return hex;
    }
}
