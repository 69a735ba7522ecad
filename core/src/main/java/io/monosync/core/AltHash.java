// file: core/src/main/java/io/monosync/core/AltHash.java
package io.monosync.core;

import java.util.HexFormat;
import java.util.Objects;

/**
 * Alternate-system commit hash (SHA-1, 40 lowercase hex characters).
 * <p>
 * Derived from a changeset's full file tree and its parents' alternate hashes,
 * so it is independent of the native {@link ChangesetId}.
 */
public record AltHash(String hex) {

    public static final int BYTES = 20;

    /** Stand-in for a missing parent when hashing. */
    public static final AltHash NULL = new AltHash("0".repeat(BYTES * 2));

    public AltHash {
        Objects.requireNonNull(hex, "hex");
        if (!isValid(hex)) {
            throw new IllegalArgumentException("not an alternate hash: " + hex);
        }
    }

    public static boolean isValid(String text) {
        return text != null && text.length() == BYTES * 2 && Hex.isLowerHex(text);
    }

    public static AltHash fromBytes(byte[] digest) {
        return new AltHash(HexFormat.of().formatHex(digest));
    }

    public byte[] toBytes() {
        return HexFormat.of().parseHex(hex);
    }

    @Override
    public String toString() {
        return hex;
    }
}
