// file: core/src/main/java/io/monosync/core/ContentId.java
package io.monosync.core;

import java.util.HexFormat;
import java.util.Objects;

/** SHA-256 address of a file's content blob, 64 lowercase hex characters. */
public record ContentId(String hex) {

    public static final int BYTES = 32;

    public ContentId {
        Objects.requireNonNull(hex, "hex");
        if (hex.length() != BYTES * 2 || !Hex.isLowerHex(hex)) {
            throw new IllegalArgumentException("not a content id: " + hex);
        }
    }

    /** Content id of the given bytes. */
    public static ContentId of(byte[] content) {
        return fromBytes(Hashing.sha256(content));
    }

    public static ContentId fromBytes(byte[] digest) {
        return new ContentId(HexFormat.of().formatHex(digest));
    }

    public byte[] toBytes() {
        return HexFormat.of().parseHex(hex);
    }

    @Override
    public String toString() {
        return hex;
    }
}
