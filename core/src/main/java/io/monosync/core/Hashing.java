// file: core/src/main/java/io/monosync/core/Hashing.java
package io.monosync.core;

import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;

/**
 * Digest helpers shared by the id types.
 * SHA-256 for native ids and content ids, SHA-1 for alternate hashes.
 */
public final class Hashing {

    private Hashing() {
        // utility
    }

    public static byte[] sha256(byte[]... chunks) {
        return digest("SHA-256", chunks);
    }

    public static byte[] sha1(byte[]... chunks) {
        return digest("SHA-1", chunks);
    }

    private static byte[] digest(String algorithm, byte[]... chunks) {
        try {
            MessageDigest md = MessageDigest.getInstance(algorithm);
            for (byte[] c : chunks) {
                md.update(c);
            }
            return md.digest();
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException(algorithm + " not available", e);
        }
    }
}
