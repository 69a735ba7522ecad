// file: core/src/main/java/io/monosync/core/Hex.java
package io.monosync.core;

final class Hex {

    private Hex() {
        // utility
    }

    static boolean isLowerHex(String s) {
        for (int i = 0; i < s.length(); i++) {
            char c = s.charAt(i);
            boolean digit = c >= '0' && c <= '9';
            boolean lower = c >= 'a' && c <= 'f';
            if (!digit && !lower) return false;
        }
        return true;
    }
}
