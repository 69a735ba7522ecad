// file: server/src/main/java/io/monosync/server/identity/IdentifierKind.java
package io.monosync.server.identity;

import java.util.Locale;

/** The identifier schemes a commit can be named by. */
public enum IdentifierKind {
    NATIVE("native"),
    LEGACY_REVISION("legacy"),
    ALT_HASH("alt"),
    BOOKMARK("bookmark");

    private final String wireName;

    IdentifierKind(String wireName) {
        this.wireName = wireName;
    }

    /** Name used in query parameters and JSON, e.g. "legacy". */
    public String wireName() {
        return wireName;
    }

    public static IdentifierKind fromWireName(String name) {
        String n = name.trim().toLowerCase(Locale.ROOT);
        for (IdentifierKind k : values()) {
            if (k.wireName.equals(n)) return k;
        }
        throw new IllegalArgumentException("unknown identifier kind: " + name
                + " (expected native, legacy, alt or bookmark)");
    }
}
