// file: server/src/main/java/io/monosync/server/identity/Identifier.java
package io.monosync.server.identity;

import io.monosync.core.AltHash;
import io.monosync.core.BookmarkName;
import io.monosync.core.ChangesetId;

import java.util.Objects;

/**
 * A way of naming a commit. Each variant belongs to exactly one
 * {@link IdentifierKind} and is globally unique within its scheme.
 */
public sealed interface Identifier
        permits Identifier.Native, Identifier.LegacyRevision, Identifier.Alt, Identifier.Bookmark {

    IdentifierKind kind();

    /** Text form, as accepted by {@link #parse(String)}. */
    String text();

    record Native(ChangesetId id) implements Identifier {
        public Native {
            Objects.requireNonNull(id, "id");
        }

        @Override public IdentifierKind kind() { return IdentifierKind.NATIVE; }

        @Override public String text() { return id.hex(); }
    }

    record LegacyRevision(long revision) implements Identifier {
        public LegacyRevision {
            if (revision <= 0) throw new IllegalArgumentException("legacy revisions start at 1");
        }

        @Override public IdentifierKind kind() { return IdentifierKind.LEGACY_REVISION; }

        @Override public String text() { return Long.toString(revision); }
    }

    record Alt(AltHash hash) implements Identifier {
        public Alt {
            Objects.requireNonNull(hash, "hash");
        }

        @Override public IdentifierKind kind() { return IdentifierKind.ALT_HASH; }

        @Override public String text() { return hash.hex(); }
    }

    record Bookmark(BookmarkName name) implements Identifier {
        public Bookmark {
            Objects.requireNonNull(name, "name");
        }

        @Override public IdentifierKind kind() { return IdentifierKind.BOOKMARK; }

        @Override public String text() { return name.name(); }
    }

    /**
     * Guess the scheme from the shape of {@code text}: 64 hex chars is a native
     * id, 40 hex chars an alternate hash, all digits a legacy revision, and
     * anything else a bookmark name.
     */
    static Identifier parse(String text) {
        Objects.requireNonNull(text, "identifier");
        if (ChangesetId.isValid(text)) return new Native(new ChangesetId(text));
        if (AltHash.isValid(text)) return new Alt(new AltHash(text));
        if (!text.isEmpty() && text.length() <= 18 && text.chars().allMatch(Character::isDigit)) {
            return new LegacyRevision(Long.parseLong(text));
        }
        return new Bookmark(BookmarkName.of(text));
    }

    /** Parse {@code text} as an identifier of the given kind. */
    static Identifier parse(String text, IdentifierKind kind) {
        Objects.requireNonNull(text, "identifier");
        try {
            return switch (kind) {
                case NATIVE -> new Native(new ChangesetId(text));
                case LEGACY_REVISION -> new LegacyRevision(Long.parseLong(text));
                case ALT_HASH -> new Alt(new AltHash(text));
                case BOOKMARK -> new Bookmark(BookmarkName.of(text));
            };
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("not a legacy revision: " + text, e);
        }
    }
}
