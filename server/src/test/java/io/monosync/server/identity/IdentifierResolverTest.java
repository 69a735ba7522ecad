// file: server/src/test/java/io/monosync/server/identity/IdentifierResolverTest.java
package io.monosync.server.identity;

import io.monosync.core.AltHash;
import io.monosync.core.BookmarkName;
import io.monosync.core.NotFoundException;
import io.monosync.server.TestRepos;
import io.monosync.server.TestRepos.Draft;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.EnumSet;
import java.util.Map;
import java.util.Set;

import static io.monosync.server.TestRepos.draft;
import static org.junit.jupiter.api.Assertions.*;

class IdentifierResolverTest {

    private TestRepos t;
    private IdentifierResolver resolver;
    private Draft c0;
    private Draft c1;

    @BeforeEach
    void setUp() {
        t = TestRepos.defaults();
        resolver = new IdentifierResolver(Schemes.all(t.altHashes));
        c0 = draft("c0").file("infra/a", "0").build();
        c1 = draft("c1").parent(c0).file("infra/a", "1").build();
        t.push(t.large, "master", c0, c1);
    }

    @Test
    void parse_guesses_scheme_from_shape() {
        assertInstanceOf(Identifier.Native.class, Identifier.parse(c0.id().hex()));
        assertInstanceOf(Identifier.Alt.class, Identifier.parse("ab".repeat(20)));
        assertInstanceOf(Identifier.LegacyRevision.class, Identifier.parse("42"));
        assertInstanceOf(Identifier.Bookmark.class, Identifier.parse("master"));
    }

    @Test
    void every_scheme_resolves_to_the_same_commit() {
        AltHash alt = t.altHashes.derive(t.large, c1.id());

        assertEquals(c1.id(), resolver.resolve(t.large, c1.id().hex()));
        assertEquals(c1.id(), resolver.resolve(t.large, "2"));
        assertEquals(c1.id(), resolver.resolve(t.large, alt.hex()));
        assertEquals(c1.id(), resolver.resolve(t.large, "master"));
        assertEquals(c0.id(), resolver.resolve(t.large, "1"));
    }

    @Test
    void lookup_names_the_commit_in_requested_schemes() {
        Map<IdentifierKind, Identifier> names = resolver.lookup(t.large,
                new Identifier.LegacyRevision(1), EnumSet.of(IdentifierKind.NATIVE, IdentifierKind.ALT_HASH));

        assertEquals(new Identifier.Native(c0.id()), names.get(IdentifierKind.NATIVE));
        Identifier.Alt alt = (Identifier.Alt) names.get(IdentifierKind.ALT_HASH);
        assertEquals(c0.id(), resolver.resolve(t.large, alt));
        assertFalse(names.containsKey(IdentifierKind.LEGACY_REVISION));
    }

    @Test
    void schemes_without_a_name_are_left_out() {
        // small repo does not issue legacy revisions, and no commit has a canonical bookmark
        Draft s0 = draft("s0").file("a", "0").build();
        t.push(t.small, "master", s0);

        Map<IdentifierKind, Identifier> names = resolver.lookup(t.small, new Identifier.Native(s0.id()),
                EnumSet.allOf(IdentifierKind.class));

        assertEquals(Set.of(IdentifierKind.NATIVE, IdentifierKind.ALT_HASH), names.keySet());
    }

    @Test
    void unknown_identifiers_are_not_found() {
        assertThrows(NotFoundException.class, () -> resolver.resolve(t.large, "99"));
        assertThrows(NotFoundException.class, () -> resolver.resolve(t.large, "f".repeat(64)));
        assertThrows(NotFoundException.class,
                () -> resolver.resolve(t.large, new Identifier.Bookmark(BookmarkName.of("gone"))));
    }

    @Test
    void parse_with_kind_rejects_malformed_text() {
        assertThrows(IllegalArgumentException.class, () -> Identifier.parse("abc", IdentifierKind.LEGACY_REVISION));
        assertThrows(IllegalArgumentException.class, () -> Identifier.parse("abc", IdentifierKind.NATIVE));
        assertThrows(IllegalArgumentException.class, () -> IdentifierKind.fromWireName("svn"));
        assertEquals(IdentifierKind.LEGACY_REVISION, IdentifierKind.fromWireName("Legacy"));
    }
}
