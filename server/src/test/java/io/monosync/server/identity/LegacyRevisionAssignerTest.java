// file: server/src/test/java/io/monosync/server/identity/LegacyRevisionAssignerTest.java
package io.monosync.server.identity;

import io.monosync.core.ChangesetId;
import io.monosync.server.TestRepos;
import io.monosync.server.TestRepos.Draft;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.OptionalLong;

import static io.monosync.server.TestRepos.draft;
import static org.junit.jupiter.api.Assertions.*;

class LegacyRevisionAssignerTest {

    @Test
    void numbers_follow_topological_order() {
        TestRepos t = TestRepos.defaults();
        Draft root = draft("root").file("x", "0").build();
        Draft left = draft("left").parent(root).file("l", "1").build();
        Draft right = draft("right").parent(root).file("r", "1").build();
        Draft merge = draft("merge").parents(left.id(), right.id()).file("m", "2").build();
        TestRepos.seed(t.large, root, left, right, merge);

        List<ChangesetId> issued = t.legacyRevisions.assignUpTo(t.large, merge.id());

        assertEquals(4, issued.size());
        assertEquals(root.id(), issued.get(0));
        assertEquals(merge.id(), issued.get(3));
        long l = t.large.legacyRevisions().get(t.large.id(), left.id()).getAsLong();
        long r = t.large.legacyRevisions().get(t.large.id(), right.id()).getAsLong();
        assertTrue(l > 1 && r > 1 && l < 4 && r < 4);
        assertEquals(OptionalLong.of(4), t.large.legacyRevisions().get(t.large.id(), merge.id()));
    }

    @Test
    void numbering_stops_at_numbered_ancestors() {
        TestRepos t = TestRepos.defaults();
        Draft a = draft("a").file("x", "0").build();
        Draft b = draft("b").parent(a).file("x", "1").build();
        TestRepos.seed(t.large, a, b);

        assertEquals(List.of(a.id()), t.legacyRevisions.assignUpTo(t.large, a.id()));
        assertEquals(List.of(b.id()), t.legacyRevisions.assignUpTo(t.large, b.id()));
        assertEquals(List.of(), t.legacyRevisions.assignUpTo(t.large, b.id()));
        assertEquals(2, t.large.legacyRevisions().latest(t.large.id()));
    }

    @Test
    void repos_without_legacy_numbering_are_skipped() {
        TestRepos t = TestRepos.defaults();
        Draft a = draft("a").file("x", "0").build();
        TestRepos.seed(t.small, a);

        assertTrue(t.legacyRevisions.assignUpTo(t.small, a.id()).isEmpty());
        assertTrue(t.small.legacyRevisions().get(t.small.id(), a.id()).isEmpty());
    }
}
