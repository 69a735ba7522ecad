// file: server/src/test/java/io/monosync/server/repo/CommitGraphTest.java
package io.monosync.server.repo;

import io.monosync.core.ChangesetId;
import io.monosync.server.TestRepos;
import io.monosync.server.TestRepos.Draft;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Optional;
import java.util.Set;

import static io.monosync.server.TestRepos.draft;
import static org.junit.jupiter.api.Assertions.*;

/**
 * History used below:
 *
 *   root - a - b ------ m
 *           \         /
 *            c ----- d
 */
class CommitGraphTest {

    private Repo repo;
    private Draft root, a, b, c, d, m;

    @BeforeEach
    void setUp() {
        repo = TestRepos.defaults().large;
        root = draft("root").file("r", "0").build();
        a = draft("a").parent(root).file("a", "1").build();
        b = draft("b").parent(a).file("b", "2").build();
        c = draft("c").parent(a).file("c", "3").build();
        d = draft("d").parent(c).file("d", "4").build();
        m = draft("m").parents(b.id(), d.id()).build();
        TestRepos.seed(repo, root, a, b, c, d, m);
    }

    @Test
    void ancestor_queries_follow_every_parent() {
        assertTrue(CommitGraph.isAncestor(repo.changesets(), root.id(), m.id()));
        assertTrue(CommitGraph.isAncestor(repo.changesets(), d.id(), m.id()));
        assertTrue(CommitGraph.isAncestor(repo.changesets(), b.id(), b.id()));
        assertFalse(CommitGraph.isAncestor(repo.changesets(), b.id(), d.id()));
        assertFalse(CommitGraph.isAncestor(repo.changesets(), m.id(), root.id()));
    }

    @Test
    void range_excludes_everything_reachable_from_base() {
        List<ChangesetId> range = CommitGraph.rangeExclusive(repo.changesets(), m.id(), Optional.of(b.id()));
        assertEquals(Set.of(c.id(), d.id(), m.id()), Set.copyOf(range));
        assertEquals(3, range.size());
        assertTrue(range.indexOf(c.id()) < range.indexOf(d.id()));
        assertEquals(m.id(), range.get(range.size() - 1));
    }

    @Test
    void range_without_base_is_full_history_parents_first() {
        List<ChangesetId> range = CommitGraph.rangeExclusive(repo.changesets(), d.id(), Optional.empty());
        assertEquals(List.of(root.id(), a.id(), c.id(), d.id()), range);
    }

    @Test
    void range_from_base_to_itself_is_empty() {
        assertTrue(CommitGraph.rangeExclusive(repo.changesets(), b.id(), Optional.of(b.id())).isEmpty());
        assertTrue(CommitGraph.rangeExclusive(repo.changesets(), a.id(), Optional.of(m.id())).isEmpty());
    }

    @Test
    void pending_ancestors_stop_at_done_commits() {
        Set<ChangesetId> done = Set.of(root.id(), a.id(), b.id());
        List<ChangesetId> pending = CommitGraph.pendingAncestors(repo.changesets(), m.id(), done::contains);
        assertEquals(List.of(c.id(), d.id(), m.id()), pending);

        assertTrue(CommitGraph.pendingAncestors(repo.changesets(), b.id(), done::contains).isEmpty());
    }
}
