// file: server/src/test/java/io/monosync/server/sync/CrossRepoSyncerTest.java
package io.monosync.server.sync;

import io.monosync.core.BookmarkName;
import io.monosync.core.Changeset;
import io.monosync.core.ChangesetId;
import io.monosync.core.ContentId;
import io.monosync.core.MPath;
import io.monosync.core.RepositoryId;
import io.monosync.core.sync.CommitSyncConfig;
import io.monosync.core.sync.EmptyCommitPolicy;
import io.monosync.core.sync.SyncConfigVersion;
import io.monosync.server.TestRepos;
import io.monosync.server.TestRepos.Draft;
import io.monosync.server.repo.RepoConfig;
import io.monosync.storage.SyncedCommitEntry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

import static io.monosync.server.TestRepos.draft;
import static org.junit.jupiter.api.Assertions.*;

class CrossRepoSyncerTest {

    private static final BookmarkName MASTER = BookmarkName.of("master");

    private TestRepos t;
    private CrossRepoSyncer syncer;

    @BeforeEach
    void setUp() {
        t = TestRepos.defaults();
        syncer = t.redirector.syncerForSmall(t.small).orElseThrow();
    }

    @Test
    void forward_sync_backfills_ancestors_first() {
        Draft s0 = draft("s0").file("a", "0").build();
        Draft s1 = draft("s1").parent(s0).file("b", "1").build();
        Draft s2 = draft("s2").parent(s1).file("a", "2").build();
        TestRepos.seed(t.small, s0, s1, s2);

        ChangesetId l2 = syncer.syncToLarge(s2.id());

        ChangesetId l1 = syncer.largeCounterpart(s1.id()).orElseThrow();
        ChangesetId l0 = syncer.largeCounterpart(s0.id()).orElseThrow();
        Changeset large2 = t.large.load(l2);
        assertEquals(List.of(l1), large2.parents());
        assertEquals(List.of(l0), t.large.load(l1).parents());
        assertEquals(Set.of(MPath.of("small/a")), large2.fileChanges().keySet());
        assertTrue(t.large.contents().exists(ContentId.of(TestRepos.bytes("2"))));

        // second run finds everything mapped
        assertEquals(l2, syncer.syncToLarge(s2.id()));
    }

    @Test
    void backsync_of_forward_synced_commits_is_the_identity() {
        Draft s0 = draft("s0").file("a", "0").build();
        TestRepos.seed(t.small, s0);
        ChangesetId l0 = syncer.syncToLarge(s0.id());

        assertEquals(Optional.of(s0.id()), syncer.syncToSmall(l0));
    }

    @Test
    void large_only_commits_get_a_working_copy_equivalence() {
        Draft s0 = draft("s0").file("a", "0").build();
        TestRepos.seed(t.small, s0);
        ChangesetId l0 = syncer.syncToLarge(s0.id());

        Draft unrelated = draft("unrelated").parents(l0).file("infra/x", "1").build();
        TestRepos.seed(t.large, unrelated);

        assertEquals(Optional.of(s0.id()), syncer.syncToSmall(unrelated.id()));
        assertTrue(syncer.isBacksynced(unrelated.id()));
        CommitSyncConfig c = t.pair().config();
        assertTrue(t.registry.mapping().findByLarge(c.smallRepo(), c.largeRepo(), unrelated.id()).isEmpty());
    }

    @Test
    void large_commits_touching_the_prefix_become_new_small_commits() {
        Draft s0 = draft("s0").file("a", "0").build();
        TestRepos.seed(t.small, s0);
        ChangesetId l0 = syncer.syncToLarge(s0.id());

        Draft edit = draft("edit in large").parents(l0).file("small/a", "edited").file("infra/y", "2").build();
        TestRepos.seed(t.large, edit);

        ChangesetId smallId = syncer.syncToSmall(edit.id()).orElseThrow();
        Changeset back = t.small.load(smallId);
        assertEquals(List.of(s0.id()), back.parents());
        assertEquals(Set.of(MPath.of("a")), back.fileChanges().keySet());
        assertEquals(Optional.of(edit.id().hex()), back.extraString(Changeset.SYNC_SOURCE_EXTRA));
    }

    @Test
    void recovery_after_crash_between_swap_and_record() {
        // A push landed in large but the process died before any mapping or small bookmark was written.
        Draft s0 = draft("s0").file("a", "0").build();
        TestRepos.seed(t.small, s0);
        Changeset l0 = syncer.rewriteToLarge(s0.changeset(), Map.of());
        t.large.changesets().put(l0);
        assertTrue(t.large.compareAndSwapBookmark(MASTER, Optional.empty(), l0.id()));
        assertTrue(syncer.largeCounterpart(s0.id()).isEmpty());

        t.redirector.recover();

        assertEquals(Optional.of(s0.id()), t.small.bookmark(MASTER));
        assertEquals(Optional.of(l0.id()), syncer.largeCounterpart(s0.id()));

        // idempotent
        t.redirector.recover();
        assertEquals(Optional.of(s0.id()), t.small.bookmark(MASTER));
    }

    @Test
    void backsync_of_a_deleted_large_bookmark_deletes_the_small_one() {
        Draft s0 = draft("s0").file("a", "0").build();
        t.push(t.small, "feature", s0);
        assertTrue(t.small.bookmark(BookmarkName.of("feature")).isPresent());

        ChangesetId largeHead = t.large.bookmark(BookmarkName.of("small/feature")).orElseThrow();
        assertTrue(t.large.deleteBookmark(BookmarkName.of("small/feature"), largeHead));
        syncer.backsyncBookmark(BookmarkName.of("small/feature"));

        assertTrue(t.small.bookmark(BookmarkName.of("feature")).isEmpty());
    }

    @Test
    void large_local_bookmarks_are_not_mirrored() {
        assertTrue(syncer.backsyncBookmark(BookmarkName.of("infra-release")).isEmpty());
    }

    @Test
    void emit_policy_backsyncs_empty_commits() {
        RepositoryId large = new RepositoryId(0);
        RepositoryId small = new RepositoryId(1);
        SyncConfigVersion v = new SyncConfigVersion("v1");
        CommitSyncConfig emit = new CommitSyncConfig(v, small, large, MPath.of("small"), Map.of(), "small",
                Set.of(MASTER), EmptyCommitPolicy.EMIT);
        TestRepos e = new TestRepos(new RepoConfig(
                List.of(new RepoConfig.RepoSpec(large, "large", true), new RepoConfig.RepoSpec(small, "small", false)),
                3,
                List.of(new RepoConfig.SyncSpec(Map.of(v, emit), emit))));
        CrossRepoSyncer s = e.redirector.syncerForSmall(e.small).orElseThrow();

        Draft s0 = draft("s0").file("a", "0").build();
        TestRepos.seed(e.small, s0);
        ChangesetId l0 = s.syncToLarge(s0.id());
        Draft unrelated = draft("unrelated").parents(l0).file("infra/x", "1").build();
        TestRepos.seed(e.large, unrelated);

        ChangesetId emitted = s.syncToSmall(unrelated.id()).orElseThrow();
        assertNotEquals(s0.id(), emitted);
        assertTrue(e.small.load(emitted).fileChanges().isEmpty());
        assertEquals(Optional.of(new SyncedCommitEntry(small, emitted, large, unrelated.id(), v)),
                e.registry.mapping().findByLarge(small, large, unrelated.id()));
    }
}
