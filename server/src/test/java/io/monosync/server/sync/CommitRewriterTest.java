// file: server/src/test/java/io/monosync/server/sync/CommitRewriterTest.java
package io.monosync.server.sync;

import io.monosync.core.BookmarkName;
import io.monosync.core.Changeset;
import io.monosync.core.ChangesetId;
import io.monosync.core.FileChange;
import io.monosync.core.MPath;
import io.monosync.core.RepositoryId;
import io.monosync.core.UnsyncedAncestorException;
import io.monosync.core.sync.CommitSyncConfig;
import io.monosync.core.sync.EmptyCommitPolicy;
import io.monosync.core.sync.SyncConfigVersion;
import io.monosync.core.sync.SyncDirection;
import io.monosync.server.TestRepos.Draft;
import io.monosync.storage.DurableSyncedCommitMapping;
import io.monosync.storage.MemoryWal;
import io.monosync.storage.SyncedCommitEntry;
import io.monosync.storage.SyncedCommitMapping;
import io.monosync.storage.WorkingCopyEquivalence;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

import static io.monosync.server.TestRepos.draft;
import static org.junit.jupiter.api.Assertions.*;

class CommitRewriterTest {

    private static final RepositoryId SMALL = new RepositoryId(1);
    private static final RepositoryId LARGE = new RepositoryId(0);
    private static final SyncConfigVersion V1 = new SyncConfigVersion("v1");

    private SyncedCommitMapping mapping;
    private CommitRewriter rewriter;
    private CommitSyncConfig skip;
    private CommitSyncConfig emit;

    @BeforeEach
    void setUp() {
        mapping = new DurableSyncedCommitMapping(new MemoryWal());
        rewriter = new CommitRewriter(mapping);
        skip = CommitSyncConfig.simple(V1, SMALL, LARGE, "small", Set.of(BookmarkName.of("master")));
        emit = new CommitSyncConfig(V1, SMALL, LARGE, MPath.of("small"), Map.of(), "small",
                Set.of(BookmarkName.of("master")), EmptyCommitPolicy.EMIT);
    }

    @Test
    void small_to_large_prefixes_paths_and_records_source() {
        Draft root = draft("root").file("README", "hi").build();
        Changeset out = rewritten(rewriter.rewrite(root.changeset(), SyncDirection.SMALL_TO_LARGE, skip));

        assertEquals(Set.of(MPath.of("small/README")), out.fileChanges().keySet());
        assertEquals("root", out.message());
        assertEquals(root.changeset().author(), out.author());
        assertEquals(root.changeset().date(), out.date());
        assertEquals(Optional.of(root.id().hex()), out.extraString(Changeset.SYNC_SOURCE_EXTRA));
        assertTrue(out.parents().isEmpty());
    }

    @Test
    void parents_are_mapped_in_order_and_copy_sources_follow() {
        Draft p1 = draft("p1").file("a", "1").build();
        Draft p2 = draft("p2").file("b", "2").build();
        ChangesetId l1 = new ChangesetId("1".repeat(64));
        ChangesetId l2 = new ChangesetId("2".repeat(64));
        mapping.insert(new SyncedCommitEntry(SMALL, p1.id(), LARGE, l1, V1));
        mapping.insert(new SyncedCommitEntry(SMALL, p2.id(), LARGE, l2, V1));

        Draft merge = draft("merge").parents(p2.id(), p1.id())
                .copy("c", "1", "a", p1.id())
                .build();
        Changeset out = rewritten(rewriter.rewrite(merge.changeset(), SyncDirection.SMALL_TO_LARGE, skip));

        assertEquals(List.of(l2, l1), out.parents());
        FileChange.Modified c = (FileChange.Modified) out.fileChanges().get(MPath.of("small/c"));
        assertEquals(MPath.of("small/a"), c.copyFrom().path());
        assertEquals(l1, c.copyFrom().changeset());
    }

    @Test
    void rewriting_is_deterministic() {
        Draft root = draft("root").file("x", "1").build();
        Changeset first = rewritten(rewriter.rewrite(root.changeset(), SyncDirection.SMALL_TO_LARGE, skip));
        Changeset second = rewritten(rewriter.rewrite(root.changeset(), SyncDirection.SMALL_TO_LARGE, skip));
        assertEquals(first.id(), second.id());
    }

    @Test
    void unmapped_parent_fails_with_unsynced_ancestor() {
        Draft parent = draft("parent").file("x", "1").build();
        Draft child = draft("child").parent(parent).file("y", "2").build();

        UnsyncedAncestorException e = assertThrows(UnsyncedAncestorException.class,
                () -> rewriter.rewrite(child.changeset(), SyncDirection.SMALL_TO_LARGE, skip));
        assertEquals(child.id(), e.source());
        assertEquals(parent.id(), e.missingParent());
    }

    @Test
    void pending_batch_entries_take_precedence() {
        Draft parent = draft("parent").file("x", "1").build();
        Draft child = draft("child").parent(parent).file("y", "2").build();
        ChangesetId pendingTarget = new ChangesetId("9".repeat(64));

        Changeset out = rewritten(rewriter.rewrite(child.changeset(), SyncDirection.SMALL_TO_LARGE, skip,
                Map.of(parent.id(), pendingTarget)));
        assertEquals(List.of(pendingTarget), out.parents());
    }

    @Test
    void large_commit_outside_prefix_is_skipped_with_its_parent_as_equivalent() {
        Draft base = draft("base").file("small/a", "1").build();
        ChangesetId smallBase = new ChangesetId("5".repeat(64));
        mapping.insert(new SyncedCommitEntry(SMALL, smallBase, LARGE, base.id(), V1));

        Draft unrelated = draft("unrelated").parent(base).file("other/x", "2").build();
        RewriteResult r = rewriter.rewrite(unrelated.changeset(), SyncDirection.LARGE_TO_SMALL, skip);

        RewriteResult.Skipped s = assertInstanceOf(RewriteResult.Skipped.class, r);
        assertEquals(Optional.of(smallBase), s.equivalent());
    }

    @Test
    void emit_policy_keeps_the_empty_commit() {
        Draft base = draft("base").file("small/a", "1").build();
        ChangesetId smallBase = new ChangesetId("5".repeat(64));
        mapping.insert(new SyncedCommitEntry(SMALL, smallBase, LARGE, base.id(), V1));

        Draft unrelated = draft("unrelated").parent(base).file("other/x", "2").build();
        Changeset out = rewritten(rewriter.rewrite(unrelated.changeset(), SyncDirection.LARGE_TO_SMALL, emit));

        assertTrue(out.fileChanges().isEmpty());
        assertEquals(List.of(smallBase), out.parents());
    }

    @Test
    void descendants_of_skipped_commits_resolve_through_the_equivalence() {
        ChangesetId skipped = new ChangesetId("7".repeat(64));
        ChangesetId smallEquivalent = new ChangesetId("8".repeat(64));
        mapping.insertEquivalentWorkingCopy(new WorkingCopyEquivalence(LARGE, skipped, SMALL,
                Optional.of(smallEquivalent), V1));

        Changeset child = draft("child").parents(skipped).file("small/z", "3").build().changeset();
        Changeset out = rewritten(rewriter.rewrite(child, SyncDirection.LARGE_TO_SMALL, skip));

        assertEquals(List.of(smallEquivalent), out.parents());
        assertEquals(Set.of(MPath.of("z")), out.fileChanges().keySet());
    }

    @Test
    void merges_are_never_skipped() {
        ChangesetId l1 = new ChangesetId("1".repeat(64));
        ChangesetId l2 = new ChangesetId("2".repeat(64));
        ChangesetId s1 = new ChangesetId("3".repeat(64));
        ChangesetId s2 = new ChangesetId("4".repeat(64));
        mapping.insert(new SyncedCommitEntry(SMALL, s1, LARGE, l1, V1));
        mapping.insert(new SyncedCommitEntry(SMALL, s2, LARGE, l2, V1));

        Changeset merge = draft("merge").parents(l1, l2).file("elsewhere", "x").build().changeset();
        Changeset out = rewritten(rewriter.rewrite(merge, SyncDirection.LARGE_TO_SMALL, skip));
        assertEquals(List.of(s1, s2), out.parents());
    }

    private static Changeset rewritten(RewriteResult r) {
        return assertInstanceOf(RewriteResult.Rewritten.class, r).changeset();
    }
}
