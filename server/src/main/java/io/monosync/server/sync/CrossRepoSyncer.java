// file: server/src/main/java/io/monosync/server/sync/CrossRepoSyncer.java
package io.monosync.server.sync;

import io.monosync.core.BookmarkName;
import io.monosync.core.Changeset;
import io.monosync.core.ChangesetId;
import io.monosync.core.ContentId;
import io.monosync.core.FileChange;
import io.monosync.core.TooManyRetriesException;
import io.monosync.core.sync.CommitSyncConfig;
import io.monosync.core.sync.SyncDirection;
import io.monosync.server.repo.CommitGraph;
import io.monosync.server.repo.Repo;
import io.monosync.server.repo.SyncPair;
import io.monosync.storage.Bookmark;
import io.monosync.storage.SyncedCommitEntry;
import io.monosync.storage.SyncedCommitMapping;
import io.monosync.storage.WorkingCopyEquivalence;

import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.logging.Logger;

/**
 * Moves history across one sync pair.
 * <p>
 * Responsibilities:
 *  - forward sync: make a small commit and all its ancestors exist in the large repo,
 *  - backsync: make a large commit and its ancestors exist in the small repo, or
 *    record that they have no small counterpart,
 *  - mirror a large bookmark onto its small name.
 * <p>
 * Every step is keyed on the mapping store, so running any of these twice, or
 * after a crash half-way, converges on the same state.
 */
public final class CrossRepoSyncer {
    private static final Logger LOG = Logger.getLogger(CrossRepoSyncer.class.getName());

    private final SyncPair pair;
    private final SyncedCommitMapping mapping;
    private final CommitRewriter rewriter;
    private final int maxRetries;

    public CrossRepoSyncer(SyncPair pair, SyncedCommitMapping mapping, int maxRetries) {
        this.pair = Objects.requireNonNull(pair, "pair");
        this.mapping = Objects.requireNonNull(mapping, "mapping");
        this.rewriter = new CommitRewriter(mapping);
        this.maxRetries = maxRetries;
    }

    public SyncPair pair() {
        return pair;
    }

    public Optional<ChangesetId> largeCounterpart(ChangesetId smallId) {
        CommitSyncConfig c = pair.config();
        return mapping.findBySmall(c.smallRepo(), c.largeRepo(), smallId).map(SyncedCommitEntry::largeId);
    }

    /** Small counterpart of a large commit; empty both for unsynced and for "no counterpart". */
    public Optional<ChangesetId> smallCounterpart(ChangesetId largeId) {
        CommitSyncConfig c = pair.config();
        Optional<SyncedCommitEntry> e = mapping.findByLarge(c.smallRepo(), c.largeRepo(), largeId);
        if (e.isPresent()) return Optional.of(e.get().smallId());
        return mapping.getEquivalentWorkingCopy(c.smallRepo(), c.largeRepo(), largeId)
                .flatMap(WorkingCopyEquivalence::smallId);
    }

    public boolean isBacksynced(ChangesetId largeId) {
        CommitSyncConfig c = pair.config();
        return mapping.findByLarge(c.smallRepo(), c.largeRepo(), largeId).isPresent()
                || mapping.getEquivalentWorkingCopy(c.smallRepo(), c.largeRepo(), largeId).isPresent();
    }

    /** Syncs {@code smallId} and any unsynced ancestors into the large repo. */
    public ChangesetId syncToLarge(ChangesetId smallId) {
        Repo small = pair.small();
        Repo large = pair.large();
        CommitSyncConfig config = pair.config();
        small.load(smallId);

        List<ChangesetId> todo = CommitGraph.pendingAncestors(small.changesets(), smallId,
                id -> largeCounterpart(id).isPresent());
        for (ChangesetId id : todo) {
            Changeset target = rewriteToLarge(small.load(id), Map.of());
            large.changesets().put(target);
            mapping.insert(new SyncedCommitEntry(small.id(), id, large.id(), target.id(), config.version()));
            LOG.fine(() -> "synced " + small.name() + ":" + id.shortHex() + " -> " + large.name() + ":" + target.id().shortHex());
        }
        return largeCounterpart(smallId).orElseThrow();
    }

    /**
     * Large-repo form of a small commit, with its content copied over. Not stored.
     *
     * @param pending counterparts of commits rewritten earlier in the same batch
     */
    public Changeset rewriteToLarge(Changeset smallCommit, Map<ChangesetId, ChangesetId> pending) {
        RewriteResult result = rewriter.rewrite(smallCommit, SyncDirection.SMALL_TO_LARGE, pair.config(), pending);
        if (!(result instanceof RewriteResult.Rewritten rewritten)) {
            throw new IllegalStateException("small commit " + smallCommit.id() + " rewrote to nothing");
        }
        copyContents(pair.small(), pair.large(), rewritten.changeset());
        return rewritten.changeset();
    }

    /**
     * Syncs {@code largeId} and any unsynced ancestors into the small repo.
     *
     * @return small counterpart, or empty if the commit has none
     */
    public Optional<ChangesetId> syncToSmall(ChangesetId largeId) {
        Repo small = pair.small();
        Repo large = pair.large();
        CommitSyncConfig config = pair.config();
        large.load(largeId);

        List<ChangesetId> todo = CommitGraph.pendingAncestors(large.changesets(), largeId, this::isBacksynced);
        for (ChangesetId id : todo) {
            Changeset source = large.load(id);
            RewriteResult result = rewriter.rewrite(source, SyncDirection.LARGE_TO_SMALL, config);
            if (result instanceof RewriteResult.Skipped skipped) {
                mapping.insertEquivalentWorkingCopy(new WorkingCopyEquivalence(
                        large.id(), id, small.id(), skipped.equivalent(), config.version()));
                continue;
            }
            Changeset rewritten = ((RewriteResult.Rewritten) result).changeset();
            Changeset target = originOf(source, rewritten).orElse(rewritten);
            if (target == rewritten) {
                copyContents(large, small, target);
                small.changesets().put(target);
            }
            mapping.insert(new SyncedCommitEntry(small.id(), target.id(), large.id(), id, config.version()));
            LOG.fine(() -> "backsynced " + large.name() + ":" + id.shortHex() + " -> " + small.name() + ":" + target.id().shortHex());
        }
        return smallCounterpart(largeId);
    }

    /**
     * The small commit a large commit was forward-synced from, when the large
     * commit records it as its source and is still an exact rewrite of it.
     * Covers pushes whose mapping write was lost after the bookmark moved.
     */
    private Optional<Changeset> originOf(Changeset largeCommit, Changeset rewritten) {
        Optional<String> origin = largeCommit.extraString(Changeset.SYNC_SOURCE_EXTRA);
        if (origin.isEmpty() || !ChangesetId.isValid(origin.get())) {
            return Optional.empty();
        }
        ChangesetId originId = new ChangesetId(origin.get());
        Optional<Changeset> candidate = pair.small().changesets().get(originId);
        if (candidate.isEmpty()) {
            return Optional.empty();
        }
        Changeset s = candidate.get();
        if (!s.withoutExtra(Changeset.SYNC_SOURCE_EXTRA).equals(rewritten.withoutExtra(Changeset.SYNC_SOURCE_EXTRA))) {
            return Optional.empty();
        }
        Optional<ChangesetId> already = largeCounterpart(originId);
        if (already.isPresent() && !already.get().equals(largeCommit.id())) {
            return Optional.empty();
        }
        return candidate;
    }

    /**
     * Points the small name of {@code largeName} at the counterpart of the large
     * bookmark, or deletes it if the large bookmark is gone. Bookmarks with no
     * small name are left alone.
     */
    public Optional<BookmarkMirror> backsyncBookmark(BookmarkName largeName) {
        Optional<BookmarkName> maybeSmall = pair.bookmarks().smallNameFor(largeName);
        if (maybeSmall.isEmpty()) {
            return Optional.empty();
        }
        BookmarkName smallName = maybeSmall.get();
        Repo small = pair.small();
        for (int attempt = 0; attempt <= maxRetries; attempt++) {
            Optional<ChangesetId> desired = pair.large().bookmark(largeName).flatMap(this::syncToSmall);
            Optional<ChangesetId> current = small.bookmark(smallName);
            if (current.equals(desired)) {
                return Optional.of(new BookmarkMirror(small.name(), smallName, desired));
            }
            boolean swapped = desired.isPresent()
                    ? small.compareAndSwapBookmark(smallName, current, desired.get())
                    : small.deleteBookmark(smallName, current.get());
            if (swapped) {
                LOG.info(() -> "backsynced bookmark " + largeName + " -> " + small.name() + "/" + smallName + " = "
                        + desired.map(ChangesetId::shortHex).orElse("<deleted>"));
                return Optional.of(new BookmarkMirror(small.name(), smallName, desired));
            }
        }
        throw new TooManyRetriesException(smallName, maxRetries + 1);
    }

    /** Re-mirrors every large bookmark that has a small name. Used at startup. */
    public int backsyncAll() {
        int n = 0;
        for (Bookmark b : pair.large().listBookmarks("", Integer.MAX_VALUE)) {
            if (backsyncBookmark(b.name()).isPresent()) n++;
        }
        return n;
    }

    private static void copyContents(Repo from, Repo to, Changeset cs) {
        for (FileChange fc : cs.fileChanges().values()) {
            if (fc instanceof FileChange.Modified m) {
                ContentId content = m.content();
                if (!to.contents().exists(content)) {
                    from.contents().get(content).ifPresent(to.contents()::put);
                }
            }
        }
    }
}
