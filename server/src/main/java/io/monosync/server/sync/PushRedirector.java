// file: server/src/main/java/io/monosync/server/sync/PushRedirector.java
package io.monosync.server.sync;

import io.monosync.core.BookmarkName;
import io.monosync.core.Changeset;
import io.monosync.core.ChangesetId;
import io.monosync.core.ChangesetVerifier;
import io.monosync.core.FileChange;
import io.monosync.core.InvalidChangesetException;
import io.monosync.core.MPath;
import io.monosync.core.NotFoundException;
import io.monosync.core.StaleBookmarkException;
import io.monosync.core.sync.BookmarkCorrespondence;
import io.monosync.server.derived.AltHashDeriver;
import io.monosync.server.identity.LegacyRevisionAssigner;
import io.monosync.server.pushrebase.PushrebaseEngine;
import io.monosync.server.pushrebase.PushrebaseOutcome;
import io.monosync.server.repo.Repo;
import io.monosync.server.repo.RepoRegistry;
import io.monosync.server.repo.SyncPair;

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.logging.Logger;

/**
 * Entry point for every write: pushes and bookmark moves.
 * <p>
 * Writes to a small repository are redirected: the large repository is the
 * source of truth, so the commits are synced forward, pushrebased in the large
 * repository, and the result is backsynced to the small one. Writes to a large
 * (or unpaired) repository land directly and are then mirrored to every small
 * repository embedded in it.
 * <p>
 * After each publish, legacy revisions and alt hashes are assigned for the new head.
 */
public final class PushRedirector {
    private static final Logger LOG = Logger.getLogger(PushRedirector.class.getName());

    private final RepoRegistry registry;
    private final PushrebaseEngine engine;
    private final LegacyRevisionAssigner legacyRevisions;
    private final AltHashDeriver altHashes;
    private final Map<SyncPair, CrossRepoSyncer> syncers = new LinkedHashMap<>();

    public PushRedirector(RepoRegistry registry, LegacyRevisionAssigner legacyRevisions, AltHashDeriver altHashes) {
        this.registry = Objects.requireNonNull(registry, "registry");
        this.engine = new PushrebaseEngine(registry.maxRetries());
        this.legacyRevisions = Objects.requireNonNull(legacyRevisions, "legacyRevisions");
        this.altHashes = Objects.requireNonNull(altHashes, "altHashes");
        for (SyncPair pair : registry.pairs()) {
            syncers.put(pair, new CrossRepoSyncer(pair, registry.mapping(), registry.maxRetries()));
        }
    }

    public Optional<CrossRepoSyncer> syncerForSmall(Repo repo) {
        return registry.pairForSmall(repo).map(syncers::get);
    }

    /**
     * Publishes {@code commits} (ancestors first) onto {@code bookmark} of {@code repo}.
     * Content for new files must be in {@code contents} or already stored in the repository.
     */
    public PublishResult push(Repo repo, BookmarkName bookmark, List<Changeset> commits, Collection<byte[]> contents) {
        if (commits.isEmpty()) {
            throw new IllegalArgumentException("push has no commits");
        }
        storeIncoming(repo, commits, contents);
        Optional<CrossRepoSyncer> syncer = syncerForSmall(repo);
        if (syncer.isPresent()) {
            return pushViaLarge(syncer.get(), bookmark, commits);
        }
        PushrebaseOutcome outcome = engine.pushrebase(repo, bookmark, commits);
        assignIdentifiers(repo, outcome.newHead());
        List<BookmarkMirror> mirrors = mirrorToSmall(repo, bookmark);
        return new PublishResult(repo.name(), bookmark, Optional.of(outcome.newHead()),
                ids(outcome), outcome.retries(), mirrors);
    }

    private PublishResult pushViaLarge(CrossRepoSyncer syncer, BookmarkName smallName, List<Changeset> commits) {
        SyncPair pair = syncer.pair();
        Repo small = pair.small();
        Repo large = pair.large();

        List<Changeset> fresh = new ArrayList<>();
        Set<ChangesetId> freshIds = new HashSet<>();
        for (Changeset cs : commits) {
            if (syncer.largeCounterpart(cs.id()).isEmpty()) {
                fresh.add(cs);
                freshIds.add(cs.id());
            }
        }
        for (Changeset cs : fresh) {
            for (ChangesetId p : cs.parents()) {
                if (!freshIds.contains(p)) syncer.syncToLarge(p);
            }
        }

        List<Changeset> rewritten = new ArrayList<>();
        Map<ChangesetId, ChangesetId> pending = new HashMap<>();
        for (Changeset cs : fresh) {
            Changeset target = syncer.rewriteToLarge(cs, pending);
            pending.put(cs.id(), target.id());
            rewritten.add(target);
        }
        if (rewritten.isEmpty()) {
            // every commit was already synced: push its large counterpart as-is
            ChangesetId tip = commits.get(commits.size() - 1).id();
            rewritten.add(large.load(syncer.largeCounterpart(tip).orElseThrow()));
        }

        BookmarkCorrespondence.Resolution names = pair.bookmarks().resolve(smallName);
        PushrebaseOutcome outcome = engine.pushrebase(large, names.largeName(), rewritten);
        LOG.info(() -> "redirected push " + small.name() + "/" + smallName + " -> " + large.name() + "/" + names.largeName()
                + " (" + outcome.rebased().size() + " new)");
        assignIdentifiers(large, outcome.newHead());

        Optional<BookmarkMirror> back = syncer.backsyncBookmark(names.largeName());
        Optional<ChangesetId> smallHead = back.flatMap(BookmarkMirror::target);
        smallHead.ifPresent(h -> assignIdentifiers(small, h));
        List<BookmarkMirror> mirrors = new ArrayList<>();
        mirrors.add(new BookmarkMirror(large.name(), names.largeName(), Optional.of(outcome.newHead())));
        mirrors.addAll(mirrorToSmall(large, names.largeName(), pair));
        return new PublishResult(small.name(), smallName, smallHead, ids(outcome), outcome.retries(), mirrors);
    }

    /**
     * Moves {@code name} to {@code target}. An empty {@code expected} means the
     * bookmark must not exist yet.
     */
    public PublishResult setBookmark(Repo repo, BookmarkName name, ChangesetId target, Optional<ChangesetId> expected) {
        repo.load(target);
        Optional<CrossRepoSyncer> syncer = syncerForSmall(repo);
        if (syncer.isEmpty()) {
            if (!repo.compareAndSwapBookmark(name, expected, target)) {
                throw new StaleBookmarkException(name, expected, repo.bookmark(name));
            }
            assignIdentifiers(repo, target);
            LOG.info(() -> "bookmark " + repo.name() + "/" + name + " -> " + target.shortHex());
            return new PublishResult(repo.name(), name, Optional.of(target), List.of(), 0, mirrorToSmall(repo, name));
        }

        CrossRepoSyncer s = syncer.get();
        Repo large = s.pair().large();
        BookmarkName largeName = s.pair().bookmarks().resolve(name).largeName();
        ChangesetId largeTarget = s.syncToLarge(target);
        Optional<ChangesetId> largeExpected = largeExpected(s, name, expected);
        if (!large.compareAndSwapBookmark(largeName, largeExpected, largeTarget)) {
            throw new StaleBookmarkException(name, expected, repo.bookmark(name));
        }
        assignIdentifiers(large, largeTarget);
        return afterRedirectedMove(s, name, largeName, largeTarget);
    }

    /** Deletes {@code name}; with no {@code expected}, whatever it currently points at. */
    public PublishResult deleteBookmark(Repo repo, BookmarkName name, Optional<ChangesetId> expected) {
        Optional<CrossRepoSyncer> syncer = syncerForSmall(repo);
        if (syncer.isEmpty()) {
            ChangesetId current = expected.or(() -> repo.bookmark(name))
                    .orElseThrow(() -> new NotFoundException("bookmark " + name));
            if (!repo.deleteBookmark(name, current)) {
                throw new StaleBookmarkException(name, expected, repo.bookmark(name));
            }
            LOG.info(() -> "bookmark " + repo.name() + "/" + name + " deleted");
            return new PublishResult(repo.name(), name, Optional.empty(), List.of(), 0, mirrorToSmall(repo, name));
        }

        CrossRepoSyncer s = syncer.get();
        Repo large = s.pair().large();
        BookmarkName largeName = s.pair().bookmarks().resolve(name).largeName();
        if (expected.isEmpty() && repo.bookmark(name).isEmpty()) {
            throw new NotFoundException("bookmark " + name);
        }
        Optional<ChangesetId> largeExpected = expected.isPresent()
                ? largeExpected(s, name, expected)
                : large.bookmark(largeName);
        if (largeExpected.isEmpty() || !large.deleteBookmark(largeName, largeExpected.get())) {
            throw new StaleBookmarkException(name, expected, repo.bookmark(name));
        }
        return afterRedirectedMove(s, name, largeName, null);
    }

    /** Re-mirrors every large bookmark into its small repositories, finishing any interrupted backsync. */
    public void recover() {
        for (CrossRepoSyncer s : syncers.values()) {
            int n = s.backsyncAll();
            LOG.info("recovery: " + n + " bookmark(s) mirrored for " + s.pair());
        }
    }

    private PublishResult afterRedirectedMove(CrossRepoSyncer s, BookmarkName smallName, BookmarkName largeName,
                                              ChangesetId largeTarget) {
        Repo small = s.pair().small();
        Repo large = s.pair().large();
        Optional<ChangesetId> smallHead = s.backsyncBookmark(largeName).flatMap(BookmarkMirror::target);
        smallHead.ifPresent(h -> assignIdentifiers(small, h));
        List<BookmarkMirror> mirrors = new ArrayList<>();
        mirrors.add(new BookmarkMirror(large.name(), largeName, Optional.ofNullable(largeTarget)));
        mirrors.addAll(mirrorToSmall(large, largeName, s.pair()));
        LOG.info(() -> "bookmark " + small.name() + "/" + smallName + " -> "
                + smallHead.map(ChangesetId::shortHex).orElse("<deleted>") + " via " + large.name() + "/" + largeName);
        return new PublishResult(small.name(), smallName, smallHead, List.of(), 0, mirrors);
    }

    /** Large-side value a small bookmark's expected value corresponds to. */
    private static Optional<ChangesetId> largeExpected(CrossRepoSyncer s, BookmarkName name, Optional<ChangesetId> expected) {
        if (expected.isEmpty()) {
            return Optional.empty();
        }
        Optional<ChangesetId> mapped = s.largeCounterpart(expected.get());
        if (mapped.isEmpty()) {
            throw new StaleBookmarkException(name, expected, s.pair().small().bookmark(name));
        }
        return mapped;
    }

    private List<BookmarkMirror> mirrorToSmall(Repo large, BookmarkName largeName) {
        return mirrorToSmall(large, largeName, null);
    }

    private List<BookmarkMirror> mirrorToSmall(Repo large, BookmarkName largeName, SyncPair skip) {
        List<BookmarkMirror> out = new ArrayList<>();
        for (SyncPair pair : registry.pairsForLarge(large)) {
            if (pair.equals(skip)) continue;
            Optional<BookmarkMirror> m = syncers.get(pair).backsyncBookmark(largeName);
            m.ifPresent(out::add);
            m.flatMap(BookmarkMirror::target).ifPresent(h -> assignIdentifiers(pair.small(), h));
        }
        return out;
    }

    private void assignIdentifiers(Repo repo, ChangesetId head) {
        legacyRevisions.assignUpTo(repo, head);
        altHashes.derive(repo, head);
    }

    /**
     * Stores uploaded content and commits in the repository they were pushed to.
     * Commits must come ancestors first and reference only stored content.
     */
    private static void storeIncoming(Repo repo, List<Changeset> commits, Collection<byte[]> contents) {
        for (byte[] blob : contents) {
            repo.contents().put(blob);
        }
        for (Changeset cs : commits) {
            ChangesetVerifier.verify(cs);
            List<String> missing = new ArrayList<>();
            for (Map.Entry<MPath, FileChange> e : cs.fileChanges().entrySet()) {
                if (e.getValue() instanceof FileChange.Modified m && !repo.contents().exists(m.content())) {
                    missing.add("content " + m.content() + " for " + e.getKey() + " is not stored");
                }
            }
            if (!missing.isEmpty()) {
                throw new InvalidChangesetException(cs.id(), missing);
            }
            for (ChangesetId p : cs.parents()) {
                if (!repo.changesets().exists(p)) {
                    throw new InvalidChangesetException(cs.id(), List.of("parent " + p + " is not stored"));
                }
            }
            repo.changesets().put(cs);
        }
    }

    private static List<ChangesetId> ids(PushrebaseOutcome outcome) {
        List<ChangesetId> out = new ArrayList<>(outcome.rebased().size());
        for (Changeset cs : outcome.rebased()) out.add(cs.id());
        return out;
    }
}
