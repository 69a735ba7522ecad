// file: server/src/main/java/io/monosync/server/check/ChangesetChecker.java
package io.monosync.server.check;

import io.monosync.core.AltHash;
import io.monosync.core.Changeset;
import io.monosync.core.ChangesetId;
import io.monosync.core.ChangesetVerifier;
import io.monosync.core.ContentId;
import io.monosync.core.FileChange;
import io.monosync.core.MPath;
import io.monosync.core.RepositoryId;
import io.monosync.server.repo.Repo;
import io.monosync.server.repo.RepoRegistry;
import io.monosync.server.repo.SyncPair;
import io.monosync.storage.Bookmark;
import io.monosync.storage.SyncedCommitEntry;
import io.monosync.storage.SyncedCommitMapping;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalLong;
import java.util.Set;
import java.util.logging.Logger;

/**
 * Offline consistency walk over everything reachable from a repository's bookmarks.
 * <p>
 * Per changeset it checks:
 *  - the stored changeset hashes to the id it is stored under,
 *  - every parent is stored,
 *  - structural validity,
 *  - every referenced content blob is stored with the right hash and size,
 *  - legacy revision and alt hash indices agree in both directions,
 *  - synced-commit mapping entries agree in both directions.
 * Problems are collected, not thrown; a broken changeset does not stop the walk.
 */
public final class ChangesetChecker {
    private static final Logger LOG = Logger.getLogger(ChangesetChecker.class.getName());

    private final RepoRegistry registry;

    public ChangesetChecker(RepoRegistry registry) {
        this.registry = Objects.requireNonNull(registry, "registry");
    }

    public CheckReport check(Repo repo) {
        List<CheckProblem> problems = new ArrayList<>();
        Set<ChangesetId> seen = new HashSet<>();
        Deque<ChangesetId> work = new ArrayDeque<>();

        for (Bookmark b : repo.listBookmarks("", Integer.MAX_VALUE)) {
            if (!repo.changesets().exists(b.target())) {
                problems.add(new CheckProblem(ProblemKind.DANGLING_BOOKMARK, b.target(), "bookmark " + b.name()));
            } else if (seen.add(b.target())) {
                work.push(b.target());
            }
        }

        while (!work.isEmpty()) {
            ChangesetId id = work.pop();
            Changeset cs = repo.load(id);
            if (!cs.id().equals(id)) {
                problems.add(new CheckProblem(ProblemKind.HASH_MISMATCH, id, "stored changeset hashes to " + cs.id()));
            }
            for (String p : ChangesetVerifier.problems(cs)) {
                problems.add(new CheckProblem(ProblemKind.INVALID_CHANGESET, id, p));
            }
            for (ChangesetId parent : cs.parents()) {
                if (!repo.changesets().exists(parent)) {
                    problems.add(new CheckProblem(ProblemKind.MISSING_PARENT, id, "parent " + parent));
                } else if (seen.add(parent)) {
                    work.push(parent);
                }
            }
            checkContents(repo, cs, id, problems);
            checkIdentifiers(repo, id, problems);
            checkMapping(repo, id, problems);
        }

        LOG.info("checked " + seen.size() + " changesets in " + repo.name() + ": " + problems.size() + " problem(s)");
        return new CheckReport(repo.name(), seen.size(), problems);
    }

    private static void checkContents(Repo repo, Changeset cs, ChangesetId id, List<CheckProblem> problems) {
        for (Map.Entry<MPath, FileChange> e : cs.fileChanges().entrySet()) {
            if (!(e.getValue() instanceof FileChange.Modified m)) continue;
            Optional<byte[]> bytes = repo.contents().get(m.content());
            if (bytes.isEmpty()) {
                problems.add(new CheckProblem(ProblemKind.MISSING_CONTENT, id, e.getKey() + ": " + m.content()));
                continue;
            }
            ContentId actual = ContentId.of(bytes.get());
            if (!actual.equals(m.content())) {
                problems.add(new CheckProblem(ProblemKind.CONTENT_HASH_MISMATCH, id,
                        e.getKey() + ": expected " + m.content() + ", stored blob hashes to " + actual));
            }
            if (bytes.get().length != m.size()) {
                problems.add(new CheckProblem(ProblemKind.CONTENT_SIZE_MISMATCH, id,
                        e.getKey() + ": recorded size " + m.size() + ", blob has " + bytes.get().length));
            }
        }
    }

    private static void checkIdentifiers(Repo repo, ChangesetId id, List<CheckProblem> problems) {
        RepositoryId r = repo.id();
        OptionalLong rev = repo.legacyRevisions().get(r, id);
        if (rev.isPresent()) {
            Optional<ChangesetId> back = repo.legacyRevisions().byRevision(r, rev.getAsLong());
            if (!back.equals(Optional.of(id))) {
                problems.add(new CheckProblem(ProblemKind.ASYMMETRIC_LEGACY_REVISION, id,
                        "revision " + rev.getAsLong() + " resolves to " + back.map(ChangesetId::toString).orElse("nothing")));
            }
        } else if (repo.assignsLegacyRevisions()) {
            problems.add(new CheckProblem(ProblemKind.MISSING_LEGACY_REVISION, id, "no legacy revision"));
        }

        Optional<AltHash> alt = repo.altHashes().get(r, id);
        if (alt.isPresent()) {
            Optional<ChangesetId> back = repo.altHashes().byHash(r, alt.get());
            if (!back.equals(Optional.of(id))) {
                problems.add(new CheckProblem(ProblemKind.ASYMMETRIC_ALT_HASH, id,
                        "alt hash " + alt.get() + " resolves to " + back.map(ChangesetId::toString).orElse("nothing")));
            }
        }
    }

    private void checkMapping(Repo repo, ChangesetId id, List<CheckProblem> problems) {
        SyncedCommitMapping mapping = registry.mapping();
        Optional<SyncPair> asSmall = registry.pairForSmall(repo);
        if (asSmall.isPresent()) {
            SyncPair p = asSmall.get();
            Optional<SyncedCommitEntry> e = mapping.findBySmall(p.small().id(), p.large().id(), id);
            if (e.isPresent()) {
                Optional<SyncedCommitEntry> back = mapping.getSmall(p.small().id(), p.large().id(), e.get().version(), e.get().largeId());
                if (back.isEmpty() || !back.get().smallId().equals(id)) {
                    problems.add(new CheckProblem(ProblemKind.ASYMMETRIC_MAPPING, id,
                            "maps to " + e.get().largeId() + " in " + p.large().name() + " but not back"));
                }
            }
        }
        for (SyncPair p : registry.pairsForLarge(repo)) {
            Optional<SyncedCommitEntry> e = mapping.findByLarge(p.small().id(), p.large().id(), id);
            if (e.isPresent()) {
                Optional<SyncedCommitEntry> back = mapping.getLarge(p.small().id(), p.large().id(), e.get().version(), e.get().smallId());
                if (back.isEmpty() || !back.get().largeId().equals(id)) {
                    problems.add(new CheckProblem(ProblemKind.ASYMMETRIC_MAPPING, id,
                            "maps to " + e.get().smallId() + " in " + p.small().name() + " but not back"));
                }
            }
        }
    }
}
