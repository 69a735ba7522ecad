// file: server/src/main/java/io/monosync/server/pushrebase/PushrebaseEngine.java
package io.monosync.server.pushrebase;

import io.monosync.core.BookmarkName;
import io.monosync.core.Changeset;
import io.monosync.core.ChangesetId;
import io.monosync.core.ChangesetVerifier;
import io.monosync.core.DivergedHistoryException;
import io.monosync.core.FileChange;
import io.monosync.core.InvalidChangesetException;
import io.monosync.core.MPath;
import io.monosync.core.RebaseConflictException;
import io.monosync.core.TooManyRetriesException;
import io.monosync.server.repo.CommitGraph;
import io.monosync.server.repo.Repo;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.NavigableSet;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.logging.Logger;

/**
 * Publishes a stack of commits onto a bookmark, rebasing them onto whatever the
 * bookmark points at when the publish happens.
 * <p>
 * Per attempt:
 *  1) read the bookmark head H,
 *  2) if the pushed tip is already reachable from H, stop: nothing is new,
 *     if H is an ancestor of the push's base, fast-forward to the stack as-is,
 *     if the base is not reachable from H either, fail with
 *     {@link DivergedHistoryException} (rebasing would drop the base's history),
 *  3) compare the paths the push touches with the paths touched by commits
 *     between the push's base and H; overlapping paths (equal, or one a
 *     directory of the other) abort the push with {@link RebaseConflictException},
 *  4) reparent the stack from its base onto H, recomputing every id,
 *  5) store the rebased commits and compare-and-swap the bookmark from H.
 * A lost swap starts over from (1) with a fresh head; after
 * {@code maxRetries} lost swaps the push fails with {@link TooManyRetriesException}.
 * <p>
 * A missing bookmark is created from the stack as-is. The bookmark CAS is the
 * only point of serialization; no lock is held across attempts.
 */
public final class PushrebaseEngine {
    private static final Logger LOG = Logger.getLogger(PushrebaseEngine.class.getName());

    public static final int DEFAULT_MAX_RETRIES = 10;

    private final int maxRetries;

    public PushrebaseEngine(int maxRetries) {
        if (maxRetries < 0) throw new IllegalArgumentException("maxRetries must be >= 0");
        this.maxRetries = maxRetries;
    }

    public PushrebaseEngine() {
        this(DEFAULT_MAX_RETRIES);
    }

    /**
     * @param commits the stack, ancestors first; its base is the first commit's
     *                first parent (none for a root commit)
     */
    public PushrebaseOutcome pushrebase(Repo repo, BookmarkName bookmark, List<Changeset> commits) {
        if (commits.isEmpty()) {
            throw new IllegalArgumentException("nothing to push");
        }
        Set<ChangesetId> batch = validateStack(repo, commits);
        Changeset first = commits.get(0);
        Optional<ChangesetId> base = first.parents().isEmpty() ? Optional.empty() : Optional.of(first.parents().get(0));
        ChangesetId tip = commits.get(commits.size() - 1).id();

        Set<MPath> touched = new HashSet<>();
        for (Changeset cs : commits) {
            touched.addAll(cs.fileChanges().keySet());
        }

        for (int attempt = 0; attempt <= maxRetries; attempt++) {
            Optional<ChangesetId> head = repo.bookmark(bookmark);

            if (head.isPresent() && repo.changesets().exists(tip)
                    && CommitGraph.isAncestor(repo.changesets(), tip, head.get())) {
                LOG.fine(() -> "push to " + bookmark + " already contained in " + head.get().shortHex());
                return new PushrebaseOutcome(bookmark, head, head.get(), List.of(), Map.of(), attempt);
            }

            List<Changeset> rebased;
            Map<ChangesetId, ChangesetId> oldToNew;
            if (head.isEmpty() || head.equals(base)
                    || (base.isPresent() && CommitGraph.isAncestor(repo.changesets(), head.get(), base.get()))) {
                rebased = commits;
                oldToNew = identity(commits);
            } else {
                if (base.isPresent() && !CommitGraph.isAncestor(repo.changesets(), base.get(), head.get())) {
                    LOG.info("push to " + bookmark + " in " + repo.name() + " is based on " + base.get().shortHex()
                            + ", which is not on " + head.get().shortHex());
                    throw new DivergedHistoryException(bookmark, base.get(), head.get());
                }
                List<MPath> conflicts = conflicts(repo, head.get(), base, touched);
                if (!conflicts.isEmpty()) {
                    LOG.info("pushrebase onto " + bookmark + " in " + repo.name() + " conflicts on " + conflicts);
                    throw new RebaseConflictException(bookmark, conflicts);
                }
                oldToNew = new LinkedHashMap<>();
                rebased = reparent(commits, batch, base, head.get(), oldToNew);
            }

            for (Changeset cs : rebased) {
                ChangesetVerifier.verify(cs);
                repo.changesets().put(cs);
            }
            ChangesetId newHead = rebased.get(rebased.size() - 1).id();
            if (repo.compareAndSwapBookmark(bookmark, head, newHead)) {
                final int retries = attempt;
                LOG.info(() -> "published " + rebased.size() + " commit(s) to " + repo.name() + "/" + bookmark
                        + ": " + head.map(ChangesetId::shortHex).orElse("<new>") + " -> " + newHead.shortHex()
                        + (retries > 0 ? " after " + retries + " retries" : ""));
                return new PushrebaseOutcome(bookmark, head, newHead, rebased, oldToNew, attempt);
            }
            LOG.fine(() -> "bookmark " + bookmark + " moved during pushrebase, retrying");
        }
        throw new TooManyRetriesException(bookmark, maxRetries + 1);
    }

    /** Checks ordering and that every outside parent exists; returns the stack's ids. */
    private static Set<ChangesetId> validateStack(Repo repo, List<Changeset> commits) {
        Set<ChangesetId> seen = new HashSet<>();
        for (Changeset cs : commits) {
            ChangesetVerifier.verify(cs);
            for (ChangesetId p : cs.parents()) {
                if (!seen.contains(p) && !repo.changesets().exists(p)) {
                    throw new InvalidChangesetException(cs.id(), List.of("parent " + p + " is neither pushed before it nor stored"));
                }
            }
            seen.add(cs.id());
        }
        return seen;
    }

    private static Map<ChangesetId, ChangesetId> identity(List<Changeset> commits) {
        Map<ChangesetId, ChangesetId> m = new LinkedHashMap<>();
        for (Changeset cs : commits) {
            m.put(cs.id(), cs.id());
        }
        return m;
    }

    /** Pushed paths that overlap paths changed between base and head, sorted. */
    static List<MPath> conflicts(Repo repo, ChangesetId head, Optional<ChangesetId> base, Set<MPath> touched) {
        NavigableSet<MPath> landed = new TreeSet<>();
        for (ChangesetId id : CommitGraph.rangeExclusive(repo.changesets(), head, base)) {
            landed.addAll(repo.load(id).fileChanges().keySet());
        }
        TreeSet<MPath> out = new TreeSet<>();
        for (MPath p : touched) {
            if (landed.contains(p)) {
                out.add(p);
                continue;
            }
            MPath under = landed.higher(p);
            if (under != null && p.isStrictPrefixOf(under)) {
                out.add(p);
                continue;
            }
            for (int depth = 1; depth < p.depth(); depth++) {
                if (landed.contains(MPath.fromElements(p.elements().subList(0, depth)))) {
                    out.add(p);
                    break;
                }
            }
        }
        return new ArrayList<>(out);
    }

    /**
     * Moves the stack from {@code base} onto {@code head}. Parents and copy
     * sources pointing at the base, or at stack commits, are rewritten; other
     * outside parents are kept. Root commits get {@code head} as their parent.
     */
    static List<Changeset> reparent(
            List<Changeset> commits,
            Set<ChangesetId> batch,
            Optional<ChangesetId> base,
            ChangesetId head,
            Map<ChangesetId, ChangesetId> oldToNew
    ) {
        Map<ChangesetId, ChangesetId> remap = new HashMap<>();
        base.ifPresent(b -> remap.put(b, head));
        List<Changeset> out = new ArrayList<>(commits.size());
        for (Changeset cs : commits) {
            List<ChangesetId> parents = new ArrayList<>();
            if (cs.parents().isEmpty()) {
                parents.add(head);
            }
            for (ChangesetId p : cs.parents()) {
                ChangesetId np = remap.getOrDefault(p, p);
                if (!parents.contains(np)) parents.add(np);
            }
            TreeMap<MPath, FileChange> changes = new TreeMap<>();
            for (Map.Entry<MPath, FileChange> e : cs.fileChanges().entrySet()) {
                FileChange fc = e.getValue();
                if (fc instanceof FileChange.Modified m && m.copyFrom() != null && remap.containsKey(m.copyFrom().changeset())) {
                    fc = m.withCopyFrom(new FileChange.CopyFrom(m.copyFrom().path(), remap.get(m.copyFrom().changeset())));
                }
                changes.put(e.getKey(), fc);
            }
            Changeset moved = cs.withParents(parents).withFileChanges(changes);
            remap.put(cs.id(), moved.id());
            oldToNew.put(cs.id(), moved.id());
            out.add(moved);
        }
        return out;
    }
}
