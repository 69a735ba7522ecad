// file: server/src/main/java/io/monosync/server/identity/LegacyRevisionAssigner.java
package io.monosync.server.identity;

import io.monosync.core.ChangesetId;
import io.monosync.core.RepositoryId;
import io.monosync.server.repo.CommitGraph;
import io.monosync.server.repo.Repo;

import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.logging.Logger;

/**
 * Issues legacy revision numbers to published commits.
 * <p>
 * All unnumbered ancestors of a new head are numbered in topological order,
 * under a per-repository lock, so numbers grow along every line of history.
 * Numbering stops at the first numbered commit: its ancestors are already
 * numbered.
 */
public final class LegacyRevisionAssigner {
    private static final Logger LOG = Logger.getLogger(LegacyRevisionAssigner.class.getName());

    private final Map<RepositoryId, Object> locks = new ConcurrentHashMap<>();

    /** @return the commits that received a number, in issue order */
    public List<ChangesetId> assignUpTo(Repo repo, ChangesetId head) {
        if (!repo.assignsLegacyRevisions()) {
            return List.of();
        }
        synchronized (locks.computeIfAbsent(repo.id(), r -> new Object())) {
            List<ChangesetId> pending = CommitGraph.pendingAncestors(repo.changesets(), head,
                    id -> repo.legacyRevisions().get(repo.id(), id).isPresent());
            for (ChangesetId id : pending) {
                repo.legacyRevisions().assign(repo.id(), id);
            }
            if (!pending.isEmpty()) {
                LOG.fine(() -> "assigned " + pending.size() + " legacy revisions in " + repo.name()
                        + ", latest " + repo.legacyRevisions().latest(repo.id()));
            }
            return pending;
        }
    }
}
