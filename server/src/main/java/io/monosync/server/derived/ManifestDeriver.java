// file: server/src/main/java/io/monosync/server/derived/ManifestDeriver.java
package io.monosync.server.derived;

import io.monosync.core.Changeset;
import io.monosync.core.ChangesetId;
import io.monosync.core.RepositoryId;
import io.monosync.server.repo.CommitGraph;
import io.monosync.server.repo.Repo;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Derives and caches {@link Manifest}s. Manifests are a pure function of the
 * changeset graph, so a cached value never goes stale; concurrent callers may
 * derive the same tree twice and store equal values.
 */
public final class ManifestDeriver {

    private final Map<RepositoryId, Map<ChangesetId, Manifest>> cache = new ConcurrentHashMap<>();

    public Manifest manifest(Repo repo, ChangesetId id) {
        Map<ChangesetId, Manifest> derived = cache.computeIfAbsent(repo.id(), r -> new ConcurrentHashMap<>());
        Manifest cached = derived.get(id);
        if (cached != null) {
            return cached;
        }
        for (ChangesetId pending : CommitGraph.pendingAncestors(repo.changesets(), id, derived::containsKey)) {
            Changeset cs = repo.load(pending);
            List<Manifest> parents = new ArrayList<>(cs.parents().size());
            for (ChangesetId p : cs.parents()) {
                parents.add(derived.get(p));
            }
            derived.put(pending, Manifest.derive(parents, cs.fileChanges()));
        }
        return derived.get(id);
    }
}
