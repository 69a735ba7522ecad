// file: server/src/main/java/io/monosync/server/sync/CommitRewriter.java
package io.monosync.server.sync;

import io.monosync.core.Changeset;
import io.monosync.core.ChangesetId;
import io.monosync.core.FileChange;
import io.monosync.core.MPath;
import io.monosync.core.UnsyncedAncestorException;
import io.monosync.core.sync.CommitSyncConfig;
import io.monosync.core.sync.EmptyCommitPolicy;
import io.monosync.core.sync.PathRewriter;
import io.monosync.core.sync.SyncDirection;
import io.monosync.storage.SyncedCommitEntry;
import io.monosync.storage.SyncedCommitMapping;
import io.monosync.storage.WorkingCopyEquivalence;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.SortedMap;

/**
 * Produces the target-namespace equivalent of one commit whose parents are
 * already synced.
 * <p>
 * Parents are looked up, in order, in:
 *  1) {@code pending}: commits rewritten earlier in the same batch but not yet
 *     recorded,
 *  2) the mapping store, under the config version being applied,
 *  3) the mapping store, under any older version,
 *  4) for large-to-small only, working-copy equivalences of skipped commits.
 * A parent found nowhere fails the rewrite with {@link UnsyncedAncestorException}.
 * <p>
 * Output is deterministic: same source, same parent mapping, same config
 * gives a byte-identical commit, so re-running a rewrite is harmless.
 * Stateless apart from reads; does not store anything.
 */
public final class CommitRewriter {

    private final SyncedCommitMapping mapping;

    public CommitRewriter(SyncedCommitMapping mapping) {
        this.mapping = Objects.requireNonNull(mapping, "mapping");
    }

    public RewriteResult rewrite(Changeset source, SyncDirection direction, CommitSyncConfig config) {
        return rewrite(source, direction, config, Map.of());
    }

    public RewriteResult rewrite(
            Changeset source,
            SyncDirection direction,
            CommitSyncConfig config,
            Map<ChangesetId, ChangesetId> pending
    ) {
        // Source parent -> target parent; empty when the parent has no counterpart at all.
        Map<ChangesetId, Optional<ChangesetId>> parentMap = new HashMap<>();
        List<ChangesetId> newParents = new ArrayList<>();
        for (ChangesetId p : source.parents()) {
            Optional<ChangesetId> mapped = mapParent(source, p, direction, config, pending);
            parentMap.put(p, mapped);
            if (mapped.isPresent() && !newParents.contains(mapped.get())) {
                newParents.add(mapped.get());
            }
        }

        PathRewriter paths = new PathRewriter(config);
        SortedMap<MPath, FileChange> changes = paths.rewriteChanges(source.fileChanges(), direction,
                p -> parentMap.getOrDefault(p, Optional.empty()));

        boolean droppedEverything = changes.isEmpty() && !source.fileChanges().isEmpty();
        if (droppedEverything && !source.isMerge() && config.emptyCommits() == EmptyCommitPolicy.SKIP) {
            return new RewriteResult.Skipped(newParents.isEmpty() ? Optional.empty() : Optional.of(newParents.get(0)));
        }

        Changeset rewritten = new Changeset(newParents, changes, source.author(), source.date(),
                source.message(), source.extras())
                .withExtra(Changeset.SYNC_SOURCE_EXTRA, source.id().hex());
        return new RewriteResult.Rewritten(rewritten);
    }

    private Optional<ChangesetId> mapParent(
            Changeset source,
            ChangesetId parent,
            SyncDirection direction,
            CommitSyncConfig config,
            Map<ChangesetId, ChangesetId> pending
    ) {
        ChangesetId inBatch = pending.get(parent);
        if (inBatch != null) {
            return Optional.of(inBatch);
        }
        if (direction == SyncDirection.SMALL_TO_LARGE) {
            Optional<SyncedCommitEntry> e = mapping.getLarge(config.smallRepo(), config.largeRepo(), config.version(), parent)
                    .or(() -> mapping.findBySmall(config.smallRepo(), config.largeRepo(), parent));
            if (e.isPresent()) {
                return Optional.of(e.get().largeId());
            }
        } else {
            Optional<SyncedCommitEntry> e = mapping.getSmall(config.smallRepo(), config.largeRepo(), config.version(), parent)
                    .or(() -> mapping.findByLarge(config.smallRepo(), config.largeRepo(), parent));
            if (e.isPresent()) {
                return Optional.of(e.get().smallId());
            }
            Optional<WorkingCopyEquivalence> eq = mapping.getEquivalentWorkingCopy(config.smallRepo(), config.largeRepo(), parent);
            if (eq.isPresent()) {
                return eq.get().smallId();
            }
        }
        throw new UnsyncedAncestorException(source.id(), parent);
    }
}
