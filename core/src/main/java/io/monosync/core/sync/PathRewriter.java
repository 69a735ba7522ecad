// file: core/src/main/java/io/monosync/core/sync/PathRewriter.java
package io.monosync.core.sync;

import io.monosync.core.ChangesetId;
import io.monosync.core.FileChange;
import io.monosync.core.MPath;

import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.SortedMap;
import java.util.TreeMap;
import java.util.function.Function;

/**
 * Maps paths and file changes between the small and large namespaces for one
 * {@link CommitSyncConfig} version. Stateless and safe to share across threads.
 * <p>
 * Small to large:
 *  - the longest matching path override replaces its prefix,
 *  - otherwise the default prefix is prepended.
 * <p>
 * Large to small:
 *  - the path must sit strictly under an override target or the default prefix,
 *  - the candidate small path is accepted only if mapping it forward again gives
 *    back the original large path; everything else is invisible to the small repo.
 * <p>
 * Copy sources are rewritten the same way. A copy source that does not map is
 * dropped and the change degrades to a plain Modified.
 */
public final class PathRewriter {

    private final CommitSyncConfig config;

    public PathRewriter(CommitSyncConfig config) {
        this.config = Objects.requireNonNull(config, "config");
    }

    public CommitSyncConfig config() {
        return config;
    }

    public Optional<MPath> rewritePath(MPath path, SyncDirection direction) {
        return direction == SyncDirection.SMALL_TO_LARGE
                ? Optional.of(smallToLarge(path))
                : largeToSmall(path);
    }

    /**
     * Rewrite every change of a commit. Paths that do not map are left out.
     *
     * @param parentMapper maps a source parent id to its rewritten id; used for
     *                     copy sources. Returning empty drops the copy info.
     */
    public SortedMap<MPath, FileChange> rewriteChanges(
            Map<MPath, FileChange> changes,
            SyncDirection direction,
            Function<ChangesetId, Optional<ChangesetId>> parentMapper
    ) {
        SortedMap<MPath, FileChange> out = new TreeMap<>();
        for (Map.Entry<MPath, FileChange> e : changes.entrySet()) {
            Optional<MPath> target = rewritePath(e.getKey(), direction);
            if (target.isEmpty()) {
                continue;
            }
            out.put(target.get(), rewriteChange(e.getValue(), direction, parentMapper));
        }
        return out;
    }

    FileChange rewriteChange(
            FileChange change,
            SyncDirection direction,
            Function<ChangesetId, Optional<ChangesetId>> parentMapper
    ) {
        if (!(change instanceof FileChange.Modified m) || m.copyFrom() == null) {
            return change;
        }
        Optional<MPath> copyPath = rewritePath(m.copyFrom().path(), direction);
        Optional<ChangesetId> copyParent = parentMapper.apply(m.copyFrom().changeset());
        if (copyPath.isEmpty() || copyParent.isEmpty()) {
            return m.withCopyFrom(null);
        }
        return m.withCopyFrom(new FileChange.CopyFrom(copyPath.get(), copyParent.get()));
    }

    MPath smallToLarge(MPath small) {
        MPath bestSource = null;
        for (MPath source : config.pathOverrides().keySet()) {
            if (source.isPrefixOf(small) && (bestSource == null || source.depth() > bestSource.depth())) {
                bestSource = source;
            }
        }
        if (bestSource == null) {
            return config.defaultPrefix().join(small);
        }
        MPath target = config.pathOverrides().get(bestSource);
        return small.removePrefix(bestSource).map(target::join).orElse(target);
    }

    Optional<MPath> largeToSmall(MPath large) {
        for (Map.Entry<MPath, MPath> o : config.pathOverrides().entrySet()) {
            MPath target = o.getValue();
            if (target.equals(large)) {
                return verified(o.getKey(), large);
            }
            Optional<MPath> rest = large.removePrefix(target);
            if (rest.isPresent()) {
                return verified(o.getKey().join(rest.get()), large);
            }
        }
        return large.removePrefix(config.defaultPrefix()).flatMap(small -> verified(small, large));
    }

    private Optional<MPath> verified(MPath candidate, MPath large) {
        return smallToLarge(candidate).equals(large) ? Optional.of(candidate) : Optional.empty();
    }
}
