// file: server/src/main/java/io/monosync/server/diff/ChangesetDiffer.java
package io.monosync.server.diff;

import io.monosync.core.ChangesetId;
import io.monosync.core.ContentId;
import io.monosync.core.FileChange;
import io.monosync.core.MPath;
import io.monosync.server.derived.Manifest;
import io.monosync.server.derived.ManifestDeriver;
import io.monosync.server.repo.CommitGraph;
import io.monosync.server.repo.Repo;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;

/**
 * Path-level diff between two commits of one repository.
 * <p>
 * Trees come from {@link ManifestDeriver}. Copy provenance comes from the
 * commits reachable from {@code other} but not from {@code base}: a path added
 * on the other side whose recorded copy source exists in the base tree is
 * reported as COPIED, or as MOVED when the source is gone on the other side
 * (the source's REMOVED entry is then folded into the move).
 */
public final class ChangesetDiffer {

    static final int BINARY_PROBE_BYTES = 8000;

    private final ManifestDeriver manifests;

    public ChangesetDiffer(ManifestDeriver manifests) {
        this.manifests = Objects.requireNonNull(manifests, "manifests");
    }

    /** Entries sorted by path. */
    public List<DiffEntry> diff(Repo repo, ChangesetId base, ChangesetId other) {
        Manifest from = manifests.manifest(repo, base);
        Manifest to = manifests.manifest(repo, other);
        Map<MPath, MPath> copies = copySources(repo, base, other);

        TreeSet<MPath> paths = new TreeSet<>(from.entries().keySet());
        paths.addAll(to.entries().keySet());

        Set<MPath> movedAway = new HashSet<>();
        List<DiffEntry> added = new ArrayList<>();
        for (MPath p : paths) {
            if (from.contains(p) || !to.contains(p)) continue;
            MPath src = copies.get(p);
            boolean binary = isBinary(repo, to.get(p).get().content());
            if (src != null && from.contains(src)) {
                if (!to.contains(src) && movedAway.add(src)) {
                    added.add(new DiffEntry(p, DiffKind.MOVED, Optional.of(src), binary));
                } else {
                    added.add(new DiffEntry(p, DiffKind.COPIED, Optional.of(src), binary));
                }
            } else {
                added.add(new DiffEntry(p, DiffKind.ADDED, Optional.empty(), binary));
            }
        }

        Map<MPath, DiffEntry> byPath = new HashMap<>();
        for (DiffEntry e : added) byPath.put(e.path(), e);
        List<DiffEntry> out = new ArrayList<>();
        for (MPath p : paths) {
            Optional<Manifest.Entry> a = from.get(p);
            Optional<Manifest.Entry> b = to.get(p);
            if (a.isPresent() && b.isPresent()) {
                if (!a.get().equals(b.get())) {
                    out.add(new DiffEntry(p, DiffKind.CHANGED, Optional.empty(), isBinary(repo, b.get().content())));
                }
            } else if (a.isPresent()) {
                if (!movedAway.contains(p)) {
                    out.add(new DiffEntry(p, DiffKind.REMOVED, Optional.empty(), isBinary(repo, a.get().content())));
                }
            } else {
                out.add(byPath.get(p));
            }
        }
        return out;
    }

    /** Latest recorded copy source per destination path, over base..other. */
    private static Map<MPath, MPath> copySources(Repo repo, ChangesetId base, ChangesetId other) {
        Map<MPath, MPath> out = new HashMap<>();
        for (ChangesetId id : CommitGraph.rangeExclusive(repo.changesets(), other, Optional.of(base))) {
            for (Map.Entry<MPath, FileChange> e : repo.load(id).fileChanges().entrySet()) {
                if (e.getValue() instanceof FileChange.Modified m && m.copyFrom() != null) {
                    out.put(e.getKey(), m.copyFrom().path());
                } else if (e.getValue() instanceof FileChange.Deleted) {
                    out.remove(e.getKey());
                }
            }
        }
        return out;
    }

    private static boolean isBinary(Repo repo, ContentId content) {
        Optional<byte[]> bytes = repo.contents().get(content);
        if (bytes.isEmpty()) return false;
        byte[] b = bytes.get();
        int n = Math.min(b.length, BINARY_PROBE_BYTES);
        for (int i = 0; i < n; i++) {
            if (b[i] == 0) return true;
        }
        return false;
    }
}
