// file: server/src/main/java/io/monosync/server/derived/AltHashDeriver.java
package io.monosync.server.derived;

import io.monosync.core.AltHash;
import io.monosync.core.Changeset;
import io.monosync.core.ChangesetId;
import io.monosync.core.FileChange;
import io.monosync.core.Hashing;
import io.monosync.core.MPath;
import io.monosync.server.repo.CommitGraph;
import io.monosync.server.repo.Repo;

import java.io.ByteArrayOutputStream;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.logging.Logger;

/**
 * Derives alternate-system hashes and records them in the repository's
 * {@link io.monosync.storage.AltHashStore}.
 * <p>
 * The hash is SHA-1 over, in order:
 *  - the alternate hashes of the parents (NULL-padded to two),
 *  - the manifest hash of the full tree,
 *  - author, date and message,
 *  - the touched paths, with copy sources,
 *  - the extras.
 * It never includes a native id, so it only depends on the history's content.
 */
public final class AltHashDeriver {
    private static final Logger LOG = Logger.getLogger(AltHashDeriver.class.getName());

    private final ManifestDeriver manifests;

    public AltHashDeriver(ManifestDeriver manifests) {
        this.manifests = Objects.requireNonNull(manifests, "manifests");
    }

    /** Alternate hash of {@code id}, deriving and indexing any missing ancestors first. */
    public AltHash derive(Repo repo, ChangesetId id) {
        List<ChangesetId> pending = CommitGraph.pendingAncestors(repo.changesets(), id,
                c -> repo.altHashes().get(repo.id(), c).isPresent());
        for (ChangesetId c : pending) {
            Changeset cs = repo.load(c);
            AltHash hash = compute(cs, repo, manifests.manifest(repo, c));
            repo.altHashes().put(repo.id(), c, hash);
        }
        if (!pending.isEmpty()) {
            LOG.fine(() -> "derived " + pending.size() + " alternate hashes in " + repo.name());
        }
        return repo.altHashes().get(repo.id(), id).orElseThrow();
    }

    private static AltHash compute(Changeset cs, Repo repo, Manifest manifest) {
        ByteArrayOutputStream buf = new ByteArrayOutputStream();
        List<ChangesetId> parents = cs.parents();
        for (int i = 0; i < Math.max(2, parents.size()); i++) {
            AltHash p = i < parents.size()
                    ? repo.altHashes().get(repo.id(), parents.get(i)).orElseThrow()
                    : AltHash.NULL;
            buf.writeBytes(p.toBytes());
        }
        buf.writeBytes(manifest.hash().toBytes());

        StringBuilder text = new StringBuilder();
        text.append(cs.author()).append('\n');
        text.append(cs.date().epochSeconds()).append(' ').append(cs.date().tzOffsetSeconds()).append('\n');
        for (Map.Entry<MPath, FileChange> e : cs.fileChanges().entrySet()) {
            text.append(e.getKey());
            if (e.getValue() instanceof FileChange.Modified m && m.copyFrom() != null) {
                text.append('\0').append(m.copyFrom().path());
            }
            text.append('\n');
        }
        text.append('\n').append(cs.message());
        buf.writeBytes(text.toString().getBytes(StandardCharsets.UTF_8));
        for (Map.Entry<String, byte[]> e : cs.extras().entrySet()) {
            buf.writeBytes(('\0' + e.getKey() + '\0').getBytes(StandardCharsets.UTF_8));
            buf.writeBytes(e.getValue());
        }
        return AltHash.fromBytes(Hashing.sha1(buf.toByteArray()));
    }
}
