// file: server/src/main/java/io/monosync/server/repo/RepoRegistry.java
package io.monosync.server.repo;

import io.monosync.core.NotFoundException;
import io.monosync.core.RepositoryId;
import io.monosync.storage.AltHashStore;
import io.monosync.storage.BookmarkStore;
import io.monosync.storage.DurableAltHashStore;
import io.monosync.storage.DurableBookmarkStore;
import io.monosync.storage.DurableChangesetStore;
import io.monosync.storage.DurableContentStore;
import io.monosync.storage.DurableLegacyRevisionStore;
import io.monosync.storage.DurableSyncedCommitMapping;
import io.monosync.storage.LegacyRevisionStore;
import io.monosync.storage.SyncedCommitMapping;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.logging.Logger;

/**
 * All configured repositories and sync pairs, wired to their stores.
 * <p>
 * WAL layout under the data directory:
 *  - repos/{id}/changesets, repos/{id}/contents: per repository
 *  - bookmarks, legacy-revisions, alt-hashes, synced-commits: shared tables
 */
public final class RepoRegistry implements AutoCloseable {
    private static final Logger LOG = Logger.getLogger(RepoRegistry.class.getName());

    private final Map<String, Repo> byName = new LinkedHashMap<>();
    private final Map<RepositoryId, Repo> byId = new LinkedHashMap<>();
    private final List<SyncPair> pairs = new ArrayList<>();
    private final SyncedCommitMapping mapping;
    private final int maxRetries;
    private final Storage storage;

    public RepoRegistry(RepoConfig config, Storage storage) {
        this.storage = storage;
        this.maxRetries = config.maxRetries();
        BookmarkStore bookmarks = new DurableBookmarkStore(storage.wal("bookmarks"));
        LegacyRevisionStore legacy = new DurableLegacyRevisionStore(storage.wal("legacy-revisions"));
        AltHashStore alt = new DurableAltHashStore(storage.wal("alt-hashes"));
        this.mapping = new DurableSyncedCommitMapping(storage.wal("synced-commits"));

        for (RepoConfig.RepoSpec spec : config.repos()) {
            String dir = "repos/" + spec.id().id() + "/";
            Repo repo = new Repo(
                    spec.id(),
                    spec.name(),
                    new DurableChangesetStore(storage.wal(dir + "changesets")),
                    new DurableContentStore(storage.wal(dir + "contents")),
                    bookmarks,
                    legacy,
                    alt,
                    spec.assignLegacyRevisions()
            );
            byName.put(repo.name(), repo);
            byId.put(repo.id(), repo);
        }
        for (RepoConfig.SyncSpec s : config.syncs()) {
            SyncPair pair = new SyncPair(byId.get(s.current().smallRepo()), byId.get(s.current().largeRepo()),
                    s.current(), s.versions());
            pairs.add(pair);
            LOG.info("sync pair " + pair);
        }
        LOG.info("loaded " + byId.size() + " repos (" + (storage.isDurable() ? "durable" : "in-memory") + ")");
    }

    /** Repository by name or numeric id. */
    public Repo repo(String nameOrId) {
        Repo r = byName.get(nameOrId);
        if (r == null && !nameOrId.isEmpty() && nameOrId.chars().allMatch(Character::isDigit)) {
            try {
                r = byId.get(new RepositoryId(Integer.parseInt(nameOrId)));
            } catch (NumberFormatException ignoredTooLarge) {
                r = null;
            }
        }
        if (r == null) throw new NotFoundException("repo " + nameOrId);
        return r;
    }

    public Repo repo(RepositoryId id) {
        Repo r = byId.get(id);
        if (r == null) throw new NotFoundException("repo " + id);
        return r;
    }

    public Collection<Repo> repos() {
        return byId.values();
    }

    public List<SyncPair> pairs() {
        return List.copyOf(pairs);
    }

    /** The pair in which {@code repo} is the small side. */
    public Optional<SyncPair> pairForSmall(Repo repo) {
        return pairs.stream().filter(p -> p.small().id().equals(repo.id())).findFirst();
    }

    /** Every pair in which {@code repo} is the large side. */
    public List<SyncPair> pairsForLarge(Repo repo) {
        return pairs.stream().filter(p -> p.large().id().equals(repo.id())).toList();
    }

    public SyncedCommitMapping mapping() {
        return mapping;
    }

    public int maxRetries() {
        return maxRetries;
    }

    @Override
    public void close() {
        storage.close();
    }
}
