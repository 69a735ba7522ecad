// file: server/src/main/java/io/monosync/server/repo/SyncPair.java
package io.monosync.server.repo;

import io.monosync.core.sync.BookmarkCorrespondence;
import io.monosync.core.sync.CommitSyncConfig;
import io.monosync.core.sync.PathRewriter;
import io.monosync.core.sync.SyncConfigVersion;

import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/** A small repository, the large repository embedding it, and their sync config. */
public final class SyncPair {

    private final Repo small;
    private final Repo large;
    private final CommitSyncConfig config;
    private final Map<SyncConfigVersion, CommitSyncConfig> versions;
    private final PathRewriter paths;
    private final BookmarkCorrespondence bookmarks;

    public SyncPair(Repo small, Repo large, CommitSyncConfig config, Map<SyncConfigVersion, CommitSyncConfig> versions) {
        this.small = Objects.requireNonNull(small, "small");
        this.large = Objects.requireNonNull(large, "large");
        this.config = Objects.requireNonNull(config, "config");
        this.versions = Map.copyOf(versions);
        if (!small.id().equals(config.smallRepo()) || !large.id().equals(config.largeRepo())) {
            throw new IllegalArgumentException("config " + config + " does not match " + small + " -> " + large);
        }
        this.paths = new PathRewriter(config);
        this.bookmarks = new BookmarkCorrespondence(config);
    }

    public SyncPair(Repo small, Repo large, CommitSyncConfig config) {
        this(small, large, config, Map.of(config.version(), config));
    }

    public Repo small() { return small; }

    public Repo large() { return large; }

    /** Config version used for new syncs. */
    public CommitSyncConfig config() { return config; }

    public Optional<CommitSyncConfig> config(SyncConfigVersion version) {
        return Optional.ofNullable(versions.get(version));
    }

    public PathRewriter paths() { return paths; }

    public BookmarkCorrespondence bookmarks() { return bookmarks; }

    @Override
    public String toString() {
        return small.name() + " -> " + large.name() + " (" + config.version().name() + ")";
    }
}
