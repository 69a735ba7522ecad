// file: server/src/main/java/io/monosync/server/repo/RepoConfig.java
package io.monosync.server.repo;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.monosync.core.BookmarkName;
import io.monosync.core.MPath;
import io.monosync.core.RepositoryId;
import io.monosync.core.sync.CommitSyncConfig;
import io.monosync.core.sync.EmptyCommitPolicy;
import io.monosync.core.sync.SyncConfigVersion;
import io.monosync.server.dto.JsonRepoConfig;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.TreeMap;

/**
 * Validated repository and cross-repo sync configuration.
 * <p>
 * Each sync pair may list several config versions; the one named by
 * currentVersion is used for new syncs, older ones stay valid for reading
 * existing mapping entries.
 */
public final class RepoConfig {

    public record RepoSpec(RepositoryId id, String name, boolean assignLegacyRevisions) {
        public RepoSpec {
            Objects.requireNonNull(id, "id");
            Objects.requireNonNull(name, "name");
            if (name.isBlank()) throw new IllegalArgumentException("repo name must not be blank");
        }
    }

    public record SyncSpec(Map<SyncConfigVersion, CommitSyncConfig> versions, CommitSyncConfig current) {
        public SyncSpec {
            versions = Map.copyOf(versions);
            Objects.requireNonNull(current, "current");
        }
    }

    public static final int DEFAULT_MAX_RETRIES = 10;

    private final List<RepoSpec> repos;
    private final int maxRetries;
    private final List<SyncSpec> syncs;

    public RepoConfig(List<RepoSpec> repos, int maxRetries, List<SyncSpec> syncs) {
        if (repos == null || repos.isEmpty()) throw new IllegalArgumentException("repos must not be empty");
        if (maxRetries < 0) throw new IllegalArgumentException("maxRetries must be >= 0");
        this.repos = List.copyOf(repos);
        this.maxRetries = maxRetries;
        this.syncs = List.copyOf(syncs);

        Set<RepositoryId> ids = new HashSet<>();
        Set<String> names = new HashSet<>();
        for (RepoSpec r : repos) {
            if (!ids.add(r.id())) throw new IllegalArgumentException("duplicate repo id " + r.id());
            if (!names.add(r.name())) throw new IllegalArgumentException("duplicate repo name " + r.name());
        }
        Set<RepositoryId> smallRepos = new HashSet<>();
        for (SyncSpec s : syncs) {
            CommitSyncConfig c = s.current();
            if (!ids.contains(c.smallRepo()) || !ids.contains(c.largeRepo())) {
                throw new IllegalArgumentException("sync pair refers to unknown repo: " + c);
            }
            if (!smallRepos.add(c.smallRepo())) {
                throw new IllegalArgumentException("repo " + c.smallRepo() + " is the small side of more than one pair");
            }
        }
        for (SyncSpec s : syncs) {
            if (smallRepos.contains(s.current().largeRepo())) {
                throw new IllegalArgumentException("repo " + s.current().largeRepo() + " cannot be both small and large");
            }
        }
    }

    /** One large repo "large" (id 0) embedding "small" (id 1) under "small/". */
    public static RepoConfig defaults() {
        RepositoryId large = new RepositoryId(0);
        RepositoryId small = new RepositoryId(1);
        CommitSyncConfig v1 = CommitSyncConfig.simple(new SyncConfigVersion("v1"), small, large, "small",
                Set.of(BookmarkName.of("master")));
        return new RepoConfig(
                List.of(new RepoSpec(large, "large", true), new RepoSpec(small, "small", false)),
                DEFAULT_MAX_RETRIES,
                List.of(new SyncSpec(Map.of(v1.version(), v1), v1))
        );
    }

    public static RepoConfig fromJsonFile(Path path) {
        ObjectMapper mapper = new ObjectMapper();
        try {
            return fromJson(mapper.readValue(path.toFile(), JsonRepoConfig.class));
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to load RepoConfig from " + path, e);
        }
    }

    static RepoConfig fromJson(JsonRepoConfig cfg) {
        if (cfg.repos == null) throw new IllegalArgumentException("config has no repos");
        List<RepoSpec> repos = cfg.repos.stream()
                .map(r -> new RepoSpec(new RepositoryId(r.id), r.name, r.assignLegacyRevisions))
                .toList();
        int maxRetries = cfg.pushrebase == null ? DEFAULT_MAX_RETRIES : cfg.pushrebase.maxRetries;

        List<SyncSpec> syncs = new ArrayList<>();
        if (cfg.commitSync != null) {
            for (JsonRepoConfig.JsonCommitSync s : cfg.commitSync) {
                syncs.add(syncSpec(s));
            }
        }
        return new RepoConfig(repos, maxRetries, syncs);
    }

    private static SyncSpec syncSpec(JsonRepoConfig.JsonCommitSync s) {
        if (s.versions == null || s.versions.isEmpty()) {
            throw new IllegalArgumentException("commitSync entry has no versions");
        }
        RepositoryId small = new RepositoryId(s.smallRepo);
        RepositoryId large = new RepositoryId(s.largeRepo);
        Map<SyncConfigVersion, CommitSyncConfig> versions = new LinkedHashMap<>();
        for (JsonRepoConfig.JsonSyncVersion v : s.versions) {
            Map<MPath, MPath> overrides = new TreeMap<>();
            if (v.pathOverrides != null) {
                v.pathOverrides.forEach((from, to) -> overrides.put(MPath.of(from), MPath.of(to)));
            }
            Set<BookmarkName> common = new HashSet<>();
            if (v.commonBookmarks != null) {
                v.commonBookmarks.forEach(b -> common.add(BookmarkName.of(b)));
            }
            SyncConfigVersion version = new SyncConfigVersion(v.version);
            String prefix = Objects.requireNonNull(v.defaultPrefix, "defaultPrefix");
            CommitSyncConfig config = new CommitSyncConfig(
                    version, small, large,
                    MPath.of(prefix),
                    overrides,
                    v.bookmarkPrefix == null ? prefix : v.bookmarkPrefix,
                    common,
                    parsePolicy(v.emptyCommits)
            );
            if (versions.put(version, config) != null) {
                throw new IllegalArgumentException("duplicate sync config version " + version.name());
            }
        }
        SyncConfigVersion currentName = s.currentVersion == null
                ? new SyncConfigVersion(s.versions.get(s.versions.size() - 1).version)
                : new SyncConfigVersion(s.currentVersion);
        CommitSyncConfig current = versions.get(currentName);
        if (current == null) {
            throw new IllegalArgumentException("currentVersion " + currentName.name() + " is not among the listed versions");
        }
        return new SyncSpec(versions, current);
    }

    private static EmptyCommitPolicy parsePolicy(String text) {
        if (text == null) return EmptyCommitPolicy.SKIP;
        return switch (text.trim().toLowerCase(Locale.ROOT)) {
            case "skip" -> EmptyCommitPolicy.SKIP;
            case "emit" -> EmptyCommitPolicy.EMIT;
            default -> throw new IllegalArgumentException("emptyCommits must be one of: skip, emit");
        };
    }

    public List<RepoSpec> repos() {
        return repos;
    }

    public int maxRetries() {
        return maxRetries;
    }

    public List<SyncSpec> syncs() {
        return syncs;
    }
}
