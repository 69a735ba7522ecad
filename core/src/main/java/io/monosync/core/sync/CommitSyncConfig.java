// file: core/src/main/java/io/monosync/core/sync/CommitSyncConfig.java
package io.monosync.core.sync;

import io.monosync.core.BookmarkName;
import io.monosync.core.MPath;
import io.monosync.core.RepositoryId;

import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * One version of the configuration tying a small repository to the large
 * repository that embeds it.
 * <p>
 * Fields:
 *  - defaultPrefix:   large-repo directory holding the small repo ("p" -> "prefix/p").
 *  - pathOverrides:   small-repo prefix -> large-repo prefix, longest match wins
 *                     over the default prefix.
 *  - bookmarkPrefix:  namespace for mirrored non-common bookmarks on the large side.
 *  - commonBookmarks: names shared verbatim by both repositories.
 *  - emptyCommits:    policy for commits that rewrite to no changes.
 * <p>
 * Configs are immutable; a change produces a new version, and mapping entries
 * record the version that produced them.
 */
public final class CommitSyncConfig {

    private final SyncConfigVersion version;
    private final RepositoryId smallRepo;
    private final RepositoryId largeRepo;
    private final MPath defaultPrefix;
    private final SortedMap<MPath, MPath> pathOverrides;
    private final String bookmarkPrefix;
    private final Set<BookmarkName> commonBookmarks;
    private final EmptyCommitPolicy emptyCommits;

    public CommitSyncConfig(
            SyncConfigVersion version,
            RepositoryId smallRepo,
            RepositoryId largeRepo,
            MPath defaultPrefix,
            Map<MPath, MPath> pathOverrides,
            String bookmarkPrefix,
            Set<BookmarkName> commonBookmarks,
            EmptyCommitPolicy emptyCommits
    ) {
        this.version = Objects.requireNonNull(version, "version");
        this.smallRepo = Objects.requireNonNull(smallRepo, "smallRepo");
        this.largeRepo = Objects.requireNonNull(largeRepo, "largeRepo");
        this.defaultPrefix = Objects.requireNonNull(defaultPrefix, "defaultPrefix");
        this.pathOverrides = Collections.unmodifiableSortedMap(new TreeMap<>(Objects.requireNonNull(pathOverrides, "pathOverrides")));
        this.bookmarkPrefix = Objects.requireNonNull(bookmarkPrefix, "bookmarkPrefix");
        this.commonBookmarks = Set.copyOf(Objects.requireNonNull(commonBookmarks, "commonBookmarks"));
        this.emptyCommits = Objects.requireNonNull(emptyCommits, "emptyCommits");

        if (smallRepo.equals(largeRepo)) {
            throw new IllegalArgumentException("small and large repository must differ");
        }
        BookmarkName.of(bookmarkPrefix); // validates the namespace syntax
        List<MPath> targets = List.copyOf(this.pathOverrides.values());
        for (int i = 0; i < targets.size(); i++) {
            for (int j = 0; j < targets.size(); j++) {
                if (i != j && targets.get(i).isPrefixOf(targets.get(j))) {
                    throw new IllegalArgumentException("path override targets overlap: "
                            + targets.get(i) + " and " + targets.get(j));
                }
            }
        }
    }

    /** Config with only a default prefix and no overrides. */
    public static CommitSyncConfig simple(
            SyncConfigVersion version,
            RepositoryId smallRepo,
            RepositoryId largeRepo,
            String prefix,
            Set<BookmarkName> commonBookmarks
    ) {
        return new CommitSyncConfig(version, smallRepo, largeRepo, MPath.of(prefix), Map.of(),
                prefix, commonBookmarks, EmptyCommitPolicy.SKIP);
    }

    public SyncConfigVersion version() { return version; }

    public RepositoryId smallRepo() { return smallRepo; }

    public RepositoryId largeRepo() { return largeRepo; }

    public MPath defaultPrefix() { return defaultPrefix; }

    public SortedMap<MPath, MPath> pathOverrides() { return pathOverrides; }

    public String bookmarkPrefix() { return bookmarkPrefix; }

    public Set<BookmarkName> commonBookmarks() { return commonBookmarks; }

    public EmptyCommitPolicy emptyCommits() { return emptyCommits; }

    @Override
    public String toString() {
        return "CommitSyncConfig{" + version + ", small=" + smallRepo + ", large=" + largeRepo
                + ", prefix=" + defaultPrefix + "}";
    }
}
