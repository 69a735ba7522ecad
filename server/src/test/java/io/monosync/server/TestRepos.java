// file: server/src/test/java/io/monosync/server/TestRepos.java
package io.monosync.server;

import io.monosync.core.BookmarkName;
import io.monosync.core.Changeset;
import io.monosync.core.ChangesetId;
import io.monosync.core.ContentId;
import io.monosync.core.DateTime;
import io.monosync.core.FileChange;
import io.monosync.core.FileType;
import io.monosync.core.MPath;
import io.monosync.server.derived.AltHashDeriver;
import io.monosync.server.derived.ManifestDeriver;
import io.monosync.server.identity.LegacyRevisionAssigner;
import io.monosync.server.repo.Repo;
import io.monosync.server.repo.RepoConfig;
import io.monosync.server.repo.RepoRegistry;
import io.monosync.server.repo.Storage;
import io.monosync.server.repo.SyncPair;
import io.monosync.server.sync.PublishResult;
import io.monosync.server.sync.PushRedirector;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * In-memory wiring of the default "large" + "small" setup (small embedded
 * under "small/", "master" common), plus a small commit builder.
 */
public final class TestRepos {

    public final RepoRegistry registry;
    public final ManifestDeriver manifests = new ManifestDeriver();
    public final AltHashDeriver altHashes = new AltHashDeriver(manifests);
    public final LegacyRevisionAssigner legacyRevisions = new LegacyRevisionAssigner();
    public final PushRedirector redirector;
    public final Repo large;
    public final Repo small;

    public TestRepos(RepoConfig config) {
        this.registry = new RepoRegistry(config, Storage.inMemory());
        this.redirector = new PushRedirector(registry, legacyRevisions, altHashes);
        this.large = registry.repo("large");
        this.small = registry.pairs().isEmpty() ? null : registry.pairs().get(0).small();
    }

    public static TestRepos defaults() {
        return new TestRepos(RepoConfig.defaults());
    }

    public SyncPair pair() {
        return registry.pairs().get(0);
    }

    public PublishResult push(Repo repo, String bookmark, Draft... drafts) {
        List<Changeset> commits = new ArrayList<>();
        List<byte[]> contents = new ArrayList<>();
        for (Draft d : drafts) {
            commits.add(d.changeset());
            contents.addAll(d.contents());
        }
        return redirector.push(repo, BookmarkName.of(bookmark), commits, contents);
    }

    /** Stores commits and their content directly, without moving any bookmark. */
    public static void seed(Repo repo, Draft... drafts) {
        for (Draft d : drafts) {
            d.contents().forEach(repo.contents()::put);
            repo.changesets().put(d.changeset());
        }
    }

    public static DraftBuilder draft(String message) {
        return new DraftBuilder(message);
    }

    public static byte[] bytes(String text) {
        return text.getBytes(StandardCharsets.UTF_8);
    }

    /** A commit plus the content blobs its changes reference. */
    public record Draft(Changeset changeset, List<byte[]> contents) {
        public ChangesetId id() {
            return changeset.id();
        }
    }

    public static final class DraftBuilder {
        private final String message;
        private final List<ChangesetId> parents = new ArrayList<>();
        private final TreeMap<MPath, FileChange> changes = new TreeMap<>();
        private final TreeMap<String, byte[]> extras = new TreeMap<>();
        private final List<byte[]> contents = new ArrayList<>();
        private String author = "tester";
        private long date = 1_700_000_000L;

        private DraftBuilder(String message) {
            this.message = message;
        }

        public DraftBuilder parents(ChangesetId... ids) {
            parents.addAll(Arrays.asList(ids));
            return this;
        }

        public DraftBuilder parent(Draft d) {
            return parents(d.id());
        }

        public DraftBuilder file(String path, String text) {
            return file(path, bytes(text));
        }

        public DraftBuilder file(String path, byte[] content) {
            contents.add(content);
            changes.put(MPath.of(path), FileChange.modified(ContentId.of(content), FileType.REGULAR, content.length));
            return this;
        }

        public DraftBuilder delete(String path) {
            changes.put(MPath.of(path), FileChange.deleted());
            return this;
        }

        public DraftBuilder copy(String path, String text, String fromPath, ChangesetId fromCommit) {
            byte[] content = bytes(text);
            contents.add(content);
            changes.put(MPath.of(path), FileChange.modified(ContentId.of(content), FileType.REGULAR, content.length)
                    .withCopyFrom(new FileChange.CopyFrom(MPath.of(fromPath), fromCommit)));
            return this;
        }

        public DraftBuilder author(String author) {
            this.author = author;
            return this;
        }

        public DraftBuilder date(long epochSeconds) {
            this.date = epochSeconds;
            return this;
        }

        public DraftBuilder extra(String key, String value) {
            extras.put(key, bytes(value));
            return this;
        }

        public Draft build() {
            Changeset cs = new Changeset(parents, changes, author, DateTime.ofEpochSeconds(date), message,
                    Map.copyOf(extras));
            return new Draft(cs, List.copyOf(contents));
        }
    }
}
