// file: server/src/main/java/io/monosync/server/RepoService.java
package io.monosync.server;

import io.monosync.core.BookmarkName;
import io.monosync.core.Changeset;
import io.monosync.core.ChangesetId;
import io.monosync.core.ContentId;
import io.monosync.core.DateTime;
import io.monosync.core.FileChange;
import io.monosync.core.FileType;
import io.monosync.core.MPath;
import io.monosync.server.check.ChangesetChecker;
import io.monosync.server.check.CheckProblem;
import io.monosync.server.check.CheckReport;
import io.monosync.server.diff.ChangesetDiffer;
import io.monosync.server.diff.DiffEntry;
import io.monosync.server.dto.BookmarkListResponse;
import io.monosync.server.dto.ChangeJson;
import io.monosync.server.dto.CheckResponse;
import io.monosync.server.dto.CommitJson;
import io.monosync.server.dto.DiffResponse;
import io.monosync.server.dto.LookupResponse;
import io.monosync.server.dto.PublishResponse;
import io.monosync.server.dto.PushRequest;
import io.monosync.server.identity.Identifier;
import io.monosync.server.identity.IdentifierKind;
import io.monosync.server.identity.IdentifierResolver;
import io.monosync.server.repo.Repo;
import io.monosync.server.repo.RepoRegistry;
import io.monosync.server.sync.BookmarkMirror;
import io.monosync.server.sync.PublishResult;
import io.monosync.server.sync.PushRedirector;
import io.monosync.storage.Bookmark;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Base64;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;

/**
 * Application service behind the HTTP API.
 *
 * Responsibilities:
 *  - Resolve repository names and identifiers.
 *  - Decode push payloads (Base64 content, "#i" references) into changesets.
 *  - Delegate writes to {@link PushRedirector} and reads to the resolver,
 *    differ and checker.
 *  - Convert results into the JSON view models.
 */
public class RepoService {

    static final int DEFAULT_BOOKMARK_LIMIT = 1000;

    private final RepoRegistry registry;
    private final IdentifierResolver resolver;
    private final PushRedirector redirector;
    private final ChangesetDiffer differ;
    private final ChangesetChecker checker;

    public RepoService(
            RepoRegistry registry,
            IdentifierResolver resolver,
            PushRedirector redirector,
            ChangesetDiffer differ,
            ChangesetChecker checker
    ) {
        this.registry = Objects.requireNonNull(registry, "registry");
        this.resolver = Objects.requireNonNull(resolver, "resolver");
        this.redirector = Objects.requireNonNull(redirector, "redirector");
        this.differ = Objects.requireNonNull(differ, "differ");
        this.checker = Objects.requireNonNull(checker, "checker");
    }

    /**
     * @param kind   scheme to parse {@code id} with, or null to guess from its shape
     * @param wanted schemes to report, or null/empty for all of them
     */
    public LookupResponse lookup(String repoName, String id, String kind, List<String> wanted) {
        Repo repo = registry.repo(repoName);
        Identifier identifier = kind == null || kind.isBlank()
                ? Identifier.parse(requireParam(id, "id"))
                : Identifier.parse(requireParam(id, "id"), IdentifierKind.fromWireName(kind));
        Set<IdentifierKind> kinds = EnumSet.noneOf(IdentifierKind.class);
        if (wanted == null || wanted.isEmpty()) {
            kinds.addAll(EnumSet.allOf(IdentifierKind.class));
        } else {
            for (String w : wanted) {
                for (String part : w.split(",")) {
                    if (!part.isBlank()) kinds.add(IdentifierKind.fromWireName(part));
                }
            }
        }

        Map<String, String> names = new LinkedHashMap<>();
        for (Map.Entry<IdentifierKind, Identifier> e : resolver.lookup(repo, identifier, kinds).entrySet()) {
            names.put(e.getKey().wireName(), e.getValue().text());
        }
        LookupResponse dto = new LookupResponse();
        dto.repo = repo.name();
        dto.changeset = resolver.resolve(repo, identifier).hex();
        dto.identifiers = names;
        return dto;
    }

    public DiffResponse diff(String repoName, String base, String other) {
        Repo repo = registry.repo(repoName);
        ChangesetId from = resolver.resolve(repo, requireParam(base, "base"));
        ChangesetId to = resolver.resolve(repo, requireParam(other, "other"));

        DiffResponse dto = new DiffResponse();
        dto.base = from.hex();
        dto.other = to.hex();
        dto.entries = new ArrayList<>();
        for (DiffEntry e : differ.diff(repo, from, to)) {
            DiffResponse.Entry entry = new DiffResponse.Entry();
            entry.path = e.path().toString();
            entry.kind = e.kind().name();
            entry.from = e.from().map(MPath::toString).orElse(null);
            entry.binary = e.binary();
            entry.summary = e.describe();
            dto.entries.add(entry);
        }
        return dto;
    }

    public BookmarkListResponse listBookmarks(String repoName, String prefix, String limit) {
        Repo repo = registry.repo(repoName);
        int max = DEFAULT_BOOKMARK_LIMIT;
        if (limit != null && !limit.isBlank()) {
            try {
                max = Integer.parseInt(limit);
            } catch (NumberFormatException nfe) {
                throw new IllegalArgumentException("limit must be an integer", nfe);
            }
            if (max <= 0) throw new IllegalArgumentException("limit must be > 0");
        }
        BookmarkListResponse dto = new BookmarkListResponse();
        dto.repo = repo.name();
        dto.bookmarks = new ArrayList<>();
        for (Bookmark b : repo.listBookmarks(prefix == null ? "" : prefix, max)) {
            BookmarkListResponse.Entry e = new BookmarkListResponse.Entry();
            e.name = b.name().name();
            e.target = b.target().hex();
            dto.bookmarks.add(e);
        }
        return dto;
    }

    public PublishResponse push(String repoName, PushRequest req) {
        Repo repo = registry.repo(repoName);
        if (req == null) throw new IllegalArgumentException("missing push body");
        BookmarkName bookmark = BookmarkName.of(requireParam(req.bookmark, "bookmark"));
        if (req.commits == null || req.commits.isEmpty()) {
            throw new IllegalArgumentException("push has no commits");
        }

        List<Changeset> commits = new ArrayList<>(req.commits.size());
        List<byte[]> contents = new ArrayList<>();
        for (int i = 0; i < req.commits.size(); i++) {
            commits.add(decodeCommit(i, req.commits.get(i), commits, contents));
        }
        return toResponse(redirector.push(repo, bookmark, commits, contents));
    }

    public PublishResponse setBookmark(String repoName, String name, String target, String expected) {
        Repo repo = registry.repo(repoName);
        BookmarkName bookmark = BookmarkName.of(name);
        ChangesetId to = resolver.resolve(repo, requireParam(target, "target"));
        Optional<ChangesetId> exp = expected == null || expected.isBlank()
                ? Optional.empty()
                : Optional.of(resolver.resolve(repo, expected));
        return toResponse(redirector.setBookmark(repo, bookmark, to, exp));
    }

    public PublishResponse deleteBookmark(String repoName, String name, String expected) {
        Repo repo = registry.repo(repoName);
        Optional<ChangesetId> exp = expected == null || expected.isBlank()
                ? Optional.empty()
                : Optional.of(resolver.resolve(repo, expected));
        return toResponse(redirector.deleteBookmark(repo, BookmarkName.of(name), exp));
    }

    public CheckResponse check(String repoName) {
        CheckReport report = checker.check(registry.repo(repoName));
        CheckResponse dto = new CheckResponse();
        dto.repo = report.repo();
        dto.checked = report.checked();
        dto.ok = report.ok();
        dto.problems = new ArrayList<>();
        for (CheckProblem p : report.problems()) {
            CheckResponse.Problem out = new CheckResponse.Problem();
            out.kind = p.kind().name();
            out.changeset = p.changeset().hex();
            out.detail = p.detail();
            dto.problems.add(out);
        }
        return dto;
    }

    // ---------- decoding ----------

    private static Changeset decodeCommit(int index, CommitJson c, List<Changeset> earlier, List<byte[]> contents) {
        if (c == null) throw new IllegalArgumentException("commit #" + index + " is null");
        List<ChangesetId> parents = new ArrayList<>();
        if (c.parents != null) {
            for (String p : c.parents) parents.add(reference(p, earlier));
        }

        TreeMap<MPath, FileChange> changes = new TreeMap<>();
        if (c.changes != null) {
            for (Map.Entry<String, ChangeJson> e : c.changes.entrySet()) {
                changes.put(MPath.of(e.getKey()), decodeChange(e.getKey(), e.getValue(), earlier, contents));
            }
        }

        Map<String, byte[]> extras = new TreeMap<>();
        if (c.extras != null) {
            for (Map.Entry<String, String> e : c.extras.entrySet()) {
                extras.put(e.getKey(), e.getValue().getBytes(StandardCharsets.UTF_8));
            }
        }
        return new Changeset(parents, changes, requireParam(c.author, "author"), new DateTime(c.date, c.tzOffset),
                c.message == null ? "" : c.message, extras);
    }

    private static FileChange decodeChange(String path, ChangeJson ch, List<Changeset> earlier, List<byte[]> contents) {
        if (ch == null) throw new IllegalArgumentException("change for " + path + " is null");
        if (ch.deleted) {
            if (ch.contentBase64 != null) {
                throw new IllegalArgumentException("change for " + path + " is both deleted and modified");
            }
            return FileChange.deleted();
        }
        if (ch.contentBase64 == null) {
            throw new IllegalArgumentException("change for " + path + " needs contentBase64 or deleted");
        }
        byte[] bytes;
        try {
            bytes = Base64.getDecoder().decode(ch.contentBase64);
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("contentBase64 for " + path + " is not valid Base64", e);
        }
        contents.add(bytes);
        FileType type = ch.type == null ? FileType.REGULAR : FileType.valueOf(ch.type.toUpperCase(Locale.ROOT));
        FileChange.Modified m = FileChange.modified(ContentId.of(bytes), type, bytes.length);
        if (ch.copyFrom != null) {
            m = m.withCopyFrom(new FileChange.CopyFrom(
                    MPath.of(requireParam(ch.copyFrom.path, "copyFrom.path")),
                    reference(requireParam(ch.copyFrom.commit, "copyFrom.commit"), earlier)));
        }
        return m;
    }

    /** Hex id, or "#i" for the i-th commit of the same request (must come earlier). */
    private static ChangesetId reference(String ref, List<Changeset> earlier) {
        if (ref != null && ref.startsWith("#")) {
            int i;
            try {
                i = Integer.parseInt(ref.substring(1));
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("bad commit reference: " + ref, e);
            }
            if (i < 0 || i >= earlier.size()) {
                throw new IllegalArgumentException("commit reference " + ref + " must name an earlier commit");
            }
            return earlier.get(i).id();
        }
        if (ref == null || !ChangesetId.isValid(ref)) {
            throw new IllegalArgumentException("not a changeset id: " + ref);
        }
        return new ChangesetId(ref);
    }

    private static String requireParam(String value, String name) {
        if (value == null || value.isBlank()) throw new IllegalArgumentException(name + " is required");
        return value;
    }

    private static PublishResponse toResponse(PublishResult r) {
        PublishResponse dto = new PublishResponse();
        dto.repo = r.repo();
        dto.bookmark = r.bookmark().name();
        dto.head = r.head().map(ChangesetId::hex).orElse(null);
        dto.published = r.published().stream().map(ChangesetId::hex).toList();
        dto.retries = r.retries();
        dto.mirrors = new ArrayList<>();
        for (BookmarkMirror m : r.mirrors()) {
            PublishResponse.Mirror out = new PublishResponse.Mirror();
            out.repo = m.repo();
            out.bookmark = m.bookmark().name();
            out.target = m.target().map(ChangesetId::hex).orElse(null);
            dto.mirrors.add(out);
        }
        return dto;
    }
}
