// file: storage/src/main/java/io/monosync/storage/DurableBookmarkStore.java
package io.monosync.storage;

import io.monosync.core.BookmarkName;
import io.monosync.core.ChangesetId;
import io.monosync.core.RepositoryId;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.NavigableMap;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentSkipListMap;
import java.util.logging.Logger;

/**
 * WAL-backed {@link BookmarkStore}.
 * <p>
 * Record payload:
 *  - op:     byte ('S' = set, 'D' = delete)
 *  - repo:   int32
 *  - name:   string
 *  - target: string (hex id; null for delete)
 * <p>
 * CAS is checked and applied under the store monitor, after the record is
 * durable, so a swap that returned true survives a crash.
 */
public class DurableBookmarkStore extends WalBackedStore implements BookmarkStore {
    private static final Logger LOG = Logger.getLogger(DurableBookmarkStore.class.getName());

    private static final byte SET = 'S';
    private static final byte DELETE = 'D';

    private final Map<RepositoryId, NavigableMap<String, ChangesetId>> mem = new ConcurrentHashMap<>();

    public DurableBookmarkStore(Wal wal) {
        super(wal);
        recover();
    }

    @Override
    public Optional<ChangesetId> read(RepositoryId repo, BookmarkName name) {
        return Optional.ofNullable(repoMap(repo).get(name.name()));
    }

    @Override
    public synchronized boolean compareAndSwap(RepositoryId repo, BookmarkName name,
                                               Optional<ChangesetId> expected, ChangesetId newTarget) {
        Objects.requireNonNull(newTarget, "newTarget");
        Optional<ChangesetId> current = read(repo, name);
        if (!current.equals(expected)) {
            LOG.fine(() -> "CAS miss on " + repo + "/" + name + ": expected " + expected + ", found " + current);
            return false;
        }
        logAndApply(record(SET, repo, name, newTarget));
        return true;
    }

    @Override
    public synchronized boolean delete(RepositoryId repo, BookmarkName name, ChangesetId expected) {
        Optional<ChangesetId> current = read(repo, name);
        if (current.isEmpty() || !current.get().equals(expected)) {
            return false;
        }
        logAndApply(record(DELETE, repo, name, null));
        return true;
    }

    @Override
    public List<Bookmark> list(RepositoryId repo, String prefix, int limit) {
        if (limit < 0) throw new IllegalArgumentException("limit must be >= 0");
        // Names sharing a prefix are contiguous in name order.
        List<Bookmark> out = new ArrayList<>();
        for (Map.Entry<String, ChangesetId> e : repoMap(repo).tailMap(prefix, true).entrySet()) {
            if (out.size() >= limit || !e.getKey().startsWith(prefix)) break;
            out.add(new Bookmark(BookmarkName.of(e.getKey()), e.getValue()));
        }
        return out;
    }

    @Override
    protected void apply(RecordCodec.PayloadReader record) {
        byte op = record.getByte();
        RepositoryId repo = new RepositoryId(record.getInt());
        BookmarkName name = BookmarkName.of(record.getRequiredString());
        String target = record.getString();
        if (op == SET) {
            repoMap(repo).put(name.name(), new ChangesetId(target));
        } else if (op == DELETE) {
            repoMap(repo).remove(name.name());
        } else {
            throw new IllegalStateException("unknown bookmark record op: " + op);
        }
    }

    private static byte[] record(byte op, RepositoryId repo, BookmarkName name, ChangesetId target) {
        return new RecordCodec.PayloadWriter()
                .putByte(op)
                .putInt(repo.id())
                .putString(name.name())
                .putString(target == null ? null : target.hex())
                .toByteArray();
    }

    private NavigableMap<String, ChangesetId> repoMap(RepositoryId repo) {
        return mem.computeIfAbsent(repo, r -> new ConcurrentSkipListMap<>());
    }
}
