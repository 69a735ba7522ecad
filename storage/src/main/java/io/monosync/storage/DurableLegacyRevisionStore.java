// file: storage/src/main/java/io/monosync/storage/DurableLegacyRevisionStore.java
package io.monosync.storage;

import io.monosync.core.ChangesetId;
import io.monosync.core.RepositoryId;

import java.util.Map;
import java.util.Optional;
import java.util.OptionalLong;
import java.util.concurrent.ConcurrentHashMap;

/**
 * WAL-backed {@link LegacyRevisionStore}.
 * <p>
 * Record payload: repo (int32), revision (int64), id (string).
 */
public class DurableLegacyRevisionStore extends WalBackedStore implements LegacyRevisionStore {

    private record Key(RepositoryId repo, ChangesetId id) {}

    private record RevKey(RepositoryId repo, long revision) {}

    private final Map<Key, Long> forward = new ConcurrentHashMap<>();
    private final Map<RevKey, ChangesetId> reverse = new ConcurrentHashMap<>();
    private final Map<RepositoryId, Long> latest = new ConcurrentHashMap<>();

    public DurableLegacyRevisionStore(Wal wal) {
        super(wal);
        recover();
    }

    @Override
    public synchronized long assign(RepositoryId repo, ChangesetId id) {
        Long existing = forward.get(new Key(repo, id));
        if (existing != null) {
            return existing;
        }
        long next = latest(repo) + 1;
        logAndApply(new RecordCodec.PayloadWriter()
                .putInt(repo.id())
                .putLong(next)
                .putString(id.hex())
                .toByteArray());
        return next;
    }

    @Override
    protected void apply(RecordCodec.PayloadReader record) {
        RepositoryId repo = new RepositoryId(record.getInt());
        long rev = record.getLong();
        ChangesetId id = new ChangesetId(record.getRequiredString());
        forward.put(new Key(repo, id), rev);
        reverse.put(new RevKey(repo, rev), id);
        latest.merge(repo, rev, Math::max);
    }

    @Override
    public OptionalLong get(RepositoryId repo, ChangesetId id) {
        Long rev = forward.get(new Key(repo, id));
        return rev == null ? OptionalLong.empty() : OptionalLong.of(rev);
    }

    @Override
    public Optional<ChangesetId> byRevision(RepositoryId repo, long revision) {
        return Optional.ofNullable(reverse.get(new RevKey(repo, revision)));
    }

    @Override
    public long latest(RepositoryId repo) {
        return latest.getOrDefault(repo, 0L);
    }
}
