// file: storage/src/main/java/io/monosync/storage/DurableAltHashStore.java
package io.monosync.storage;

import io.monosync.core.AltHash;
import io.monosync.core.ChangesetId;
import io.monosync.core.RepositoryId;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/** WAL-backed {@link AltHashStore}. Record payload: repo (int32), id, hash (strings). */
public class DurableAltHashStore extends WalBackedStore implements AltHashStore {

    private record Key(RepositoryId repo, ChangesetId id) {}

    private record HashKey(RepositoryId repo, AltHash hash) {}

    private final Map<Key, AltHash> forward = new ConcurrentHashMap<>();
    private final Map<HashKey, ChangesetId> reverse = new ConcurrentHashMap<>();

    public DurableAltHashStore(Wal wal) {
        super(wal);
        recover();
    }

    @Override
    public synchronized void put(RepositoryId repo, ChangesetId id, AltHash hash) {
        AltHash existing = forward.get(new Key(repo, id));
        if (existing != null) {
            if (!existing.equals(hash)) {
                throw new IllegalStateException("commit " + id + " already has alternate hash " + existing
                        + ", refusing " + hash);
            }
            return;
        }
        ChangesetId owner = reverse.get(new HashKey(repo, hash));
        if (owner != null) {
            throw new IllegalStateException("alternate hash " + hash + " already belongs to " + owner);
        }
        logAndApply(new RecordCodec.PayloadWriter()
                .putInt(repo.id())
                .putString(id.hex())
                .putString(hash.hex())
                .toByteArray());
    }

    @Override
    protected void apply(RecordCodec.PayloadReader record) {
        RepositoryId repo = new RepositoryId(record.getInt());
        ChangesetId id = new ChangesetId(record.getRequiredString());
        AltHash hash = new AltHash(record.getRequiredString());
        forward.put(new Key(repo, id), hash);
        reverse.put(new HashKey(repo, hash), id);
    }

    @Override
    public Optional<AltHash> get(RepositoryId repo, ChangesetId id) {
        return Optional.ofNullable(forward.get(new Key(repo, id)));
    }

    @Override
    public Optional<ChangesetId> byHash(RepositoryId repo, AltHash hash) {
        return Optional.ofNullable(reverse.get(new HashKey(repo, hash)));
    }
}
