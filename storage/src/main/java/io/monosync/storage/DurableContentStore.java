// file: storage/src/main/java/io/monosync/storage/DurableContentStore.java
package io.monosync.storage;

import io.monosync.core.ContentId;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/** WAL-backed {@link ContentStore}; record payload is the raw blob. */
public class DurableContentStore extends WalBackedStore implements ContentStore {

    private final Map<ContentId, byte[]> mem = new ConcurrentHashMap<>();

    public DurableContentStore(Wal wal) {
        super(wal);
        recover();
    }

    @Override
    public synchronized ContentId put(byte[] content) {
        ContentId id = ContentId.of(content);
        if (!mem.containsKey(id)) {
            logAndApply(new RecordCodec.PayloadWriter().putBytes(content).toByteArray());
        }
        return id;
    }

    @Override
    protected void apply(RecordCodec.PayloadReader record) {
        byte[] blob = record.getBytes();
        mem.putIfAbsent(ContentId.of(blob), blob);
    }

    @Override
    public Optional<byte[]> get(ContentId id) {
        byte[] blob = mem.get(id);
        return blob == null ? Optional.empty() : Optional.of(blob.clone());
    }

    @Override
    public boolean exists(ContentId id) {
        return mem.containsKey(id);
    }
}
