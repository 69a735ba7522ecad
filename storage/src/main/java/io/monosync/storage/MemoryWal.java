// file: storage/src/main/java/io/monosync/storage/MemoryWal.java
package io.monosync.storage;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;

/**
 * Volatile WAL for in-memory mode and tests. Records live as long as the
 * instance, so a store rebuilt from the same MemoryWal sees every earlier
 * append, which is enough to exercise recovery without touching disk.
 */
public final class MemoryWal implements Wal {
    private final List<byte[]> records = new ArrayList<>();

    @Override
    public synchronized void append(byte[] serializedRecord) {
        records.add(serializedRecord.clone());
    }

    @Override
    public void rotateIfNeeded() {
        // single segment
    }

    @Override
    public synchronized WalReader openReader() {
        Iterator<byte[]> it = List.copyOf(records).iterator();
        return new WalReader() {
            @Override
            public byte[] next() {
                return it.hasNext() ? RecordCodec.unframe(it.next()) : null;
            }

            @Override
            public void close() {
            }
        };
    }

    public synchronized int size() {
        return records.size();
    }

    @Override
    public void close() {
    }
}
