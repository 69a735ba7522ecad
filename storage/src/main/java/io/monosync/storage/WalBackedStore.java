// file: storage/src/main/java/io/monosync/storage/WalBackedStore.java
package io.monosync.storage;

import java.util.Objects;

/**
 * Shared plumbing of the durable stores: an in-memory index rebuilt from the
 * WAL on startup and kept current on every write.
 * <p>
 * Write path (always under the store's monitor):
 *  1) validate against the in-memory index,
 *  2) append + fsync the record,
 *  3) apply it to memory,
 *  4) rotate the WAL segment if needed.
 * <p>
 * Subclasses call {@link #recover()} at the end of their constructor, once
 * their own index fields exist.
 */
abstract class WalBackedStore implements AutoCloseable {
    private final Wal wal;

    WalBackedStore(Wal wal) {
        this.wal = Objects.requireNonNull(wal, "wal");
    }

    /** Apply one replayed or freshly written record to the in-memory index. */
    protected abstract void apply(RecordCodec.PayloadReader record);

    protected final void recover() {
        try (Wal.WalReader r = wal.openReader()) {
            for (byte[] payload; (payload = r.next()) != null; ) {
                apply(new RecordCodec.PayloadReader(payload));
            }
        } catch (RuntimeException e) {
            throw new IllegalStateException("recovery failed for " + getClass().getSimpleName(), e);
        } catch (Exception e) {
            throw new IllegalStateException("closing WAL reader failed for " + getClass().getSimpleName(), e);
        }
    }

    /** Make a record durable, then apply it. Callers hold the store's monitor. */
    protected final void logAndApply(byte[] payload) {
        wal.append(RecordCodec.frame(payload));
        apply(new RecordCodec.PayloadReader(payload));
        wal.rotateIfNeeded();
    }

    @Override
    public void close() throws Exception {
        wal.close();
    }
}
