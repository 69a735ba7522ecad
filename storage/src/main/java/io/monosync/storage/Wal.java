// file: storage/src/main/java/io/monosync/storage/Wal.java
package io.monosync.storage;

/**
 * Write-ahead log backing every durable store.
 * <p>
 * Contract:
 *  - append() is atomic at record granularity: a partially written record is
 *    treated as absent during recovery (the reader stops at the first corrupt
 *    or truncated record).
 *  - append() must make the record durable before returning, so a store that
 *    acknowledged a write will see it again after a crash.
 */
public interface Wal extends AutoCloseable {

    /**
     * Append one framed record and make it durable.
     *
     * @param serializedRecord header+payload bytes from {@link RecordCodec#frame(byte[])}
     */
    void append(byte[] serializedRecord);

    /** Start a new segment if the current one is over its size threshold. */
    void rotateIfNeeded();

    /**
     * Open a sequential reader over every record, oldest first. The reader stops
     * at end of log or at the first corrupt or truncated record.
     */
    WalReader openReader();

    interface WalReader extends AutoCloseable {

        /** Next valid payload (header stripped), or null at end of log or torn tail. */
        byte[] next();
    }
}
