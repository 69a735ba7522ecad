// file: server/src/main/java/io/monosync/server/repo/Storage.java
package io.monosync.server.repo;

import io.monosync.storage.FileWal;
import io.monosync.storage.MemoryWal;
import io.monosync.storage.Wal;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Hands out one WAL per store, either as segment files under a data directory
 * or in memory, and closes them all on shutdown.
 */
public final class Storage implements AutoCloseable {
    private static final Logger LOG = Logger.getLogger(Storage.class.getName());

    /** Segment size before rotation (~64MB). */
    public static final long ROTATE_BYTES = 64L * 1024 * 1024;

    private final Path dataDir; // null = in-memory
    private final List<Wal> opened = new ArrayList<>();

    private Storage(Path dataDir) {
        this.dataDir = dataDir;
    }

    public static Storage durable(Path dataDir) {
        return new Storage(dataDir);
    }

    public static Storage inMemory() {
        return new Storage(null);
    }

    /** WAL for the store named {@code name}, e.g. "bookmarks" or "repos/0/changesets". */
    public synchronized Wal wal(String name) {
        Wal wal = dataDir == null ? new MemoryWal() : new FileWal(dataDir.resolve(name), ROTATE_BYTES);
        opened.add(wal);
        return wal;
    }

    public boolean isDurable() {
        return dataDir != null;
    }

    @Override
    public synchronized void close() {
        for (Wal wal : opened) {
            try {
                wal.close();
            } catch (Exception e) {
                LOG.log(Level.WARNING, "failed to close WAL", e);
            }
        }
        opened.clear();
    }
}
