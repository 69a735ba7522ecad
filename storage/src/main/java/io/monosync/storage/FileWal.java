// file: storage/src/main/java/io/monosync/storage/FileWal.java
package io.monosync.storage;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.channels.FileChannel;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.logging.Logger;
import java.util.stream.Collectors;
import java.util.stream.Stream;

import static java.nio.file.StandardOpenOption.CREATE;
import static java.nio.file.StandardOpenOption.READ;
import static java.nio.file.StandardOpenOption.WRITE;

/**
 * File-backed WAL that appends framed records to numbered segment files
 * ("00000001.log", "00000002.log", ...).
 * <p>
 * On construction it:
 *  - creates the directory if needed,
 *  - opens the newest segment (or creates the first one),
 *  - cuts off a torn tail left by a crash, so later appends are not hidden
 *    behind garbage.
 * <p>
 * append() writes the bytes and calls force(true). rotateIfNeeded() moves to
 * a new segment once the current one holds at least {@code rotateBytes}.
 * <p>
 * The reader walks all segments in order and stops at the first truncated
 * header/payload or bad CRC.
 */
public class FileWal implements Wal {
    private static final Logger LOG = Logger.getLogger(FileWal.class.getName());

    private final Path dir;
    private final long rotateBytes;
    private FileChannel ch;
    private Path current;
    private long writtenInSegment = 0;

    public FileWal(Path dir, long rotateBytes) {
        this.dir = dir;
        this.rotateBytes = rotateBytes;
        try {
            Files.createDirectories(dir);
        } catch (IOException e) {
            throw new UncheckedIOException("cannot create WAL directory " + dir, e);
        }
        openNewestOrCreate();
    }

    @Override
    public synchronized void append(byte[] serializedRecord) {
        try {
            ByteBuffer buf = ByteBuffer.wrap(serializedRecord);
            while (buf.hasRemaining()) {
                ch.write(buf);
            }
            ch.force(true);
            writtenInSegment += serializedRecord.length;
        } catch (IOException e) {
            throw new UncheckedIOException("WAL append failed in " + current, e);
        }
    }

    @Override
    public synchronized void rotateIfNeeded() {
        if (writtenInSegment < rotateBytes) return;
        try {
            ch.close();
            current = dir.resolve(segmentName(segmentIndex(current) + 1));
            ch = FileChannel.open(current, CREATE, WRITE, READ);
            writtenInSegment = 0;
            LOG.fine(() -> "rotated WAL to " + current);
        } catch (IOException e) {
            throw new UncheckedIOException("WAL rotation failed in " + dir, e);
        }
    }

    @Override
    public WalReader openReader() {
        return new Reader(segments(dir));
    }

    @Override
    public synchronized void close() throws IOException {
        if (ch != null) ch.close();
    }

    private void openNewestOrCreate() {
        try {
            List<Path> segs = segments(dir);
            current = segs.isEmpty() ? dir.resolve(segmentName(1)) : segs.get(segs.size() - 1);
            ch = FileChannel.open(current, CREATE, WRITE, READ);
            long valid = validPrefixLength(ch);
            if (valid < ch.size()) {
                LOG.warning("truncating torn WAL tail in " + current + " at offset " + valid
                        + " (file size " + ch.size() + ")");
                ch.truncate(valid);
                ch.force(true);
            }
            writtenInSegment = valid;
            ch.position(valid);
        } catch (IOException e) {
            throw new UncheckedIOException("cannot open WAL in " + dir, e);
        }
    }

    static List<Path> segments(Path dir) {
        try (Stream<Path> files = Files.list(dir)) {
            return files.filter(p -> p.getFileName().toString().endsWith(".log"))
                    .sorted()
                    .collect(Collectors.toList());
        } catch (IOException e) {
            throw new UncheckedIOException("cannot list WAL segments in " + dir, e);
        }
    }

    private static String segmentName(int index) {
        return String.format("%08d.log", index);
    }

    private static int segmentIndex(Path segment) {
        return Integer.parseInt(segment.getFileName().toString().replace(".log", ""));
    }

    /** Offset just past the last intact record of a segment. */
    private static long validPrefixLength(FileChannel ch) throws IOException {
        long pos = 0;
        while (true) {
            byte[] payload = readRecord(ch, pos);
            if (payload == null) return pos;
            pos += RecordCodec.HEADER_BYTES + payload.length;
        }
    }

    /** Payload of the record at {@code pos}, or null if absent, truncated or corrupt. */
    private static byte[] readRecord(FileChannel ch, long pos) throws IOException {
        ByteBuffer hdr = ByteBuffer.allocate(RecordCodec.HEADER_BYTES).order(ByteOrder.LITTLE_ENDIAN);
        int read = ch.read(hdr, pos);
        if (read < RecordCodec.HEADER_BYTES) return null; // EOF or truncated header
        hdr.flip();
        short magic = hdr.getShort();
        byte ver = hdr.get();
        int len = hdr.getInt();
        int crc = hdr.getInt();
        if (magic != RecordCodec.MAGIC || ver != RecordCodec.VERSION || len < 0) return null;
        if (pos + RecordCodec.HEADER_BYTES + len > ch.size()) return null; // truncated payload
        ByteBuffer payload = ByteBuffer.allocate(len);
        while (payload.hasRemaining()) {
            int r = ch.read(payload, pos + RecordCodec.HEADER_BYTES + payload.position());
            if (r <= 0) return null;
        }
        byte[] bytes = payload.array();
        if (RecordCodec.crc32(bytes) != crc) return null;
        return bytes;
    }

    private static final class Reader implements WalReader {
        private final Deque<Path> pending;
        private FileChannel ch;
        private long pos = 0;
        private boolean stopped = false;

        Reader(List<Path> segments) {
            this.pending = new ArrayDeque<>(segments);
        }

        @Override
        public byte[] next() {
            try {
                while (!stopped) {
                    if (ch == null) {
                        Path seg = pending.pollFirst();
                        if (seg == null) return null;
                        ch = FileChannel.open(seg, READ);
                        pos = 0;
                    }
                    byte[] payload = readRecord(ch, pos);
                    if (payload != null) {
                        pos += RecordCodec.HEADER_BYTES + payload.length;
                        return payload;
                    }
                    if (pos < ch.size()) {
                        stopped = true; // corrupt record: nothing after it is trusted
                    }
                    ch.close();
                    ch = null;
                }
                return null;
            } catch (IOException e) {
                throw new UncheckedIOException("WAL read failed", e);
            }
        }

        @Override
        public void close() throws IOException {
            if (ch != null) ch.close();
        }
    }
}
