// file: storage/src/main/java/io/monosync/storage/RecordCodec.java
package io.monosync.storage;

import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.zip.CRC32;

/**
 * Binary framing for WAL records, plus the little-endian primitives store
 * payloads are written with.
 * <p>
 * On-disk layout of one record:
 * <p>
 *   [HEADER (11 bytes, little-endian)]
 *     - magic   (2B)  = 0x4D53
 *     - version (1B)  = 1
 *     - length  (4B)  = payload length in bytes
 *     - crc32   (4B)  = CRC32(payload)
 * <p>
 *   [PAYLOAD (length bytes)]
 *     store-specific; strings and byte arrays are int32 length + bytes,
 *     with length -1 meaning null.
 */
final class RecordCodec {
    static final short MAGIC = (short) 0x4D53;
    static final byte VERSION = 1;
    static final int HEADER_BYTES = 2 + 1 + 4 + 4;

    private RecordCodec() {
    }

    /** Prefix a payload with its header. */
    static byte[] frame(byte[] payload) {
        ByteBuffer out = ByteBuffer.allocate(HEADER_BYTES + payload.length).order(ByteOrder.LITTLE_ENDIAN);
        out.putShort(MAGIC).put(VERSION).putInt(payload.length).putInt(crc32(payload));
        out.put(payload);
        return out.array();
    }

    /**
     * Validate a framed record and return its payload.
     *
     * @throws IllegalArgumentException on a bad header, length or checksum
     */
    static byte[] unframe(byte[] record) {
        if (record.length < HEADER_BYTES) {
            throw new IllegalArgumentException("record shorter than header");
        }
        ByteBuffer hdr = ByteBuffer.wrap(record, 0, HEADER_BYTES).order(ByteOrder.LITTLE_ENDIAN);
        short magic = hdr.getShort();
        byte ver = hdr.get();
        int len = hdr.getInt();
        int crc = hdr.getInt();
        if (magic != MAGIC || ver != VERSION || len != record.length - HEADER_BYTES) {
            throw new IllegalArgumentException("bad record header");
        }
        byte[] payload = Arrays.copyOfRange(record, HEADER_BYTES, record.length);
        if (crc32(payload) != crc) {
            throw new IllegalArgumentException("record checksum mismatch");
        }
        return payload;
    }

    static int crc32(byte[] bytes) {
        CRC32 crc = new CRC32();
        crc.update(bytes, 0, bytes.length);
        return (int) crc.getValue();
    }

    /** Growable little-endian payload builder. */
    static final class PayloadWriter {
        private ByteBuffer buf = ByteBuffer.allocate(128).order(ByteOrder.LITTLE_ENDIAN);

        PayloadWriter putByte(byte b) {
            ensure(1);
            buf.put(b);
            return this;
        }

        PayloadWriter putInt(int v) {
            ensure(4);
            buf.putInt(v);
            return this;
        }

        PayloadWriter putLong(long v) {
            ensure(8);
            buf.putLong(v);
            return this;
        }

        PayloadWriter putBytes(byte[] data) {
            if (data == null) {
                return putInt(-1);
            }
            ensure(4 + data.length);
            buf.putInt(data.length).put(data);
            return this;
        }

        PayloadWriter putString(String s) {
            return putBytes(s == null ? null : s.getBytes(StandardCharsets.UTF_8));
        }

        byte[] toByteArray() {
            return Arrays.copyOf(buf.array(), buf.position());
        }

        private void ensure(int extra) {
            if (buf.remaining() >= extra) return;
            int cap = Math.max(buf.capacity() * 2, buf.position() + extra);
            ByteBuffer bigger = ByteBuffer.allocate(cap).order(ByteOrder.LITTLE_ENDIAN);
            buf.flip();
            bigger.put(buf);
            buf = bigger;
        }
    }

    /** Sequential reader over a payload written by {@link PayloadWriter}. */
    static final class PayloadReader {
        private final ByteBuffer b;

        PayloadReader(byte[] payload) {
            this.b = ByteBuffer.wrap(payload).order(ByteOrder.LITTLE_ENDIAN);
        }

        byte getByte() {
            return b.get();
        }

        int getInt() {
            return b.getInt();
        }

        long getLong() {
            return b.getLong();
        }

        byte[] getBytes() {
            int len = b.getInt();
            if (len == -1) return null;
            byte[] out = new byte[len];
            b.get(out);
            return out;
        }

        String getString() {
            byte[] s = getBytes();
            return s == null ? null : new String(s, StandardCharsets.UTF_8);
        }

        String getRequiredString() {
            String s = getString();
            if (s == null) throw new IllegalStateException("unexpected null string in record");
            return s;
        }
    }
}
