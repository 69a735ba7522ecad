// file: storage/src/test/java/io/monosync/storage/RecordCodecTest.java
package io.monosync.storage;

import org.junit.jupiter.api.Test;

import java.nio.ByteBuffer;
import java.nio.ByteOrder;

import static org.junit.jupiter.api.Assertions.*;

class RecordCodecTest {

    @Test
    void frame_writes_header_with_length_and_crc() {
        byte[] payload = new RecordCodec.PayloadWriter()
                .putByte((byte) 'S')
                .putInt(7)
                .putString("main")
                .putString(null)
                .toByteArray();

        byte[] framed = RecordCodec.frame(payload);

        ByteBuffer hdr = ByteBuffer.wrap(framed, 0, RecordCodec.HEADER_BYTES).order(ByteOrder.LITTLE_ENDIAN);
        assertEquals(RecordCodec.MAGIC, hdr.getShort());
        assertEquals(RecordCodec.VERSION, hdr.get());
        assertEquals(payload.length, hdr.getInt());
        assertEquals(RecordCodec.crc32(payload), hdr.getInt());

        var r = new RecordCodec.PayloadReader(RecordCodec.unframe(framed));
        assertEquals('S', r.getByte());
        assertEquals(7, r.getInt());
        assertEquals("main", r.getString());
        assertNull(r.getString());
    }

    @Test
    void unframe_rejects_flipped_payload_bit() {
        byte[] framed = RecordCodec.frame(new byte[]{1, 2, 3, 4});
        framed[framed.length - 1] ^= 0x01;

        assertThrows(IllegalArgumentException.class, () -> RecordCodec.unframe(framed));
    }

    @Test
    void writer_grows_past_its_initial_buffer() {
        byte[] big = new byte[10_000];
        big[9_999] = 42;

        var r = new RecordCodec.PayloadReader(new RecordCodec.PayloadWriter().putLong(1L).putBytes(big).toByteArray());

        assertEquals(1L, r.getLong());
        assertArrayEquals(big, r.getBytes());
    }
}
