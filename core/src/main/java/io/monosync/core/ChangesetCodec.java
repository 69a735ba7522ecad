// file: core/src/main/java/io/monosync/core/ChangesetCodec.java
package io.monosync.core;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.DataInputStream;
import java.io.DataOutputStream;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Canonical binary form of a {@link Changeset}. The changeset id is the SHA-256
 * of these bytes, and the storage layer persists exactly these bytes.
 * <p>
 * Layout (big-endian):
 * <p>
 *   - tag:       "monosync-changeset-v1" (int32 len + UTF-8)
 *   - parents:   int32 count, then 32 raw bytes each, in order
 *   - changes:   int32 count, then per path (sorted):
 *       - path:      int32 len + UTF-8
 *       - kind:      byte, 'D' deleted or 'M' modified
 *       - if 'M':    content (32B), file type (1B), size (int64),
 *                    hasCopy (1B), then copy path + copy changeset (32B) if set
 *   - author:    int32 len + UTF-8
 *   - date:      int64 epoch seconds, int32 tz offset
 *   - message:   int32 len + UTF-8
 *   - extras:    int32 count, then per key (sorted): key string, int32 len + bytes
 */
public final class ChangesetCodec {

    private static final String TAG = "monosync-changeset-v1";

    private ChangesetCodec() {
        // utility
    }

    public static byte[] encode(Changeset cs) {
        var buf = new ByteArrayOutputStream(256);
        try (var out = new DataOutputStream(buf)) {
            writeString(out, TAG);

            out.writeInt(cs.parents().size());
            for (ChangesetId p : cs.parents()) {
                out.write(p.toBytes());
            }

            out.writeInt(cs.fileChanges().size());
            for (Map.Entry<MPath, FileChange> e : cs.fileChanges().entrySet()) {
                writeString(out, e.getKey().toString());
                if (e.getValue() instanceof FileChange.Modified m) {
                    out.writeByte('M');
                    out.write(m.content().toBytes());
                    out.writeByte(m.type().code());
                    out.writeLong(m.size());
                    if (m.copyFrom() == null) {
                        out.writeBoolean(false);
                    } else {
                        out.writeBoolean(true);
                        writeString(out, m.copyFrom().path().toString());
                        out.write(m.copyFrom().changeset().toBytes());
                    }
                } else {
                    out.writeByte('D');
                }
            }

            writeString(out, cs.author());
            out.writeLong(cs.date().epochSeconds());
            out.writeInt(cs.date().tzOffsetSeconds());
            writeString(out, cs.message());

            Map<String, byte[]> extras = cs.extras();
            out.writeInt(extras.size());
            for (Map.Entry<String, byte[]> e : extras.entrySet()) {
                writeString(out, e.getKey());
                out.writeInt(e.getValue().length);
                out.write(e.getValue());
            }
        } catch (IOException e) {
            throw new UncheckedIOException("changeset encoding failed", e);
        }
        return buf.toByteArray();
    }

    /** Decode bytes produced by {@link #encode(Changeset)}. */
    public static Changeset decode(byte[] bytes) {
        try (var in = new DataInputStream(new ByteArrayInputStream(bytes))) {
            String tag = readString(in);
            if (!TAG.equals(tag)) {
                throw new IllegalArgumentException("unknown changeset encoding: " + tag);
            }

            int parentCount = in.readInt();
            List<ChangesetId> parents = new ArrayList<>(parentCount);
            for (int i = 0; i < parentCount; i++) {
                parents.add(ChangesetId.fromBytes(in.readNBytes(ChangesetId.BYTES)));
            }

            int changeCount = in.readInt();
            Map<MPath, FileChange> changes = new LinkedHashMap<>(changeCount * 2);
            for (int i = 0; i < changeCount; i++) {
                MPath path = MPath.of(readString(in));
                byte kind = in.readByte();
                if (kind == 'D') {
                    changes.put(path, FileChange.deleted());
                } else if (kind == 'M') {
                    ContentId content = ContentId.fromBytes(in.readNBytes(ContentId.BYTES));
                    FileType type = FileType.fromCode(in.readByte());
                    long size = in.readLong();
                    FileChange.CopyFrom copy = null;
                    if (in.readBoolean()) {
                        MPath copyPath = MPath.of(readString(in));
                        copy = new FileChange.CopyFrom(copyPath, ChangesetId.fromBytes(in.readNBytes(ChangesetId.BYTES)));
                    }
                    changes.put(path, new FileChange.Modified(content, type, size, copy));
                } else {
                    throw new IllegalArgumentException("unknown file change kind: " + kind);
                }
            }

            String author = readString(in);
            DateTime date = new DateTime(in.readLong(), in.readInt());
            String message = readString(in);

            int extraCount = in.readInt();
            Map<String, byte[]> extras = new TreeMap<>();
            for (int i = 0; i < extraCount; i++) {
                String key = readString(in);
                int len = in.readInt();
                extras.put(key, in.readNBytes(len));
            }
            return new Changeset(parents, changes, author, date, message, extras);
        } catch (IOException e) {
            throw new IllegalArgumentException("truncated changeset encoding", e);
        }
    }

    private static void writeString(DataOutputStream out, String s) throws IOException {
        byte[] b = s.getBytes(StandardCharsets.UTF_8);
        out.writeInt(b.length);
        out.write(b);
    }

    private static String readString(DataInputStream in) throws IOException {
        int len = in.readInt();
        if (len < 0) throw new IOException("negative string length");
        byte[] b = in.readNBytes(len);
        if (b.length < len) throw new IOException("truncated string");
        return new String(b, StandardCharsets.UTF_8);
    }
}
