// file: core/src/main/java/io/monosync/core/FileType.java
package io.monosync.core;

/** Kind of file a {@link FileChange.Modified} produces. Stored as a single byte. */
public enum FileType {
    REGULAR((byte) 'r'),
    EXECUTABLE((byte) 'x'),
    SYMLINK((byte) 'l');

    private final byte code;

    FileType(byte code) {
        this.code = code;
    }

    public byte code() {
        return code;
    }

    public static FileType fromCode(byte code) {
        for (FileType t : values()) {
            if (t.code == code) return t;
        }
        throw new IllegalArgumentException("unknown file type code: " + code);
    }
}
