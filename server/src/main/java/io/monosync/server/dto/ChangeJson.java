// file: server/src/main/java/io/monosync/server/dto/ChangeJson.java
package io.monosync.server.dto;

/**
 * A file change: either {"deleted": true} or new content with an optional
 * type ("regular" default, "executable", "symlink") and copy source.
 */
public class ChangeJson {
    public boolean deleted;
    public String contentBase64;
    public String type;
    public CopyFromJson copyFrom;

    public static class CopyFromJson {
        public String path;
        public String commit; // hex id or "#i"
    }
}
