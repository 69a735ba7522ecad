// file: server/src/main/java/io/monosync/server/dto/DiffResponse.java
package io.monosync.server.dto;

import java.util.List;

public class DiffResponse {
    public String base;
    public String other;
    public List<Entry> entries;

    public static class Entry {
        public String path;
        public String kind;
        public String from;     // MOVED / COPIED only
        public boolean binary;
        public String summary;
    }
}
