// file: server/src/main/java/io/monosync/server/dto/BookmarkListResponse.java
package io.monosync.server.dto;

import java.util.List;

public class BookmarkListResponse {
    public String repo;
    public List<Entry> bookmarks;

    public static class Entry {
        public String name;
        public String target;
    }
}
