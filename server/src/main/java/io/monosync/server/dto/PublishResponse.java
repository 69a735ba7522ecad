// file: server/src/main/java/io/monosync/server/dto/PublishResponse.java
package io.monosync.server.dto;

import java.util.List;

/** Response for pushes and bookmark updates. head is null once a bookmark is deleted. */
public class PublishResponse {
    public String repo;
    public String bookmark;
    public String head;
    public List<String> published;
    public int retries;
    public List<Mirror> mirrors;

    public static class Mirror {
        public String repo;
        public String bookmark;
        public String target;
    }
}
