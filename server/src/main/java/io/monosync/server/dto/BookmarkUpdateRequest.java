// file: server/src/main/java/io/monosync/server/dto/BookmarkUpdateRequest.java
package io.monosync.server.dto;

/**
 * JSON body for PUT /repos/{repo}/bookmarks/{name}.
 * Both fields take any identifier; omit "expected" to create a new bookmark.
 */
public class BookmarkUpdateRequest {
    public String target;
    public String expected;
}
