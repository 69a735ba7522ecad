// file: storage/src/main/java/io/monosync/storage/Bookmark.java
package io.monosync.storage;

import io.monosync.core.BookmarkName;
import io.monosync.core.ChangesetId;

/** A bookmark's current value, as returned by listings. */
public record Bookmark(BookmarkName name, ChangesetId target) {}
