// file: server/src/main/java/io/monosync/server/sync/BookmarkMirror.java
package io.monosync.server.sync;

import io.monosync.core.BookmarkName;
import io.monosync.core.ChangesetId;

import java.util.Optional;

/** Where a bookmark ended up in a counterpart repository; empty target means deleted. */
public record BookmarkMirror(String repo, BookmarkName bookmark, Optional<ChangesetId> target) {}
