// file: server/src/main/java/io/monosync/server/sync/PublishResult.java
package io.monosync.server.sync;

import io.monosync.core.BookmarkName;
import io.monosync.core.ChangesetId;

import java.util.List;
import java.util.Optional;

/**
 * What a push or bookmark update did, from the caller's repository's point of view.
 *
 * @param head      the bookmark's value in the caller's repository afterwards
 * @param published ids of commits newly published in the repository that was pushed into
 *                  (the large repo, for pushes to a small repo)
 * @param mirrors   the bookmark's counterparts in other repositories
 */
public record PublishResult(
        String repo,
        BookmarkName bookmark,
        Optional<ChangesetId> head,
        List<ChangesetId> published,
        int retries,
        List<BookmarkMirror> mirrors
) {
    public PublishResult {
        published = List.copyOf(published);
        mirrors = List.copyOf(mirrors);
    }
}
