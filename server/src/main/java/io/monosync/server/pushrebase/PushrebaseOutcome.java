// file: server/src/main/java/io/monosync/server/pushrebase/PushrebaseOutcome.java
package io.monosync.server.pushrebase;

import io.monosync.core.BookmarkName;
import io.monosync.core.Changeset;
import io.monosync.core.ChangesetId;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Result of a successful pushrebase.
 *
 * @param oldHead  bookmark value the publish swapped away from (empty if it was created)
 * @param newHead  bookmark value after the push; equals oldHead when nothing was new
 * @param rebased  commits published by this push, ancestors first
 * @param oldToNew pushed commit id to published commit id
 * @param retries  number of times the bookmark moved under us before the swap won
 */
public record PushrebaseOutcome(
        BookmarkName bookmark,
        Optional<ChangesetId> oldHead,
        ChangesetId newHead,
        List<Changeset> rebased,
        Map<ChangesetId, ChangesetId> oldToNew,
        int retries
) {
    public PushrebaseOutcome {
        rebased = List.copyOf(rebased);
        oldToNew = Map.copyOf(oldToNew);
    }

    public boolean moved() {
        return oldHead.isEmpty() || !oldHead.get().equals(newHead);
    }
}
