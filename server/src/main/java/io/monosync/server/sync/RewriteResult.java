// file: server/src/main/java/io/monosync/server/sync/RewriteResult.java
package io.monosync.server.sync;

import io.monosync.core.Changeset;
import io.monosync.core.ChangesetId;

import java.util.Objects;
import java.util.Optional;

/** Outcome of rewriting one commit into the other repository's namespace. */
public sealed interface RewriteResult permits RewriteResult.Rewritten, RewriteResult.Skipped {

    /** The target-namespace commit. Not yet stored. */
    record Rewritten(Changeset changeset) implements RewriteResult {
        public Rewritten {
            Objects.requireNonNull(changeset, "changeset");
        }
    }

    /**
     * Nothing of the commit is visible in the target repository. The working
     * copy there equals {@code equivalent} (empty if nothing exists yet).
     */
    record Skipped(Optional<ChangesetId> equivalent) implements RewriteResult {
        public Skipped {
            Objects.requireNonNull(equivalent, "equivalent");
        }
    }
}
