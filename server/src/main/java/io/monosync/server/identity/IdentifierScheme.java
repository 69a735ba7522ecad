// file: server/src/main/java/io/monosync/server/identity/IdentifierScheme.java
package io.monosync.server.identity;

import io.monosync.core.ChangesetId;
import io.monosync.server.repo.Repo;

import java.util.Optional;

/**
 * One identifier scheme, backed by its own index. The resolver dispatches on
 * {@link #kind()}, so a new scheme is added by registering another
 * implementation.
 */
public interface IdentifierScheme {

    IdentifierKind kind();

    /** Commit named by {@code identifier}, which is of this scheme's kind. */
    Optional<ChangesetId> resolve(Repo repo, Identifier identifier);

    /** This scheme's name for a commit, if it has one. */
    Optional<Identifier> identify(Repo repo, ChangesetId id);
}
