// file: server/src/main/java/io/monosync/server/identity/Schemes.java
package io.monosync.server.identity;

import io.monosync.core.ChangesetId;
import io.monosync.server.derived.AltHashDeriver;
import io.monosync.server.repo.Repo;

import java.util.List;
import java.util.Optional;

/** The built-in identifier schemes. */
public final class Schemes {

    private Schemes() {
    }

    public static List<IdentifierScheme> all(AltHashDeriver altHashes) {
        return List.of(new NativeScheme(), new LegacyRevisionScheme(), new AltHashScheme(altHashes), new BookmarkScheme());
    }

    static final class NativeScheme implements IdentifierScheme {
        @Override
        public IdentifierKind kind() {
            return IdentifierKind.NATIVE;
        }

        @Override
        public Optional<ChangesetId> resolve(Repo repo, Identifier identifier) {
            ChangesetId id = ((Identifier.Native) identifier).id();
            return repo.changesets().exists(id) ? Optional.of(id) : Optional.empty();
        }

        @Override
        public Optional<Identifier> identify(Repo repo, ChangesetId id) {
            return Optional.of(new Identifier.Native(id));
        }
    }

    static final class LegacyRevisionScheme implements IdentifierScheme {
        @Override
        public IdentifierKind kind() {
            return IdentifierKind.LEGACY_REVISION;
        }

        @Override
        public Optional<ChangesetId> resolve(Repo repo, Identifier identifier) {
            long rev = ((Identifier.LegacyRevision) identifier).revision();
            return repo.legacyRevisions().byRevision(repo.id(), rev);
        }

        @Override
        public Optional<Identifier> identify(Repo repo, ChangesetId id) {
            var rev = repo.legacyRevisions().get(repo.id(), id);
            return rev.isPresent() ? Optional.of(new Identifier.LegacyRevision(rev.getAsLong())) : Optional.empty();
        }
    }

    /** Alternate hashes are derived on demand when a commit is identified. */
    static final class AltHashScheme implements IdentifierScheme {
        private final AltHashDeriver deriver;

        AltHashScheme(AltHashDeriver deriver) {
            this.deriver = deriver;
        }

        @Override
        public IdentifierKind kind() {
            return IdentifierKind.ALT_HASH;
        }

        @Override
        public Optional<ChangesetId> resolve(Repo repo, Identifier identifier) {
            return repo.altHashes().byHash(repo.id(), ((Identifier.Alt) identifier).hash());
        }

        @Override
        public Optional<Identifier> identify(Repo repo, ChangesetId id) {
            return Optional.of(new Identifier.Alt(deriver.derive(repo, id)));
        }
    }

    /** Bookmarks resolve to their current target; a commit has no canonical bookmark. */
    static final class BookmarkScheme implements IdentifierScheme {
        @Override
        public IdentifierKind kind() {
            return IdentifierKind.BOOKMARK;
        }

        @Override
        public Optional<ChangesetId> resolve(Repo repo, Identifier identifier) {
            return repo.bookmark(((Identifier.Bookmark) identifier).name());
        }

        @Override
        public Optional<Identifier> identify(Repo repo, ChangesetId id) {
            return Optional.empty();
        }
    }
}
