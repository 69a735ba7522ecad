// file: server/src/main/java/io/monosync/server/identity/IdentifierResolver.java
package io.monosync.server.identity;

import io.monosync.core.ChangesetId;
import io.monosync.core.NotFoundException;
import io.monosync.server.repo.Repo;

import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Resolves any {@link Identifier} to a native changeset id, and converts
 * between schemes.
 * <p>
 * Every scheme is globally unique by construction, so resolution either finds
 * exactly one commit or fails with {@link NotFoundException}.
 */
public final class IdentifierResolver {

    private final Map<IdentifierKind, IdentifierScheme> schemes = new EnumMap<>(IdentifierKind.class);

    public IdentifierResolver(List<IdentifierScheme> schemes) {
        for (IdentifierScheme s : schemes) {
            if (this.schemes.put(s.kind(), s) != null) {
                throw new IllegalArgumentException("duplicate scheme for " + s.kind());
            }
        }
    }

    public ChangesetId resolve(Repo repo, Identifier identifier) {
        return scheme(identifier.kind()).resolve(repo, identifier)
                .orElseThrow(() -> new NotFoundException(identifier.kind().wireName() + " " + identifier.text()
                        + " in " + repo.name()));
    }

    /** Parse (guessing the scheme) and resolve. */
    public ChangesetId resolve(Repo repo, String text) {
        return resolve(repo, Identifier.parse(text));
    }

    /**
     * Hash conversion: resolve {@code identifier}, then name the commit in every
     * requested scheme that has a name for it. Schemes without one are left out.
     */
    public Map<IdentifierKind, Identifier> lookup(Repo repo, Identifier identifier, Set<IdentifierKind> wanted) {
        ChangesetId id = resolve(repo, identifier);
        Map<IdentifierKind, Identifier> out = new LinkedHashMap<>();
        for (IdentifierKind kind : IdentifierKind.values()) {
            if (!wanted.contains(kind)) continue;
            Optional<Identifier> named = scheme(kind).identify(repo, id);
            named.ifPresent(n -> out.put(kind, n));
        }
        return out;
    }

    private IdentifierScheme scheme(IdentifierKind kind) {
        IdentifierScheme s = schemes.get(kind);
        if (s == null) throw new IllegalArgumentException("no scheme registered for " + kind.wireName());
        return s;
    }
}
