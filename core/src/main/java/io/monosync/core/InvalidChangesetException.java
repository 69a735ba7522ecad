// file: core/src/main/java/io/monosync/core/InvalidChangesetException.java
package io.monosync.core;

import java.util.List;
import java.util.Map;

/** A changeset failed {@link ChangesetVerifier} checks. */
public final class InvalidChangesetException extends MonosyncException {
    private final ChangesetId changeset;
    private final List<String> problems;

    public InvalidChangesetException(ChangesetId changeset, List<String> problems) {
        super("invalid changeset " + changeset + ": " + String.join("; ", problems));
        this.changeset = changeset;
        this.problems = List.copyOf(problems);
    }

    public ChangesetId changeset() { return changeset; }

    public List<String> problems() { return problems; }

    @Override
    public String kind() { return "InvalidChangeset"; }

    @Override
    public Map<String, Object> context() {
        return Map.of("changeset", changeset.hex(), "problems", problems);
    }
}
