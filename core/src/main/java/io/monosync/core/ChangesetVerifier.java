// file: core/src/main/java/io/monosync/core/ChangesetVerifier.java
package io.monosync.core;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Structural checks a changeset must pass before it is stored:
 *  - author is not blank,
 *  - no duplicate parents,
 *  - every copy source names one of the changeset's parents,
 *  - no changed path is a directory containing another path modified
 *    in the same changeset (a path cannot be both a file and a directory).
 */
public final class ChangesetVerifier {

    private ChangesetVerifier() {
        // utility
    }

    /** All problems found, empty if the changeset is valid. */
    public static List<String> problems(Changeset cs) {
        List<String> problems = new ArrayList<>();
        if (cs.author().isBlank()) {
            problems.add("author must not be blank");
        }
        if (cs.parents().stream().distinct().count() != cs.parents().size()) {
            problems.add("duplicate parents");
        }

        MPath lastModified = null;
        for (Map.Entry<MPath, FileChange> e : cs.fileChanges().entrySet()) {
            MPath path = e.getKey();
            if (e.getValue() instanceof FileChange.Modified m) {
                if (m.copyFrom() != null && !cs.parents().contains(m.copyFrom().changeset())) {
                    problems.add("copy source of " + path + " refers to " + m.copyFrom().changeset()
                            + " which is not a parent");
                }
                // Sorted order puts a directory right before its contents.
                if (lastModified != null && lastModified.isStrictPrefixOf(path)) {
                    problems.add("path " + lastModified + " is modified as a file but also contains " + path);
                }
                lastModified = path;
            }
        }
        return problems;
    }

    public static void verify(Changeset cs) {
        List<String> problems = problems(cs);
        if (!problems.isEmpty()) {
            throw new InvalidChangesetException(cs.id(), problems);
        }
    }
}
