// file: core/src/test/java/io/monosync/core/ChangesetVerifierTest.java
package io.monosync.core;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class ChangesetVerifierTest {

    private static final ContentId C = ContentId.of(new byte[]{1, 2, 3});

    private static Changeset cs(List<ChangesetId> parents, Map<MPath, FileChange> changes) {
        return new Changeset(parents, changes, "alice", DateTime.ofEpochSeconds(10), "msg", Map.of());
    }

    @Test
    void accepts_rename_from_a_parent() {
        Changeset root = cs(List.of(), Map.of(MPath.of("a"), FileChange.modified(C, FileType.REGULAR, 3)));
        Changeset rename = cs(List.of(root.id()), Map.of(
                MPath.of("a"), FileChange.deleted(),
                MPath.of("b"), new FileChange.Modified(C, FileType.REGULAR, 3, new FileChange.CopyFrom(MPath.of("a"), root.id()))
        ));

        assertTrue(ChangesetVerifier.problems(rename).isEmpty());
        assertDoesNotThrow(() -> ChangesetVerifier.verify(rename));
    }

    @Test
    void rejects_copy_from_a_non_parent() {
        Changeset unrelated = cs(List.of(), Map.of());
        Changeset bad = cs(List.of(), Map.of(
                MPath.of("b"), new FileChange.Modified(C, FileType.REGULAR, 3, new FileChange.CopyFrom(MPath.of("a"), unrelated.id()))
        ));

        var ex = assertThrows(InvalidChangesetException.class, () -> ChangesetVerifier.verify(bad));
        assertEquals(bad.id(), ex.changeset());
        assertTrue(ex.problems().get(0).contains("not a parent"));
    }

    @Test
    void rejects_path_that_is_both_file_and_directory() {
        Changeset bad = cs(List.of(), Map.of(
                MPath.of("dir"), FileChange.modified(C, FileType.REGULAR, 3),
                MPath.of("dir/inner"), FileChange.modified(C, FileType.REGULAR, 3)
        ));

        assertEquals(1, ChangesetVerifier.problems(bad).size());
    }

    @Test
    void replacing_a_directory_with_a_file_is_fine() {
        Changeset ok = cs(List.of(), Map.of(
                MPath.of("dir"), FileChange.modified(C, FileType.REGULAR, 3),
                MPath.of("dir/inner"), FileChange.deleted()
        ));

        assertTrue(ChangesetVerifier.problems(ok).isEmpty());
    }
}
