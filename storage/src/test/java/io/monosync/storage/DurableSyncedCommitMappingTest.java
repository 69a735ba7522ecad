// file: storage/src/test/java/io/monosync/storage/DurableSyncedCommitMappingTest.java
package io.monosync.storage;

import io.monosync.core.MappingConflictException;
import io.monosync.core.RepositoryId;
import io.monosync.core.sync.SyncConfigVersion;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.util.Optional;

import static io.monosync.storage.StoreFixtures.id;
import static org.junit.jupiter.api.Assertions.*;

class DurableSyncedCommitMappingTest {

    private static final RepositoryId SMALL = new RepositoryId(1);
    private static final RepositoryId LARGE = new RepositoryId(0);
    private static final SyncConfigVersion V1 = new SyncConfigVersion("v1");
    private static final SyncConfigVersion V2 = new SyncConfigVersion("v2");

    @TempDir Path walDir;

    private static SyncedCommitEntry entry(char small, char large, SyncConfigVersion v) {
        return new SyncedCommitEntry(SMALL, id(small), LARGE, id(large), v);
    }

    @Test
    void identical_insert_is_a_no_op_and_lookups_work_both_ways() {
        var wal = new MemoryWal();
        var mapping = new DurableSyncedCommitMapping(wal);

        assertTrue(mapping.insert(entry('a', 'b', V1)));
        assertFalse(mapping.insert(entry('a', 'b', V1)));
        assertEquals(1, wal.size());

        assertEquals(id('b'), mapping.getLarge(SMALL, LARGE, V1, id('a')).orElseThrow().largeId());
        assertEquals(id('a'), mapping.getSmall(SMALL, LARGE, V1, id('b')).orElseThrow().smallId());
        assertTrue(mapping.getLarge(SMALL, LARGE, V2, id('a')).isEmpty());
        assertTrue(mapping.getLarge(LARGE, SMALL, V1, id('a')).isEmpty());
    }

    @Test
    void divergent_target_for_the_same_source_is_a_conflict() {
        var mapping = new DurableSyncedCommitMapping(new MemoryWal());
        mapping.insert(entry('a', 'b', V1));

        var ex = assertThrows(MappingConflictException.class, () -> mapping.insert(entry('a', 'c', V1)));
        assertEquals(id('a'), ex.source());
        assertEquals(id('b'), ex.existingTarget());
        assertEquals(id('c'), ex.rejectedTarget());

        assertThrows(MappingConflictException.class, () -> mapping.insert(entry('d', 'b', V1)));
        assertTrue(mapping.getLarge(SMALL, LARGE, V1, id('d')).isEmpty());
    }

    @Test
    void a_new_config_version_may_map_the_same_commit_again() {
        var mapping = new DurableSyncedCommitMapping(new MemoryWal());
        mapping.insert(entry('a', 'b', V1));
        mapping.insert(entry('a', 'c', V2));

        assertEquals(id('c'), mapping.findBySmall(SMALL, LARGE, id('a')).orElseThrow().largeId());
        assertEquals(V1, mapping.findByLarge(SMALL, LARGE, id('b')).orElseThrow().version());
    }

    @Test
    void equivalences_are_idempotent_and_conflicts_are_rejected() {
        var mapping = new DurableSyncedCommitMapping(new MemoryWal());
        var eq = new WorkingCopyEquivalence(LARGE, id('l'), SMALL, Optional.of(id('s')), V1);

        assertTrue(mapping.insertEquivalentWorkingCopy(eq));
        assertFalse(mapping.insertEquivalentWorkingCopy(eq));
        assertThrows(IllegalStateException.class, () -> mapping.insertEquivalentWorkingCopy(
                new WorkingCopyEquivalence(LARGE, id('l'), SMALL, Optional.empty(), V1)));
        assertEquals(eq, mapping.getEquivalentWorkingCopy(SMALL, LARGE, id('l')).orElseThrow());
    }

    @Test
    void entries_survive_restart() throws Exception {
        var m1 = new DurableSyncedCommitMapping(new FileWal(walDir, 1L << 60));
        m1.insert(entry('a', 'b', V1));
        m1.insertEquivalentWorkingCopy(new WorkingCopyEquivalence(LARGE, id('e'), SMALL, Optional.empty(), V1));
        m1.close();

        var m2 = new DurableSyncedCommitMapping(new FileWal(walDir, 1L << 60));

        assertEquals(id('a'), m2.getSmall(SMALL, LARGE, V1, id('b')).orElseThrow().smallId());
        assertEquals(Optional.empty(), m2.getEquivalentWorkingCopy(SMALL, LARGE, id('e')).orElseThrow().smallId());
        assertThrows(MappingConflictException.class, () -> m2.insert(entry('a', 'f', V1)));
        m2.close();
    }
}
