// file: storage/src/test/java/io/monosync/storage/DurableBookmarkStoreTest.java
package io.monosync.storage;

import io.monosync.core.BookmarkName;
import io.monosync.core.ChangesetId;
import io.monosync.core.RepositoryId;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.util.List;
import java.util.Optional;

import static io.monosync.storage.StoreFixtures.id;
import static org.junit.jupiter.api.Assertions.*;

class DurableBookmarkStoreTest {

    private static final RepositoryId REPO = new RepositoryId(0);
    private static final RepositoryId OTHER = new RepositoryId(1);
    private static final BookmarkName MAIN = BookmarkName.of("main");

    @TempDir Path walDir;

    @Test
    void create_requires_absence_and_move_requires_the_current_value() {
        var store = new DurableBookmarkStore(new MemoryWal());
        ChangesetId a = id('a');
        ChangesetId b = id('b');

        assertTrue(store.compareAndSwap(REPO, MAIN, Optional.empty(), a));
        assertFalse(store.compareAndSwap(REPO, MAIN, Optional.empty(), b), "already exists");
        assertFalse(store.compareAndSwap(REPO, MAIN, Optional.of(b), b), "stale expectation");
        assertTrue(store.compareAndSwap(REPO, MAIN, Optional.of(a), b));

        assertEquals(Optional.of(b), store.read(REPO, MAIN));
        assertEquals(Optional.empty(), store.read(OTHER, MAIN), "bookmarks are scoped per repository");
    }

    @Test
    void delete_is_a_compare_and_delete() {
        var store = new DurableBookmarkStore(new MemoryWal());
        store.compareAndSwap(REPO, MAIN, Optional.empty(), id('a'));

        assertFalse(store.delete(REPO, MAIN, id('b')));
        assertTrue(store.read(REPO, MAIN).isPresent());
        assertTrue(store.delete(REPO, MAIN, id('a')));
        assertTrue(store.read(REPO, MAIN).isEmpty());
        assertFalse(store.delete(REPO, MAIN, id('a')));
    }

    @Test
    void list_filters_by_prefix_and_honours_limit() {
        var store = new DurableBookmarkStore(new MemoryWal());
        for (String n : List.of("main", "small/feature", "small/alpha", "small/zeta", "smaller")) {
            store.compareAndSwap(REPO, BookmarkName.of(n), Optional.empty(), id('c'));
        }

        List<Bookmark> prefixed = store.list(REPO, "small/", 10);
        assertEquals(List.of("small/alpha", "small/feature", "small/zeta"),
                prefixed.stream().map(b -> b.name().name()).toList());
        assertEquals(2, store.list(REPO, "", 2).size());
        assertTrue(store.list(OTHER, "", 10).isEmpty());
    }

    @Test
    void latest_values_survive_restart() throws Exception {
        var store1 = new DurableBookmarkStore(new FileWal(walDir, 1L << 60));
        store1.compareAndSwap(REPO, MAIN, Optional.empty(), id('a'));
        store1.compareAndSwap(REPO, MAIN, Optional.of(id('a')), id('b'));
        store1.compareAndSwap(REPO, BookmarkName.of("gone"), Optional.empty(), id('a'));
        store1.delete(REPO, BookmarkName.of("gone"), id('a'));
        store1.close();

        var store2 = new DurableBookmarkStore(new FileWal(walDir, 1L << 60));

        assertEquals(Optional.of(id('b')), store2.read(REPO, MAIN));
        assertTrue(store2.read(REPO, BookmarkName.of("gone")).isEmpty());
        store2.close();
    }
}
