// file: core/src/test/java/io/monosync/core/sync/BookmarkCorrespondenceTest.java
package io.monosync.core.sync;

import io.monosync.core.BookmarkName;
import io.monosync.core.RepositoryId;
import org.junit.jupiter.api.Test;

import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class BookmarkCorrespondenceTest {

    private final BookmarkCorrespondence resolver = new BookmarkCorrespondence(CommitSyncConfig.simple(
            new SyncConfigVersion("v1"), new RepositoryId(1), new RepositoryId(0), "fbsource", Set.of(BookmarkName.of("master"))));

    @Test
    void common_bookmark_keeps_its_name() {
        var r = resolver.resolve(BookmarkName.of("master"));

        assertTrue(r.common());
        assertEquals(BookmarkName.of("master"), r.largeName());
        assertEquals(BookmarkName.of("master"), r.smallName());
    }

    @Test
    void other_bookmarks_are_namespaced_on_the_large_side_only() {
        var r = resolver.resolve(BookmarkName.of("feature"));

        assertFalse(r.common());
        assertEquals(BookmarkName.of("fbsource/feature"), r.largeName());
        assertEquals(BookmarkName.of("feature"), r.smallName());
    }

    @Test
    void large_names_map_back_only_when_they_mirror_something() {
        assertEquals(BookmarkName.of("feature"), resolver.smallNameFor(BookmarkName.of("fbsource/feature")).orElseThrow());
        assertEquals(BookmarkName.of("master"), resolver.smallNameFor(BookmarkName.of("master")).orElseThrow());
        assertTrue(resolver.smallNameFor(BookmarkName.of("feature")).isEmpty());
        assertTrue(resolver.smallNameFor(BookmarkName.of("fbsource/master")).isEmpty());
    }
}
