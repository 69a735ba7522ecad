// file: core/src/test/java/io/monosync/core/MPathTest.java
package io.monosync.core;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class MPathTest {

    @Test
    void rejects_malformed_paths() {
        for (String bad : List.of("", "/a", "a/", "a//b", "a/./b", "../a", "a/\0")) {
            assertThrows(IllegalArgumentException.class, () -> MPath.of(bad), bad);
        }
    }

    @Test
    void prefix_relations_are_component_wise() {
        MPath dir = MPath.of("a/b");

        assertTrue(dir.isPrefixOf(MPath.of("a/b")));
        assertTrue(dir.isStrictPrefixOf(MPath.of("a/b/c")));
        assertFalse(dir.isPrefixOf(MPath.of("a/bc")));
        assertFalse(dir.isStrictPrefixOf(dir));

        assertEquals(MPath.of("c/d"), MPath.of("a/b/c/d").removePrefix(dir).orElseThrow());
        assertTrue(dir.removePrefix(dir).isEmpty());
        assertEquals(MPath.of("x/a/b"), MPath.of("x").join(dir));
    }

    @Test
    void directory_contents_sort_right_after_the_directory() {
        List<MPath> paths = new ArrayList<>(List.of(MPath.of("a.b"), MPath.of("a/z"), MPath.of("a")));
        Collections.sort(paths);

        assertEquals(List.of(MPath.of("a"), MPath.of("a/z"), MPath.of("a.b")), paths);
    }
}
