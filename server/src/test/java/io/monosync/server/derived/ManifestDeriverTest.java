// file: server/src/test/java/io/monosync/server/derived/ManifestDeriverTest.java
package io.monosync.server.derived;

import io.monosync.core.ContentId;
import io.monosync.core.MPath;
import io.monosync.server.TestRepos;
import io.monosync.server.TestRepos.Draft;
import org.junit.jupiter.api.Test;

import java.util.List;

import static io.monosync.server.TestRepos.bytes;
import static io.monosync.server.TestRepos.draft;
import static org.junit.jupiter.api.Assertions.*;

class ManifestDeriverTest {

    private final ManifestDeriver deriver = new ManifestDeriver();

    @Test
    void tree_accumulates_changes_along_history() {
        TestRepos t = TestRepos.defaults();
        Draft a = draft("a").file("dir/one", "1").file("two", "2").build();
        Draft b = draft("b").parent(a).delete("two").file("dir/three", "3").build();
        TestRepos.seed(t.large, a, b);

        Manifest m = deriver.manifest(t.large, b.id());

        assertEquals(List.of(MPath.of("dir/one"), MPath.of("dir/three")), List.copyOf(m.entries().keySet()));
        assertEquals(ContentId.of(bytes("3")), m.get(MPath.of("dir/three")).orElseThrow().content());
        assertEquals(2, deriver.manifest(t.large, a.id()).size());
    }

    @Test
    void file_replaces_directory_and_directory_replaces_file() {
        TestRepos t = TestRepos.defaults();
        Draft a = draft("a").file("d/x", "x").file("d/y", "y").file("f", "f").build();
        Draft b = draft("b").parent(a).file("d", "now a file").file("f/inner", "now a dir").build();
        TestRepos.seed(t.large, a, b);

        Manifest m = deriver.manifest(t.large, b.id());

        assertEquals(List.of(MPath.of("d"), MPath.of("f/inner")), List.copyOf(m.entries().keySet()));
    }

    @Test
    void merge_takes_first_parent_and_fills_in_from_others() {
        TestRepos t = TestRepos.defaults();
        Draft root = draft("root").file("shared", "0").build();
        Draft left = draft("left").parent(root).file("shared", "left").build();
        Draft right = draft("right").parent(root).file("shared", "right").file("only-right", "r").build();
        Draft merge = draft("merge").parents(left.id(), right.id()).build();
        TestRepos.seed(t.large, root, left, right, merge);

        Manifest m = deriver.manifest(t.large, merge.id());

        assertEquals(ContentId.of(bytes("left")), m.get(MPath.of("shared")).orElseThrow().content());
        assertTrue(m.contains(MPath.of("only-right")));
    }

    @Test
    void equal_trees_hash_equal() {
        TestRepos t = TestRepos.defaults();
        Draft a = draft("a").file("x", "1").build();
        Draft b = draft("b").file("x", "1").author("someone else").build();
        TestRepos.seed(t.large, a, b);

        assertNotEquals(a.id(), b.id());
        assertEquals(deriver.manifest(t.large, a.id()).hash(), deriver.manifest(t.large, b.id()).hash());
    }
}
