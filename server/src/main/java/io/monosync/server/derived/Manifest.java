// file: server/src/main/java/io/monosync/server/derived/Manifest.java
package io.monosync.server.derived;

import io.monosync.core.AltHash;
import io.monosync.core.ContentId;
import io.monosync.core.FileChange;
import io.monosync.core.FileType;
import io.monosync.core.Hashing;
import io.monosync.core.MPath;

import java.nio.charset.StandardCharsets;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.SortedMap;
import java.util.TreeMap;

/** Full file tree of a changeset: every path that exists after it, with its content. */
public final class Manifest {

    public record Entry(ContentId content, FileType type, long size) {
        public Entry {
            Objects.requireNonNull(content, "content");
            Objects.requireNonNull(type, "type");
        }
    }

    public static final Manifest EMPTY = new Manifest(new TreeMap<>());

    private final SortedMap<MPath, Entry> entries;

    private Manifest(TreeMap<MPath, Entry> entries) {
        this.entries = Collections.unmodifiableSortedMap(entries);
    }

    public SortedMap<MPath, Entry> entries() {
        return entries;
    }

    public Optional<Entry> get(MPath path) {
        return Optional.ofNullable(entries.get(path));
    }

    public boolean contains(MPath path) {
        return entries.containsKey(path);
    }

    public int size() {
        return entries.size();
    }

    /**
     * Tree of a changeset given its parents' trees: the first parent's tree,
     * plus entries only other parents have, with the changeset's own changes
     * applied on top.
     * <p>
     * A file written at a path replaces any directory there and any file at one
     * of its parent directories; a deletion removes the file.
     */
    static Manifest derive(List<Manifest> parents, Map<MPath, FileChange> changes) {
        TreeMap<MPath, Entry> tree = new TreeMap<>();
        for (int i = parents.size() - 1; i >= 0; i--) {
            tree.putAll(parents.get(i).entries);
        }
        for (Map.Entry<MPath, FileChange> c : changes.entrySet()) {
            MPath path = c.getKey();
            if (c.getValue() instanceof FileChange.Modified m) {
                removeUnder(tree, path);
                for (int depth = 1; depth < path.depth(); depth++) {
                    tree.remove(MPath.fromElements(path.elements().subList(0, depth)));
                }
                tree.put(path, new Entry(m.content(), m.type(), m.size()));
            } else {
                tree.remove(path);
            }
        }
        return new Manifest(tree);
    }

    private static void removeUnder(TreeMap<MPath, Entry> tree, MPath dir) {
        // Component-wise order puts a directory's contents right after it.
        var tail = tree.tailMap(dir, false);
        var it = tail.keySet().iterator();
        while (it.hasNext()) {
            MPath p = it.next();
            if (!dir.isStrictPrefixOf(p)) break;
            it.remove();
        }
    }

    /** SHA-1 over the sorted "path NUL content type" lines, used by alternate hashes. */
    public AltHash hash() {
        StringBuilder sb = new StringBuilder();
        for (Map.Entry<MPath, Entry> e : entries.entrySet()) {
            sb.append(e.getKey()).append('\0')
                    .append(e.getValue().content().hex())
                    .append((char) e.getValue().type().code())
                    .append('\n');
        }
        return AltHash.fromBytes(Hashing.sha1(sb.toString().getBytes(StandardCharsets.UTF_8)));
    }
}
