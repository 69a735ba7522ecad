// file: core/src/main/java/io/monosync/core/Changeset.java
package io.monosync.core;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * Immutable, content-addressed commit.
 * <p>
 * Fields:
 *  - parents:     ordered parent ids (empty for a root, two or more for a merge).
 *  - fileChanges: path -> change, sorted by path.
 *  - author, date, message.
 *  - extras:      free-form metadata, key -> bytes, sorted by key.
 * <p>
 * The id is SHA-256 over {@link ChangesetCodec#encode(Changeset)}, so equal content
 * means equal id and the other way round. equals/hashCode go through the id.
 * "Modifying" a changeset returns a new one with a new id.
 */
public final class Changeset {

    /** Extras key carrying the id of the commit this one was rewritten from. */
    public static final String SYNC_SOURCE_EXTRA = "sync-source";

    private final List<ChangesetId> parents;
    private final SortedMap<MPath, FileChange> fileChanges;
    private final String author;
    private final DateTime date;
    private final String message;
    private final SortedMap<String, byte[]> extras;

    // Lazily computed; benign race, every thread computes the same value.
    private volatile ChangesetId id;

    public Changeset(
            List<ChangesetId> parents,
            Map<MPath, ? extends FileChange> fileChanges,
            String author,
            DateTime date,
            String message,
            Map<String, byte[]> extras
    ) {
        this.parents = List.copyOf(Objects.requireNonNull(parents, "parents"));
        this.fileChanges = Collections.unmodifiableSortedMap(new TreeMap<>(Objects.requireNonNull(fileChanges, "fileChanges")));
        this.author = Objects.requireNonNull(author, "author");
        this.date = Objects.requireNonNull(date, "date");
        this.message = Objects.requireNonNull(message, "message");

        TreeMap<String, byte[]> ex = new TreeMap<>();
        for (Map.Entry<String, byte[]> e : Objects.requireNonNull(extras, "extras").entrySet()) {
            ex.put(Objects.requireNonNull(e.getKey(), "extra key"),
                    Arrays.copyOf(e.getValue(), e.getValue().length));
        }
        this.extras = Collections.unmodifiableSortedMap(ex);
    }

    public ChangesetId id() {
        ChangesetId cached = id;
        if (cached == null) {
            cached = ChangesetId.fromBytes(Hashing.sha256(ChangesetCodec.encode(this)));
            id = cached;
        }
        return cached;
    }

    public List<ChangesetId> parents() { return parents; }

    public SortedMap<MPath, FileChange> fileChanges() { return fileChanges; }

    public String author() { return author; }

    public DateTime date() { return date; }

    public String message() { return message; }

    /** Read-only copy of the extras; mutating the returned arrays does not touch this changeset. */
    public SortedMap<String, byte[]> extras() {
        TreeMap<String, byte[]> copy = new TreeMap<>();
        for (Map.Entry<String, byte[]> e : extras.entrySet()) {
            copy.put(e.getKey(), e.getValue().clone());
        }
        return Collections.unmodifiableSortedMap(copy);
    }

    public Optional<byte[]> extra(String key) {
        byte[] v = extras.get(key);
        return v == null ? Optional.empty() : Optional.of(Arrays.copyOf(v, v.length));
    }

    public Optional<String> extraString(String key) {
        return extra(key).map(b -> new String(b, StandardCharsets.UTF_8));
    }

    public boolean isMerge() {
        return parents.size() > 1;
    }

    public boolean isRoot() {
        return parents.isEmpty();
    }

    public Changeset withParents(List<ChangesetId> newParents) {
        return new Changeset(newParents, fileChanges, author, date, message, extras);
    }

    public Changeset withFileChanges(Map<MPath, ? extends FileChange> newChanges) {
        return new Changeset(parents, newChanges, author, date, message, extras);
    }

    public Changeset withExtra(String key, String value) {
        TreeMap<String, byte[]> ex = new TreeMap<>(extras);
        ex.put(key, value.getBytes(StandardCharsets.UTF_8));
        return new Changeset(parents, fileChanges, author, date, message, ex);
    }

    public Changeset withoutExtra(String key) {
        if (!extras.containsKey(key)) return this;
        TreeMap<String, byte[]> ex = new TreeMap<>(extras);
        ex.remove(key);
        return new Changeset(parents, fileChanges, author, date, message, ex);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Changeset c)) return false;
        return id().equals(c.id());
    }

    @Override
    public int hashCode() {
        return id().hashCode();
    }

    @Override
    public String toString() {
        return "Changeset{" + id().shortHex() + ", parents=" + parents.size()
                + ", changes=" + fileChanges.size() + ", author=" + author + "}";
    }
}
