// file: core/src/main/java/io/monosync/core/RepositoryId.java
package io.monosync.core;

/** Numeric identity of a repository, stable across restarts. */
public record RepositoryId(int id) implements Comparable<RepositoryId> {

    public RepositoryId {
        if (id < 0) throw new IllegalArgumentException("repository id must be >= 0, got " + id);
    }

    @Override
    public int compareTo(RepositoryId o) {
        return Integer.compare(id, o.id);
    }

    @Override
    public String toString() {
        return "repo#" + id;
    }
}
