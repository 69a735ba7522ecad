// file: core/src/main/java/io/monosync/core/BookmarkName.java
package io.monosync.core;

import java.util.Objects;

/**
 * Name of a bookmark (a mutable branch pointer), scoped to one repository.
 * <p>
 * Names are non-empty, contain no whitespace, and have no leading, trailing
 * or doubled '/'. Namespaced mirrors look like {@code "<prefix>/<name>"}.
 */
public record BookmarkName(String name) implements Comparable<BookmarkName> {

    public BookmarkName {
        Objects.requireNonNull(name, "name");
        if (name.isEmpty()) throw new IllegalArgumentException("bookmark name must not be empty");
        if (name.startsWith("/") || name.endsWith("/") || name.contains("//")) {
            throw new IllegalArgumentException("malformed bookmark name: " + name);
        }
        for (int i = 0; i < name.length(); i++) {
            if (Character.isWhitespace(name.charAt(i)) || name.charAt(i) == 0) {
                throw new IllegalArgumentException("bookmark name contains whitespace: " + name);
            }
        }
    }

    public static BookmarkName of(String name) {
        return new BookmarkName(name);
    }

    public boolean startsWith(String prefix) {
        return name.startsWith(prefix);
    }

    @Override
    public int compareTo(BookmarkName o) {
        return name.compareTo(o.name);
    }

    @Override
    public String toString() {
        return name;
    }
}
