// file: core/src/main/java/io/monosync/core/MPath.java
package io.monosync.core;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

/**
 * Immutable repository-relative path, stored as its '/'-separated components.
 * <p>
 * Invariants:
 *  - at least one component,
 *  - no empty, "." or ".." components,
 *  - no NUL or newline characters.
 * <p>
 * Ordering is component-wise, so "a/b" sorts before "a.b" and a directory's
 * contents sort directly after the directory itself.
 */
public final class MPath implements Comparable<MPath> {

    private final List<String> elements;

    private MPath(List<String> elements) {
        this.elements = elements;
    }

    /** Parse a path such as {@code "dir/file.txt"}. */
    public static MPath of(String path) {
        if (path == null || path.isEmpty()) {
            throw new IllegalArgumentException("path must not be empty");
        }
        return fromElements(Arrays.asList(path.split("/", -1)));
    }

    public static MPath fromElements(List<String> elements) {
        if (elements.isEmpty()) {
            throw new IllegalArgumentException("path must have at least one element");
        }
        for (String e : elements) {
            if (e.isEmpty() || e.equals(".") || e.equals("..")) {
                throw new IllegalArgumentException("invalid path element '" + e + "' in " + String.join("/", elements));
            }
            if (e.indexOf('\0') >= 0 || e.indexOf('\n') >= 0) {
                throw new IllegalArgumentException("path element contains NUL or newline: " + e);
            }
        }
        return new MPath(Collections.unmodifiableList(new ArrayList<>(elements)));
    }

    public List<String> elements() {
        return elements;
    }

    public int depth() {
        return elements.size();
    }

    public String basename() {
        return elements.get(elements.size() - 1);
    }

    /** {@code this} followed by {@code suffix}: "a".join("b/c") is "a/b/c". */
    public MPath join(MPath suffix) {
        List<String> joined = new ArrayList<>(elements.size() + suffix.elements.size());
        joined.addAll(elements);
        joined.addAll(suffix.elements);
        return new MPath(Collections.unmodifiableList(joined));
    }

    /** True if this path equals {@code other} or is a directory containing it. */
    public boolean isPrefixOf(MPath other) {
        if (elements.size() > other.elements.size()) return false;
        return other.elements.subList(0, elements.size()).equals(elements);
    }

    /** True if this path is a directory strictly containing {@code other}. */
    public boolean isStrictPrefixOf(MPath other) {
        return elements.size() < other.elements.size() && isPrefixOf(other);
    }

    /**
     * Remove a strict directory prefix. "a/b/c" minus "a" is "b/c";
     * returns empty if {@code prefix} is not a strict prefix.
     */
    public Optional<MPath> removePrefix(MPath prefix) {
        if (!prefix.isStrictPrefixOf(this)) return Optional.empty();
        return Optional.of(new MPath(elements.subList(prefix.elements.size(), elements.size())));
    }

    @Override
    public int compareTo(MPath o) {
        int n = Math.min(elements.size(), o.elements.size());
        for (int i = 0; i < n; i++) {
            int c = elements.get(i).compareTo(o.elements.get(i));
            if (c != 0) return c;
        }
        return Integer.compare(elements.size(), o.elements.size());
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof MPath p)) return false;
        return elements.equals(p.elements);
    }

    @Override
    public int hashCode() {
        return elements.hashCode();
    }

    @Override
    public String toString() {
        return String.join("/", elements);
    }
}
