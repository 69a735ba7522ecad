// file: server/src/main/java/io/monosync/server/repo/CommitGraph.java
package io.monosync.server.repo;

import io.monosync.core.ChangesetId;
import io.monosync.storage.ChangesetStore;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.PriorityQueue;
import java.util.Set;
import java.util.function.Predicate;

/**
 * Ancestry queries over a {@link ChangesetStore}.
 * <p>
 * Every walk uses an explicit queue, never recursion, and prunes with
 * generation numbers: nothing below the generation of the commit being
 * searched for can reach it.
 */
public final class CommitGraph {

    private CommitGraph() {
        // utility
    }

    /** True if {@code ancestor} is {@code descendant} or one of its ancestors. */
    public static boolean isAncestor(ChangesetStore store, ChangesetId ancestor, ChangesetId descendant) {
        if (ancestor.equals(descendant)) return true;
        long floor = store.generation(ancestor);
        Deque<ChangesetId> queue = new ArrayDeque<>();
        Set<ChangesetId> seen = new HashSet<>();
        queue.add(descendant);
        while (!queue.isEmpty()) {
            ChangesetId cur = queue.poll();
            for (ChangesetId p : store.parents(cur)) {
                if (p.equals(ancestor)) return true;
                if (store.generation(p) > floor && seen.add(p)) {
                    queue.add(p);
                }
            }
        }
        return false;
    }

    /**
     * Commits reachable from {@code head} but not from {@code base} (both
     * inclusive), ancestors first. With no base this is all of head's history.
     * <p>
     * Both frontiers are walked together in decreasing generation order; by the
     * time a commit is popped every path to it from base has been seen.
     */
    public static List<ChangesetId> rangeExclusive(ChangesetStore store, ChangesetId head, Optional<ChangesetId> base) {
        Comparator<ChangesetId> byGenerationDesc = Comparator
                .<ChangesetId>comparingLong(store::generation).reversed()
                .thenComparing(Comparator.reverseOrder());
        PriorityQueue<ChangesetId> queue = new PriorityQueue<>(byGenerationDesc);
        Map<ChangesetId, Boolean> fromBase = new HashMap<>();
        int pendingFromHead = 0;

        fromBase.put(head, false);
        queue.add(head);
        pendingFromHead++;
        if (base.isPresent()) {
            if (fromBase.containsKey(base.get())) {
                fromBase.put(base.get(), true);
                pendingFromHead--;
            } else {
                fromBase.put(base.get(), true);
                queue.add(base.get());
            }
        }

        List<ChangesetId> out = new ArrayList<>();
        while (pendingFromHead > 0) {
            ChangesetId cur = queue.poll();
            boolean baseSide = fromBase.remove(cur);
            if (!baseSide) {
                pendingFromHead--;
                out.add(cur);
            }
            for (ChangesetId p : store.parents(cur)) {
                Boolean known = fromBase.get(p);
                if (known == null) {
                    fromBase.put(p, baseSide);
                    queue.add(p);
                    if (!baseSide) pendingFromHead++;
                } else if (baseSide && !known) {
                    fromBase.put(p, true);
                    pendingFromHead--;
                }
            }
        }
        out.sort(topological(store));
        return out;
    }

    /**
     * Ancestors of {@code start} (inclusive) that do not satisfy {@code done},
     * ancestors first. The walk does not continue past commits that are done.
     */
    public static List<ChangesetId> pendingAncestors(ChangesetStore store, ChangesetId start, Predicate<ChangesetId> done) {
        List<ChangesetId> out = new ArrayList<>();
        if (done.test(start)) return out;
        Deque<ChangesetId> stack = new ArrayDeque<>();
        Set<ChangesetId> seen = new HashSet<>();
        stack.push(start);
        seen.add(start);
        while (!stack.isEmpty()) {
            ChangesetId cur = stack.pop();
            out.add(cur);
            for (ChangesetId p : store.parents(cur)) {
                if (seen.add(p) && !done.test(p)) {
                    stack.push(p);
                }
            }
        }
        out.sort(topological(store));
        return out;
    }

    /** Orders by generation, then id; parents always sort before children. */
    public static Comparator<ChangesetId> topological(ChangesetStore store) {
        return Comparator.<ChangesetId>comparingLong(store::generation).thenComparing(Comparator.naturalOrder());
    }
}
