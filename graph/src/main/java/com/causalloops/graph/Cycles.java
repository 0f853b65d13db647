package com.causalloops.graph;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Collects discovered cycles in canonical form, dropping exact repeats, and turns them into
 * closed, ordered loops.
 */
public final class Cycles {
    private final Set<List<String>> found = new LinkedHashSet<>();

    /**
     * Rotates {@code cycle} so its smallest vertex comes first, keeping the relative order of the rest.
     * Rotations of the same cycle share one representative; a different traversal order of the same
     * vertices does not.
     */
    public static List<String> canonical(List<String> cycle) {
        Objects.requireNonNull(cycle, "cycle");
        if (cycle.isEmpty()) throw new IllegalArgumentException("A cycle has at least one vertex");
        int min = 0;
        for (int i = 1; i < cycle.size(); i++) {
            if (LoopOrder.compareNames(cycle.get(i), cycle.get(min)) < 0) min = i;
        }
        List<String> out = new ArrayList<>(cycle.size());
        out.addAll(cycle.subList(min, cycle.size()));
        out.addAll(cycle.subList(0, min));
        return List.copyOf(out);
    }

    /** Repeats the first vertex at the end: {@code [a, b, c]} becomes {@code [a, b, c, a]}. */
    public static List<String> close(List<String> cycle) {
        List<String> out = new ArrayList<>(cycle.size() + 1);
        out.addAll(cycle);
        out.add(cycle.get(0));
        return List.copyOf(out);
    }

    /** @return true if this was a new cycle */
    public boolean add(List<String> cycle) {
        return found.add(canonical(cycle));
    }

    public int size() {
        return found.size();
    }

    /** Canonical cycles in discovery order, not closed. */
    public List<List<String>> canonicalCycles() {
        return List.copyOf(found);
    }

    /** Closed loops sorted by {@link LoopOrder}; ties keep discovery order. */
    public List<List<String>> loops() {
        List<List<String>> closed = new ArrayList<>(found.size());
        for (List<String> c : found) closed.add(close(c));
        closed.sort(LoopOrder.INSTANCE);
        return Collections.unmodifiableList(closed);
    }
}
