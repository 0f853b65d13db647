package com.causalloops.graph;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Insertion-idempotent collection. Iteration order is only observable through {@link #slice()},
 * which is always ascending, so output built from it is deterministic.
 */
public final class UniqueSet<T extends Comparable<? super T>> {
    private final Set<T> elements;

    public UniqueSet() {
        this.elements = new HashSet<>();
    }

    @SafeVarargs
    public static <T extends Comparable<? super T>> UniqueSet<T> of(T... elements) {
        UniqueSet<T> s = new UniqueSet<>();
        for (T e : elements) s.add(e);
        return s;
    }

    public void add(T element) {
        elements.add(element);
    }

    public boolean contains(T element) {
        return elements.contains(element);
    }

    public int size() {
        return elements.size();
    }

    public boolean isEmpty() {
        return elements.isEmpty();
    }

    /** Elements in ascending natural order; a fresh, unmodifiable list on every call. */
    public List<T> slice() {
        List<T> out = new ArrayList<>(elements);
        Collections.sort(out);
        return Collections.unmodifiableList(out);
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof UniqueSet<?> other && elements.equals(other.elements);
    }

    @Override
    public int hashCode() {
        return elements.hashCode();
    }

    @Override
    public String toString() {
        return "UniqueSet" + slice();
    }
}
