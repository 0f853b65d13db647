package com.causalloops.graph;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Immutable adjacency over normalized vertex names.
 * <p>
 * Keys appear in the order a vertex is first seen as an edge source; each destination list keeps
 * edge insertion order and is not deduplicated (several statements may assert the same influence).
 */
public final class EdgeList {
    private final Map<String, List<String>> outgoing;
    private final UniqueSet<String> vertices;

    private EdgeList(Map<String, List<String>> outgoing, UniqueSet<String> vertices) {
        this.outgoing = outgoing;
        this.vertices = vertices;
    }

    public static EdgeList of(Iterable<Edge> edges) {
        Objects.requireNonNull(edges, "edges");
        Map<String, List<String>> adj = new LinkedHashMap<>();
        UniqueSet<String> vertices = new UniqueSet<>();
        for (Edge e : edges) {
            String from = VariableNames.normalize(e.from());
            String to = VariableNames.normalize(e.to());
            adj.computeIfAbsent(from, k -> new ArrayList<>()).add(to);
            vertices.add(from);
            vertices.add(to);
        }
        Map<String, List<String>> frozen = new LinkedHashMap<>();
        adj.forEach((k, v) -> frozen.put(k, List.copyOf(v)));
        return new EdgeList(Collections.unmodifiableMap(frozen), vertices);
    }

    /** Vertices with at least one outgoing edge, in first-seen order. */
    public List<String> sources() {
        return List.copyOf(outgoing.keySet());
    }

    public List<String> neighbours(String vertex) {
        return outgoing.getOrDefault(vertex, List.of());
    }

    /** Every normalized endpoint. A copy: callers may add to it. */
    public UniqueSet<String> vertices() {
        UniqueSet<String> copy = new UniqueSet<>();
        for (String v : vertices.slice()) copy.add(v);
        return copy;
    }

    public Map<String, List<String>> asMap() {
        return outgoing;
    }

    public boolean isEmpty() {
        return outgoing.isEmpty();
    }
}
