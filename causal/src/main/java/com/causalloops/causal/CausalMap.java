package com.causalloops.causal;

import com.causalloops.graph.CycleFinder;
import com.causalloops.graph.Edge;
import com.causalloops.graph.EdgeList;
import com.causalloops.graph.UniqueSet;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * A causal loop diagram: a title, an explanation and the causal chains that make up its edges.
 * <p>
 * Immutable. {@link #variables()} and {@link #loops()} are recomputed on every call and share no
 * state, so a map can be queried from several threads at once.
 */
public record CausalMap(String title, String explanation, List<CausalChain> chains) {

    public CausalMap {
        title = Objects.requireNonNullElse(title, "");
        explanation = Objects.requireNonNullElse(explanation, "");
        chains = chains == null ? List.of() : List.copyOf(chains);
    }

    /** A map holding one single-hop chain per relationship, in order. */
    public static CausalMap fromRelationships(String title, String explanation, List<Relationship> relationships) {
        Objects.requireNonNull(relationships, "relationships");
        List<CausalChain> chains = new ArrayList<>(relationships.size());
        for (Relationship r : relationships) chains.add(CausalChain.of(r));
        return new CausalMap(title, explanation, chains);
    }

    public static CausalMap fromRelationships(List<Relationship> relationships) {
        return fromRelationships("", "", relationships);
    }

    /** Every influence in chain order, flattened to single hops. */
    public List<Relationship> relationships() {
        List<Relationship> out = new ArrayList<>();
        for (CausalChain c : chains) out.addAll(c.toRelationships());
        return List.copyOf(out);
    }

    public List<Edge> edges() {
        List<Edge> out = new ArrayList<>();
        for (CausalChain c : chains) out.addAll(c.edges());
        return out;
    }

    public EdgeList edgeList() {
        return EdgeList.of(edges());
    }

    /** Normalized names of every edge endpoint. */
    public UniqueSet<String> variables() {
        return edgeList().vertices();
    }

    /**
     * Feedback loops as closed sequences of normalized names ({@code [a, b, c, a]}), each starting at
     * its smallest name, shortest first and then lexicographic.
     */
    public List<List<String>> loops() {
        return CycleFinder.loops(edgeList());
    }
}
