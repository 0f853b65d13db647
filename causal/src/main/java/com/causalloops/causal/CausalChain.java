package com.causalloops.causal;

import com.causalloops.graph.Edge;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * A multi-hop path of influences starting at {@code initialVariable}. A chain of n entries
 * stands for n edges: initial to entry 0, then entry i-1 to entry i.
 */
public record CausalChain(
        @JsonProperty("initial_variable") String initialVariable,
        List<RelationshipEntry> relationships,
        String reasoning) {

    public CausalChain {
        initialVariable = Objects.requireNonNullElse(initialVariable, "");
        relationships = relationships == null ? List.of() : List.copyOf(relationships);
        reasoning = Objects.requireNonNullElse(reasoning, "");
    }

    /** The single-hop chain equivalent to {@code r}. */
    public static CausalChain of(Relationship r) {
        return new CausalChain(r.from(), List.of(new RelationshipEntry(r.to(), r.polarity(), r.polarityReasoning())), r.reasoning());
    }

    /** The chain's hops as flat relationships; each carries the chain's reasoning. */
    public List<Relationship> toRelationships() {
        List<Relationship> out = new ArrayList<>(relationships.size());
        String previous = initialVariable;
        for (RelationshipEntry entry : relationships) {
            out.add(new Relationship(previous, entry.variable(), entry.polarity(), reasoning, entry.polarityReasoning()));
            previous = entry.variable();
        }
        return out;
    }

    public List<Edge> edges() {
        List<Edge> out = new ArrayList<>(relationships.size());
        String previous = initialVariable;
        for (RelationshipEntry entry : relationships) {
            out.add(new Edge(previous, entry.variable()));
            previous = entry.variable();
        }
        return out;
    }
}
