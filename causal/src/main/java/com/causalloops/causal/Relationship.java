package com.causalloops.causal;

import java.util.Objects;

/**
 * One causal influence {@code from -> to}. Names are kept as written; normalization happens when
 * the graph is built.
 */
public record Relationship(
        String from,
        String to,
        Polarity polarity,
        String reasoning,
        String polarityReasoning) {

    public Relationship {
        from = Objects.requireNonNullElse(from, "");
        to = Objects.requireNonNullElse(to, "");
        reasoning = Objects.requireNonNullElse(reasoning, "");
        polarityReasoning = Objects.requireNonNullElse(polarityReasoning, "");
    }

    public static Relationship of(String from, String to, Polarity polarity) {
        return new Relationship(from, to, polarity, "", "");
    }
}
