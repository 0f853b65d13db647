package com.causalloops.causal;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Objects;

/** One hop of a {@link CausalChain}: the variable reached and how it responds to the previous one. */
public record RelationshipEntry(
        String variable,
        Polarity polarity,
        @JsonProperty("polarity_reasoning") String polarityReasoning) {

    public RelationshipEntry {
        variable = Objects.requireNonNullElse(variable, "");
        polarityReasoning = Objects.requireNonNullElse(polarityReasoning, "");
    }
}
