package com.causalloops.causal.json;

import com.causalloops.causal.CausalChain;
import com.causalloops.causal.CausalMap;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/** The chain wire shape: {@code {title, explanation, causal_chains: [{initial_variable, relationships, reasoning}]}}. */
public record CausalChainsDocument(
        String title,
        String explanation,
        @JsonProperty("causal_chains") List<CausalChain> causalChains) {

    public CausalChainsDocument {
        causalChains = causalChains == null ? List.of() : causalChains;
    }

    public static CausalChainsDocument of(CausalMap map) {
        return new CausalChainsDocument(map.title(), map.explanation(), map.chains());
    }
}
