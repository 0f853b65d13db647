package com.causalloops.causal.json;

import com.causalloops.causal.CausalMap;
import com.causalloops.common.errorsor.ErrorsOr;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

/** Turns one wire shape into a {@link CausalMap}. */
public interface CausalMapAdapter {

    /** Short name used in error messages. */
    String shape();

    /** True if {@code root} looks like this adapter's shape. */
    boolean accepts(JsonNode root);

    ErrorsOr<CausalMap> adapt(ObjectMapper mapper, JsonNode root);
}
