package com.causalloops.causal.json;

import com.causalloops.causal.CausalMap;
import com.causalloops.common.errorsor.ErrorsOr;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

public final class CausalChainsAdapter implements CausalMapAdapter {
    static final String FIELD = "causal_chains";

    @Override
    public String shape() {
        return FIELD;
    }

    @Override
    public boolean accepts(JsonNode root) {
        return root.isObject() && root.has(FIELD);
    }

    @Override
    public ErrorsOr<CausalMap> adapt(ObjectMapper mapper, JsonNode root) {
        return ErrorsOr.trying(() -> mapper.treeToValue(root, CausalChainsDocument.class))
                .mapTry(doc -> new CausalMap(doc.title(), doc.explanation(), doc.causalChains()))
                .addPrefixIfError("Cannot read " + shape() + " document: ");
    }
}
