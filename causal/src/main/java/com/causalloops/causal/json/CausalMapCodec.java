package com.causalloops.causal.json;

import com.causalloops.causal.CausalMap;
import com.causalloops.common.codec.Codec;
import com.causalloops.common.codec.HasObjectMapper;
import com.causalloops.common.errorsor.ErrorsOr;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Reads either wire shape into a {@link CausalMap}; writes the causal-chains shape.
 * <p>
 * The first adapter that accepts the document wins, so a document carrying both arrays is read as
 * chains. Failures are returned as errors, never thrown.
 */
public final class CausalMapCodec implements Codec<CausalMap, String>, HasObjectMapper {

    private final ObjectMapper mapper;
    private final List<CausalMapAdapter> adapters;

    public CausalMapCodec() {
        this(new ObjectMapper(), List.of(new CausalChainsAdapter(), new FlatRelationshipsAdapter()));
    }

    public CausalMapCodec(ObjectMapper baseMapper, List<CausalMapAdapter> adapters) {
        this.mapper = Objects.requireNonNull(baseMapper, "baseMapper").copy();
        this.mapper.findAndRegisterModules();
        this.mapper.configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
        this.adapters = List.copyOf(Objects.requireNonNull(adapters, "adapters"));
    }

    @Override
    public ErrorsOr<String> encode(CausalMap map) {
        try {
            return ErrorsOr.lift(mapper.writeValueAsString(CausalChainsDocument.of(map)));
        } catch (Exception e) {
            return ErrorsOr.error("Failed to encode causal map: {0}: {1}", e);
        }
    }

    @Override
    public ErrorsOr<CausalMap> decode(String json) {
        if (json == null || json.isBlank()) return ErrorsOr.error("Failed to decode causal map: empty input");
        final JsonNode root;
        try {
            root = mapper.readTree(json);
        } catch (Exception e) {
            return ErrorsOr.error("Failed to decode causal map: {0}: {1}", e);
        }
        if (root == null || !root.isObject()) {
            return ErrorsOr.error("Failed to decode causal map: expected a JSON object");
        }
        for (CausalMapAdapter adapter : adapters) {
            if (adapter.accepts(root)) return adapter.adapt(mapper, root);
        }
        return ErrorsOr.error("Failed to decode causal map: expected one of "
                + adapters.stream().map(CausalMapAdapter::shape).collect(Collectors.joining(", ")));
    }

    @Override
    public ObjectMapper objectMapper() {
        return mapper;
    }
}
