package com.causalloops.common.codec;

import com.causalloops.common.errorsor.ErrorsOr;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.util.Objects;

/**
 * JSON codec for one concrete type. Unknown properties are ignored on decode: model output
 * routinely carries fields the schema did not ask for.
 */
public final class JacksonTypedJsonCodec<T> implements Codec<T, String>, HasObjectMapper {
    private final ObjectMapper mapper;
    private final Class<T> klass;
    private final TypeReference<T> typeRef; // optional for generic types

    public JacksonTypedJsonCodec(Class<T> klass) {
        this(new ObjectMapper(), klass);
    }

    public JacksonTypedJsonCodec(ObjectMapper baseMapper, Class<T> klass) {
        this.mapper = configure(Objects.requireNonNull(baseMapper).copy());
        this.klass = Objects.requireNonNull(klass);
        this.typeRef = null;
    }

    /**
     * Use this ctor if T is generic (e.g., List<MyType>)
     */
    public JacksonTypedJsonCodec(TypeReference<T> typeRef) {
        this(new ObjectMapper(), typeRef);
    }

    public JacksonTypedJsonCodec(ObjectMapper baseMapper, TypeReference<T> typeRef) {
        this.mapper = configure(Objects.requireNonNull(baseMapper).copy());
        this.klass = null;
        this.typeRef = Objects.requireNonNull(typeRef);
    }

    private static ObjectMapper configure(ObjectMapper m) {
        m.findAndRegisterModules();
        m.configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
        return m;
    }

    @Override
    public ErrorsOr<String> encode(T value) {
        try {
            return ErrorsOr.lift(mapper.writeValueAsString(value));
        } catch (Exception e) {
            return ErrorsOr.error("Failed to encode to JSON: " + e.getMessage());
        }
    }

    @Override
    public ErrorsOr<T> decode(String json) {
        if (json == null || json.isBlank()) return ErrorsOr.error("Failed to decode from JSON: empty input");
        try {
            T value = klass != null ? mapper.readValue(json, klass) : mapper.readValue(json, typeRef);
            if (value == null) return ErrorsOr.error("Failed to decode from JSON: null document");
            return ErrorsOr.lift(value);
        } catch (Exception e) {
            return ErrorsOr.error("Failed to decode from JSON: " + e.getMessage());
        }
    }

    @Override
    public ObjectMapper objectMapper() {
        return mapper;
    }

}
