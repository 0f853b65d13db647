package com.causalloops.common.codec;

import com.causalloops.common.errorsor.ErrorsOr;
import com.fasterxml.jackson.core.type.TypeReference;

public interface Codec<From, To> {

    ErrorsOr<To> encode(From from);

    ErrorsOr<From> decode(To to);

    static <T> Codec<T, String> clazzCodec(Class<T> klass) {
        return new JacksonTypedJsonCodec<>(klass);
    }

    static <T> Codec<T, String> typeRefCodec(TypeReference<T> typeRef) {
        return new JacksonTypedJsonCodec<>(typeRef);
    }
}
