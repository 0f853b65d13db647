package com.causalloops.common.apiclient;

import com.causalloops.common.codec.Codec;

import java.net.URI;
import java.net.http.HttpHeaders;
import java.net.http.HttpRequest;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Map;
import java.util.Objects;
import java.util.function.Function;

/**
 * POSTs the input encoded as JSON and hands the raw response body to {@code decodeFn}.
 * Encoding failures are programming errors here and surface as {@link IllegalArgumentException}.
 */
public final class JsonPostCodec<In, Out> implements HttpCodec<In, Out> {

    private final Codec<In, String> bodyCodec;
    private final Function<String, Out> decodeFn;

    public JsonPostCodec(Codec<In, String> bodyCodec, Function<String, Out> decodeFn) {
        this.bodyCodec = Objects.requireNonNull(bodyCodec, "bodyCodec");
        this.decodeFn = Objects.requireNonNull(decodeFn, "decodeFn");
    }

    @Override
    public HttpRequest buildRequest(URI url, Duration readTimeout, Map<String, String> headers, String corrId, In in) {
        String body = bodyCodec.encode(in).fold(
                json -> json,
                errors -> {
                    throw new IllegalArgumentException("Cannot encode request body: " + errors);
                });

        HttpRequest.Builder b = HttpRequest.newBuilder(url)
                .timeout(readTimeout)
                .POST(HttpRequest.BodyPublishers.ofString(body, StandardCharsets.UTF_8));

        headers.forEach(b::header);
        if (corrId != null && !corrId.isBlank()) {
            b.header("traceparent", corrId);
        }
        return b.build();
    }

    @Override
    public Out decode(int statusCode, String body, HttpHeaders headers) {
        return decodeFn.apply(body);
    }
}
