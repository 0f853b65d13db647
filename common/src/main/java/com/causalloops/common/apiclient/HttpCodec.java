package com.causalloops.common.apiclient;

import java.net.URI;
import java.net.http.HttpHeaders;
import java.net.http.HttpRequest;
import java.time.Duration;
import java.util.Map;

/** Builds the request for one call and turns a 2xx body back into the output type. */
public interface HttpCodec<In, Out> {
    HttpRequest buildRequest(URI url, Duration readTimeout, Map<String, String> headers, String corrId, In in);

    Out decode(int statusCode, String body, HttpHeaders headers);
}
