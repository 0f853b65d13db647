package com.causalloops.common.apiclient;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.time.Duration;
import java.util.Objects;
import java.util.function.Function;

/**
 * Blocking HTTP/2 client that uses HttpClientConfig and a per-call url.
 */
public final class BlockingHttp2ApiClient<In, Out> implements ApiClient<In, Out> {
    private static final Logger log = LoggerFactory.getLogger(BlockingHttp2ApiClient.class);

    private final HttpClient http;
    private final HttpClientConfig<In, Out> config;

    public BlockingHttp2ApiClient(HttpClientConfig<In, Out> config, Function<HttpClientConfig<In, Out>, HttpClient> http) {
        this.config = Objects.requireNonNull(config, "config");
        this.http = http.apply(config);
    }

    public BlockingHttp2ApiClient(HttpClientConfig<In, Out> config) {
        this(config, c -> HttpClient.newBuilder()
                .version(HttpClient.Version.HTTP_2)
                .connectTimeout(c.connectTimeout())
                .build());
    }

    @Override
    public Out post(String url, String corrId, In in) {
        Objects.requireNonNull(url, "url must not be null");

        final URI uri = URI.create(url);

        try {
            var req = config.codec().buildRequest(uri, config.readTimeout(), config.headersFn().apply(uri, in), corrId, in);
            var res = http.send(req, HttpResponse.BodyHandlers.ofString());

            final int sc = res.statusCode();
            log.debug("POST {} -> {}", url, sc);

            if (sc >= 200 && sc < 300) {
                return config.codec().decode(sc, res.body(), res.headers());
            }

            throw new HttpStatusException(url, sc, truncate(res.body(), 512));

        } catch (HttpTimeoutException e) {
            throw new RuntimeException("Timeout calling " + url, e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new RuntimeException("Interrupted while calling " + url, e);
        } catch (IOException e) {
            throw new RuntimeException("Error calling " + url, e);
        }
    }

    static String truncate(String s, int max) {
        if (s == null) return null;
        return s.length() <= max ? s : s.substring(0, max) + "...";
    }
}
