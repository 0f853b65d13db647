package com.causalloops.common.apiclient;

/** A call completed but the server answered with a non-2xx status. */
public class HttpStatusException extends RuntimeException {
    private final int statusCode;
    private final String body;

    public HttpStatusException(String url, int statusCode, String body) {
        super("HTTP " + statusCode + " calling " + url + " body=" + body);
        this.statusCode = statusCode;
        this.body = body;
    }

    public int statusCode() {
        return statusCode;
    }

    public String body() {
        return body;
    }
}
