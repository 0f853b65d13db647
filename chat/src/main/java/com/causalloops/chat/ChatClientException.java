package com.causalloops.chat;

/** Transport-level failure of a chat completion: I/O, timeout, or a non-2xx answer. */
public class ChatClientException extends RuntimeException {
    private final int statusCode;

    public ChatClientException(String message, Throwable cause) {
        this(message, -1, cause);
    }

    public ChatClientException(String message, int statusCode, Throwable cause) {
        super(message, cause);
        this.statusCode = statusCode;
    }

    /** HTTP status, or -1 if the call never got an answer. */
    public int statusCode() {
        return statusCode;
    }
}
