package com.acme.chatcore.http;

import java.nio.charset.StandardCharsets;

/**
 * An HTTP exchange that did not produce a usable response: a non-success status, a
 * transport failure, or a request still rate limited after the retry budget.
 */
public class RestException extends Exception {
    private final int status;
    private final byte[] body;

    public RestException(int status, byte[] body, String message) {
        super(message);
        this.status = status;
        this.body = body == null ? new byte[0] : body;
    }

    public RestException(String message, Throwable cause) {
        super(message, cause);
        this.status = -1;
        this.body = new byte[0];
    }

    /**
     * HTTP status, or {@code -1} when no response was received.
     */
    public int status() {
        return status;
    }

    public String body() {
        return new String(body, StandardCharsets.UTF_8);
    }
}
