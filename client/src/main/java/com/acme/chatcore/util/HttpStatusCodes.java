package com.acme.chatcore.util;

/**
 * HTTP status codes the dispatch path branches on.
 */
public final class HttpStatusCodes {

    public static final int OK = 200;
    public static final int NO_CONTENT = 204;

    public static final int BAD_REQUEST = 400;
    public static final int UNAUTHORIZED = 401;
    public static final int FORBIDDEN = 403;
    public static final int NOT_FOUND = 404;
    public static final int TOO_MANY_REQUESTS = 429;

    public static final int INTERNAL_ERROR = 500;
    public static final int BAD_GATEWAY = 502;
    public static final int SERVICE_UNAVAILABLE = 503;

    private HttpStatusCodes() {
    }

    public static boolean isSuccess(int status) {
        return status >= 200 && status < 300;
    }
}
