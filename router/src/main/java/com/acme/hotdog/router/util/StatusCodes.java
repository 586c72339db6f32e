package com.acme.hotdog.router.util;

/**
 * HTTP status codes served by the status endpoint.
 */
public final class StatusCodes {

    public static final int OK = 200;
    public static final int NOT_FOUND = 404;
    public static final int METHOD_NOT_ALLOWED = 405;
    public static final int INTERNAL_ERROR = 500;

    private StatusCodes() {
    }
}
