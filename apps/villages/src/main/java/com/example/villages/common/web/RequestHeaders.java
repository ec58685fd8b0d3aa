package com.example.villages.common.web;

public final class RequestHeaders {

    /**
     * Authenticated user ID, set by the upstream gateway.
     */
    public static final String USER_ID = "X-User-Id";

    private RequestHeaders() {
    }
}
