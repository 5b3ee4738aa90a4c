package com.prakash.studyplanner.controller;

import com.prakash.studyplanner.exception.UnauthorizedException;

/**
 * Resolves the calling user from the identity header set by the authenticating gateway.
 */
final class RequestUser {

    static final String HEADER = "X-User-Id";

    private RequestUser() {
    }

    static String require(String headerValue) {
        if (headerValue == null || headerValue.isBlank()) {
            throw new UnauthorizedException("Unauthorized");
        }
        return headerValue.trim();
    }
}
