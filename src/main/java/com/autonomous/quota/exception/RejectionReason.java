package com.autonomous.quota.exception;

import org.springframework.http.HttpStatus;

/**
 * Machine-readable reason a request was not served.
 */
public enum RejectionReason {
    UNAUTHORIZED(HttpStatus.UNAUTHORIZED),
    MALFORMED_REQUEST(HttpStatus.BAD_REQUEST),
    MODEL_NOT_ALLOWED(HttpStatus.BAD_REQUEST),
    BUDGET_EXHAUSTED(HttpStatus.TOO_MANY_REQUESTS),
    BUDGET_WOULD_BE_EXCEEDED(HttpStatus.TOO_MANY_REQUESTS),
    UPSTREAM_FAILURE(HttpStatus.INTERNAL_SERVER_ERROR);

    private final HttpStatus status;

    RejectionReason(HttpStatus status) {
        this.status = status;
    }

    public HttpStatus getStatus() {
        return status;
    }
}
