package com.flagship.pharmacy_pos.exception;

import org.springframework.http.HttpStatus;

/**
 * Stable failure categories surfaced to POS clients.
 *
 * The front end branches on {@link #isRetryable()} ("try again") versus the
 * terminal kinds, so each kind carries its own operator-facing message.
 */
public enum ErrorKind {
    VALIDATION("Invalid request data. Check the values and submit again.",
            HttpStatus.BAD_REQUEST, false),
    NOT_FOUND("The terminal or record was not found.",
            HttpStatus.NOT_FOUND, false),
    OCCUPIED("This terminal is in use by another cashier. Pick another terminal.",
            HttpStatus.CONFLICT, false),
    BUSY("The record is being modified right now. Try again in a moment.",
            HttpStatus.LOCKED, true),
    SERIALIZATION_CONFLICT("Another operation changed this data at the same time. Try again.",
            HttpStatus.CONFLICT, true),
    UNAUTHORIZED("Authorization failed. Ask a supervisor.",
            HttpStatus.UNAUTHORIZED, false),
    FAULT("Internal error. The operation was not applied.",
            HttpStatus.INTERNAL_SERVER_ERROR, false);

    private final String userMessage;
    private final HttpStatus httpStatus;
    private final boolean retryable;

    ErrorKind(String userMessage, HttpStatus httpStatus, boolean retryable) {
        this.userMessage = userMessage;
        this.httpStatus = httpStatus;
        this.retryable = retryable;
    }

    public String getUserMessage() {
        return userMessage;
    }

    public HttpStatus getHttpStatus() {
        return httpStatus;
    }

    public boolean isRetryable() {
        return retryable;
    }
}
