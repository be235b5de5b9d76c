package com.flagship.pharmacy_pos.exception;

/**
 * Base exception for all POS engine failures.
 *
 * The exception message is the technical detail for logs; clients get
 * {@link ErrorKind#getUserMessage()}.
 */
public abstract class PosException extends RuntimeException {

    private final ErrorKind kind;

    protected PosException(ErrorKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    protected PosException(ErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public ErrorKind getKind() {
        return kind;
    }

    public boolean isRetryable() {
        return kind.isRetryable();
    }
}
