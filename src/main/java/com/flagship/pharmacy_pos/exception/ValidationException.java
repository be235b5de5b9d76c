package com.flagship.pharmacy_pos.exception;

/**
 * Malformed input, rejected before any transaction is opened.
 */
public class ValidationException extends PosException {

    public ValidationException(String message) {
        super(ErrorKind.VALIDATION, message);
    }
}
