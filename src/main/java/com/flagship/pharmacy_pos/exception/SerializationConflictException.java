package com.flagship.pharmacy_pos.exception;

/**
 * The serializable scheduler rejected the transaction because of a
 * concurrent conflicting commit.
 */
public class SerializationConflictException extends PosException {

    public SerializationConflictException(String message, Throwable cause) {
        super(ErrorKind.SERIALIZATION_CONFLICT, message, cause);
    }
}
