package com.flagship.pharmacy_pos.exception;

/**
 * Thrown when a referenced terminal, session, product or user does not exist.
 */
public class ResourceNotFoundException extends PosException {

    public ResourceNotFoundException(String resource, Object id) {
        super(ErrorKind.NOT_FOUND, resource + " not found: " + id);
    }
}
