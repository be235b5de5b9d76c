package com.flagship.pharmacy_pos.exception;

/**
 * The resource is held by a different owner. A business conflict, never retried.
 */
public class ResourceOccupiedException extends PosException {

    public ResourceOccupiedException(String message) {
        super(ErrorKind.OCCUPIED, message);
    }
}
