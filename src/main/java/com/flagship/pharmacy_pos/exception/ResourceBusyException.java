package com.flagship.pharmacy_pos.exception;

/**
 * Row lock held by a concurrent unit of work (NOWAIT failed).
 */
public class ResourceBusyException extends PosException {

    public ResourceBusyException(String message) {
        super(ErrorKind.BUSY, message);
    }

    public ResourceBusyException(String message, Throwable cause) {
        super(ErrorKind.BUSY, message, cause);
    }
}
