package com.flagship.pharmacy_pos.exception;

/**
 * Unexpected storage or internal failure, including a failed mandatory audit write.
 */
public class InternalFaultException extends PosException {

    public InternalFaultException(String message, Throwable cause) {
        super(ErrorKind.FAULT, message, cause);
    }
}
