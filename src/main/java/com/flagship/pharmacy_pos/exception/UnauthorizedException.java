package com.flagship.pharmacy_pos.exception;

/**
 * A credential or PIN check failed, or an approval was required and not supplied.
 */
public class UnauthorizedException extends PosException {

    public UnauthorizedException(String message) {
        super(ErrorKind.UNAUTHORIZED, message);
    }
}
