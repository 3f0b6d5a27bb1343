package com.bank.bakeoff.exception;

/**
 * The request is valid but conflicts with the current state of the resource
 * (wrong status, out-of-order candidate, lost concurrent update).
 */
public class ConflictException extends RuntimeException {

    public ConflictException(String message) {
        super(message);
    }
}
