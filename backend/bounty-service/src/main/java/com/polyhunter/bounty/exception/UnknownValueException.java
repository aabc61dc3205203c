package com.polyhunter.bounty.exception;

/**
 * Thrown when a client-supplied token names no known status, pay type or action
 */
public class UnknownValueException extends BountyException {

    public UnknownValueException(String message) {
        super(message);
    }
}
