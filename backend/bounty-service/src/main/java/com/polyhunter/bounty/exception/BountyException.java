package com.polyhunter.bounty.exception;

/**
 * Base class for business failures surfaced to the admin boundary
 */
public abstract class BountyException extends RuntimeException {

    protected BountyException(String message) {
        super(message);
    }
}
