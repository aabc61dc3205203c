package com.polyhunter.bounty.exception;

/**
 * Thrown when the calling admin's role is below what an operation requires
 */
public class AccessDeniedException extends BountyException {

    public AccessDeniedException(String message) {
        super(message);
    }
}
