package com.polyhunter.bounty.exception;

/**
 * Thrown when a submission or its parent request is not in a reviewable state
 */
public class NotReviewableException extends BountyException {

    public NotReviewableException(String message) {
        super(message);
    }
}
