package com.polyhunter.bounty.exception;

/**
 * Thrown when another reviewer changed the same request or submission first. The caller should
 * refetch and may retry.
 */
public class ConcurrentReviewException extends BountyException {

    public static final String DEFAULT_MESSAGE =
            "This request was modified by another admin. Please refresh and try again.";

    public ConcurrentReviewException() {
        super(DEFAULT_MESSAGE);
    }

    public ConcurrentReviewException(String message) {
        super(message);
    }
}
