package com.polyhunter.bounty.exception;

/**
 * Thrown when a lifecycle or payout-status change is not permitted from the current status
 */
public class InvalidTransitionException extends BountyException {

    public InvalidTransitionException(String message) {
        super(message);
    }
}
