package com.polyhunter.bounty.exception;

import java.util.UUID;

/**
 * Thrown when a request, submission or earning does not exist
 */
public class NotFoundException extends BountyException {

    public NotFoundException(String message) {
        super(message);
    }

    public static NotFoundException of(String kind, UUID id) {
        return new NotFoundException(kind + " not found: " + id);
    }
}
