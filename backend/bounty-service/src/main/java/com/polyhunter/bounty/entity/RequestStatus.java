package com.polyhunter.bounty.entity;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import com.polyhunter.bounty.exception.UnknownValueException;

import java.util.EnumSet;
import java.util.Set;

/**
 * Lifecycle status of a bounty request
 */
public enum RequestStatus implements PersistedValue {
    DRAFT("draft"),
    PENDING_REVIEW("pending_review"),
    PUBLISHED("published"),
    PAUSED("paused"),
    FULFILLED("fulfilled"),
    CLOSED("closed"),
    CANCELLED("cancelled");

    /**
     * Statuses whose in-flight submissions may still be reviewed
     */
    public static final Set<RequestStatus> REVIEWABLE = EnumSet.of(PUBLISHED, PAUSED, FULFILLED);

    /**
     * Statuses in which the pay terms may still be edited
     */
    public static final Set<RequestStatus> EDITABLE = EnumSet.of(DRAFT, PENDING_REVIEW);

    private final String value;

    RequestStatus(String value) {
        this.value = value;
    }

    @Override
    @JsonValue
    public String getValue() {
        return value;
    }

    @JsonCreator
    public static RequestStatus fromValue(String value) {
        for (RequestStatus status : values()) {
            if (status.value.equalsIgnoreCase(value) || status.name().equalsIgnoreCase(value)) {
                return status;
            }
        }
        throw new UnknownValueException("Unknown request status: " + value);
    }
}
