package com.polyhunter.bounty.entity;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import com.polyhunter.bounty.exception.UnknownValueException;

import java.util.EnumSet;
import java.util.Set;

/**
 * Review status of a bounty submission
 */
public enum SubmissionStatus implements PersistedValue {
    SUBMITTED("submitted"),
    IN_REVIEW("in_review"),
    ACCEPTED("accepted"),
    REJECTED("rejected"),
    REVISION_REQUESTED("revision_requested");

    /**
     * Statuses a reviewer may act on
     */
    public static final Set<SubmissionStatus> REVIEWABLE = EnumSet.of(SUBMITTED, IN_REVIEW);

    private final String value;

    SubmissionStatus(String value) {
        this.value = value;
    }

    @Override
    @JsonValue
    public String getValue() {
        return value;
    }

    @JsonCreator
    public static SubmissionStatus fromValue(String value) {
        for (SubmissionStatus status : values()) {
            if (status.value.equalsIgnoreCase(value) || status.name().equalsIgnoreCase(value)) {
                return status;
            }
        }
        throw new UnknownValueException("Unknown submission status: " + value);
    }
}
