package com.polyhunter.bounty.entity;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import com.polyhunter.bounty.exception.UnknownValueException;

/**
 * Decision a reviewer takes on a submission
 */
public enum ReviewAction {
    ACCEPT("accept", SubmissionStatus.ACCEPTED, AdminRole.ADMIN),
    REJECT("reject", SubmissionStatus.REJECTED, AdminRole.REVIEWER),
    REVISION_REQUESTED("revision_requested", SubmissionStatus.REVISION_REQUESTED, AdminRole.REVIEWER);

    private final String value;
    private final SubmissionStatus resultingStatus;
    private final AdminRole requiredRole;

    ReviewAction(String value, SubmissionStatus resultingStatus, AdminRole requiredRole) {
        this.value = value;
        this.resultingStatus = resultingStatus;
        this.requiredRole = requiredRole;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    public SubmissionStatus getResultingStatus() {
        return resultingStatus;
    }

    public AdminRole getRequiredRole() {
        return requiredRole;
    }

    @JsonCreator
    public static ReviewAction fromValue(String value) {
        for (ReviewAction action : values()) {
            if (action.value.equalsIgnoreCase(value) || action.name().equalsIgnoreCase(value)) {
                return action;
            }
        }
        throw new UnknownValueException("Invalid review action: " + value);
    }
}
