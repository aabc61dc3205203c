package com.polyhunter.bounty.entity;

import java.util.EnumSet;
import java.util.Set;

/**
 * Admin lifecycle actions on a bounty request, with the statuses each may start from
 */
public enum RequestAction {
    PUBLISH("publish", EnumSet.of(RequestStatus.DRAFT, RequestStatus.PENDING_REVIEW), RequestStatus.PUBLISHED),
    PAUSE("pause", EnumSet.of(RequestStatus.PUBLISHED), RequestStatus.PAUSED),
    UNPAUSE("unpause", EnumSet.of(RequestStatus.PAUSED), RequestStatus.PUBLISHED),
    CLOSE("close", EnumSet.of(RequestStatus.PUBLISHED, RequestStatus.PAUSED), RequestStatus.CLOSED),
    CANCEL("cancel", EnumSet.of(RequestStatus.DRAFT, RequestStatus.PENDING_REVIEW,
            RequestStatus.PUBLISHED, RequestStatus.PAUSED), RequestStatus.CANCELLED);

    private final String value;
    private final Set<RequestStatus> allowedFrom;
    private final RequestStatus target;

    RequestAction(String value, Set<RequestStatus> allowedFrom, RequestStatus target) {
        this.value = value;
        this.allowedFrom = allowedFrom;
        this.target = target;
    }

    public String getValue() {
        return value;
    }

    public Set<RequestStatus> getAllowedFrom() {
        return EnumSet.copyOf(allowedFrom);
    }

    public RequestStatus getTarget() {
        return target;
    }
}
