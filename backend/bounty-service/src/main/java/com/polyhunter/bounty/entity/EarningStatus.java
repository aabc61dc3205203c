package com.polyhunter.bounty.entity;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import com.polyhunter.bounty.exception.UnknownValueException;

import java.util.EnumSet;
import java.util.Set;

/**
 * Payout status of an earning
 */
public enum EarningStatus implements PersistedValue {
    PENDING("pending"),
    PROCESSING("processing"),
    PAID("paid"),
    HELD("held");

    private final String value;

    EarningStatus(String value) {
        this.value = value;
    }

    @Override
    @JsonValue
    public String getValue() {
        return value;
    }

    /**
     * Statuses this one may move to in the payout workflow
     */
    public Set<EarningStatus> nextStatuses() {
        return switch (this) {
            case PENDING -> EnumSet.of(PROCESSING, HELD);
            case PROCESSING -> EnumSet.of(PAID, HELD, PENDING);
            case HELD -> EnumSet.of(PENDING);
            case PAID -> EnumSet.noneOf(EarningStatus.class);
        };
    }

    public boolean canMoveTo(EarningStatus target) {
        return nextStatuses().contains(target);
    }

    @JsonCreator
    public static EarningStatus fromValue(String value) {
        for (EarningStatus status : values()) {
            if (status.value.equalsIgnoreCase(value) || status.name().equalsIgnoreCase(value)) {
                return status;
            }
        }
        throw new UnknownValueException("Unknown earning status: " + value);
    }
}
