package com.polyhunter.bounty.entity;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import com.polyhunter.bounty.exception.UnknownValueException;

/**
 * How a request pays for an accepted submission
 */
public enum PayType implements PersistedValue {
    PER_IMAGE("per_image"),
    FLAT("flat");

    private final String value;

    PayType(String value) {
        this.value = value;
    }

    @Override
    @JsonValue
    public String getValue() {
        return value;
    }

    @JsonCreator
    public static PayType fromValue(String value) {
        for (PayType type : values()) {
            if (type.value.equalsIgnoreCase(value) || type.name().equalsIgnoreCase(value)) {
                return type;
            }
        }
        throw new UnknownValueException("Unknown pay type: " + value);
    }
}
