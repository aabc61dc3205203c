package com.polyhunter.bounty.entity;

import jakarta.persistence.AttributeConverter;

/**
 * Maps a {@link PersistedValue} enum to its lower-case column value and back
 */
public abstract class PersistedValueConverter<E extends Enum<E> & PersistedValue>
        implements AttributeConverter<E, String> {

    private final Class<E> type;

    protected PersistedValueConverter(Class<E> type) {
        this.type = type;
    }

    @Override
    public String convertToDatabaseColumn(E attribute) {
        return attribute != null ? attribute.getValue() : null;
    }

    @Override
    public E convertToEntityAttribute(String dbData) {
        if (dbData == null) {
            return null;
        }
        for (E constant : type.getEnumConstants()) {
            if (constant.getValue().equals(dbData)) {
                return constant;
            }
        }
        throw new IllegalStateException("Unknown stored " + type.getSimpleName() + " value: " + dbData);
    }
}
