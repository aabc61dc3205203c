package com.polyhunter.bounty.entity;

/**
 * Enum whose persisted and wire form is a lower-case token rather than its constant name
 */
public interface PersistedValue {

    String getValue();
}
