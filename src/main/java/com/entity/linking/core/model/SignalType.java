package com.entity.linking.core.model;

/**
 * The identifying attribute a contact search is driven by.
 */
public enum SignalType {
    /** Prefix search on normalized phone digits. */
    PHONE,
    /** Domain search on e-mail endpoints. */
    EMAIL,
    /** Substring search on display names. */
    NAME
}
