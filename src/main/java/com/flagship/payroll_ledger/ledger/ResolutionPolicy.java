package com.flagship.payroll_ledger.ledger;

import com.fasterxml.jackson.annotation.JsonCreator;

import java.util.Locale;

/**
 * What a forced unmark does to a payment that still covers other days.
 * A payment left with no days is always deleted.
 */
public enum ResolutionPolicy {
    DELETE,
    SHRINK;

    /**
     * Case-insensitive, so "delete" and "shrink" are accepted.
     */
    @JsonCreator
    public static ResolutionPolicy fromValue(String value) {
        if (value == null) {
            return null;
        }
        return valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
