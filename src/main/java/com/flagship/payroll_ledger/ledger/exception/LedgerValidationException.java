package com.flagship.payroll_ledger.ledger.exception;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Bad input. Nothing was written.
 *
 * {@link #getOffendingIds()} maps each rejected record id to the reason it
 * was rejected, in the order the ids were supplied.
 */
public class LedgerValidationException extends LedgerException {

    private final Map<String, String> offendingIds;

    public LedgerValidationException(String message) {
        this(message, Map.of());
    }

    public LedgerValidationException(String message, Map<String, String> offendingIds) {
        super(offendingIds.isEmpty() ? message : message + ": " + offendingIds);
        this.offendingIds = Collections.unmodifiableMap(new LinkedHashMap<>(offendingIds));
    }

    public Map<String, String> getOffendingIds() {
        return offendingIds;
    }
}
