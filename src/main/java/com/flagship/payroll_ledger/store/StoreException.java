package com.flagship.payroll_ledger.store;

/**
 * Raised by a record store when a single-document read or write fails.
 *
 * Stores make no cross-record guarantees, so callers that chain several
 * writes must track what succeeded themselves.
 */
public class StoreException extends RuntimeException {

    public StoreException(String message) {
        super(message);
    }

    public StoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
