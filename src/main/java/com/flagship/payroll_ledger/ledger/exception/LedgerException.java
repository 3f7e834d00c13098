package com.flagship.payroll_ledger.ledger.exception;

/**
 * Base class for every failure the ledger engine reports.
 * Callers branch on the subclass, never on the message text.
 */
public abstract class LedgerException extends RuntimeException {

    protected LedgerException(String message) {
        super(message);
    }

    protected LedgerException(String message, Throwable cause) {
        super(message, cause);
    }
}
