package com.flagship.payroll_ledger.ledger.exception;

/**
 * A store read failed before the operation wrote anything.
 * Safe to retry as is.
 */
public class LedgerReadException extends LedgerException {

    public LedgerReadException(String message, Throwable cause) {
        super(message, cause);
    }
}
