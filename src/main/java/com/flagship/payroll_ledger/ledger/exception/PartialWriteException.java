package com.flagship.payroll_ledger.ledger.exception;

import com.flagship.payroll_ledger.ledger.SagaReport;

/**
 * A multi-step write failed partway and every completed step was rolled back.
 */
public class PartialWriteException extends LedgerException {

    private final transient SagaReport report;

    public PartialWriteException(String message, SagaReport report, Throwable cause) {
        super(message + " (" + report.summary() + ")", cause);
        this.report = report;
    }

    public SagaReport getReport() {
        return report;
    }
}
