package com.flagship.payroll_ledger.ledger.exception;

import com.flagship.payroll_ledger.ledger.SagaReport;

/**
 * Work days were marked paid but the payment record could not be written.
 * The marks were rolled back.
 */
public class PaymentCreateException extends LedgerException {

    private final transient SagaReport report;

    public PaymentCreateException(String message, SagaReport report, Throwable cause) {
        super(message + " (" + report.summary() + ")", cause);
        this.report = report;
    }

    public SagaReport getReport() {
        return report;
    }
}
