package com.flagship.payroll_ledger.ledger.exception;

import com.flagship.payroll_ledger.ledger.SagaReport;

import java.util.List;

/**
 * A rollback failed, so records are left inconsistent.
 *
 * {@link #getResidualIds()} names every record whose undo failed. Running the
 * integrity repair, or fixing those records by hand, is the only way back to
 * a consistent ledger.
 */
public class ManualInterventionRequiredException extends LedgerException {

    /**
     * The stage whose failure triggered the rollback.
     */
    public enum FailedStage {
        MARK_WORK_DAYS,
        CREATE_PAYMENT,
        UNMARK_WORK_DAYS
    }

    private final FailedStage failedStage;
    private final transient SagaReport report;

    public ManualInterventionRequiredException(FailedStage failedStage, SagaReport report, Throwable cause) {
        super(String.format("Rollback after %s failure left records inconsistent: %s (%s)",
            failedStage, report.residualRecordIds(), report.summary()), cause);
        this.failedStage = failedStage;
        this.report = report;
    }

    public FailedStage getFailedStage() {
        return failedStage;
    }

    public SagaReport getReport() {
        return report;
    }

    public List<String> getResidualIds() {
        return report.residualRecordIds();
    }
}
