package com.flagship.payroll_ledger.ledger;

import com.flagship.payroll_ledger.payment.PaymentRecord;
import lombok.Value;

import java.util.List;

/**
 * Per-record outcome of a forced unmark.
 *
 * The force path is best-effort: a failed write is listed in
 * {@code failures} and the remaining writes still run. {@code complete}
 * is true only when every write succeeded.
 */
@Value
public class ForceUnmarkResult {
    ResolutionPolicy resolutionPolicy;
    List<String> deletedPaymentIds;
    List<PaymentRecord> updatedPayments;
    List<String> unmarkedWorkDayIds;
    List<Failure> failures;

    public boolean isComplete() {
        return failures.isEmpty();
    }

    @Value
    public static class Failure {
        String recordId;
        String operation;
        String message;
    }
}
