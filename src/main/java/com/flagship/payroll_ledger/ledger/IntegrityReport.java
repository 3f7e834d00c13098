package com.flagship.payroll_ledger.ledger;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.payroll_ledger.payment.PaymentRecord;
import com.flagship.payroll_ledger.workday.WorkRecord;
import lombok.Value;

import java.util.List;

/**
 * Result of a full integrity scan.
 *
 * Orphaned work days are paid with no covering payment. Orphaned payments
 * cover at least one existing work day that is not marked paid.
 * {@code warnings} hold anomalies that repair does not fix and that do not
 * affect validity: double claims and references to deleted work days.
 */
@Value
public class IntegrityReport {
    List<WorkRecord> orphanedWorkDays;
    List<PaymentRecord> orphanedPayments;
    List<String> issues;
    List<String> warnings;

    @JsonProperty("isValid")
    public boolean isValid() {
        return orphanedWorkDays.isEmpty() && orphanedPayments.isEmpty();
    }
}
