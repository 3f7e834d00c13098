package com.flagship.payroll_ledger.ledger;

import com.flagship.payroll_ledger.payment.PaymentRecord;
import lombok.Value;

import java.math.RoundingMode;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Outcome of a guarded unmark.
 *
 * Either the days were unmarked ({@code applied}), or nothing was written
 * because payments cover them and the caller has to confirm first.
 */
@Value
public class UnmarkResult {
    boolean applied;
    List<String> unmarkedWorkDayIds;
    List<PaymentRecord> affectedPayments;
    boolean requiresConfirmation;
    String message;

    static UnmarkResult applied(List<String> unmarkedWorkDayIds) {
        return new UnmarkResult(true, List.copyOf(unmarkedWorkDayIds), List.of(), false,
            String.format("Unmarked %d work day(s) as paid", unmarkedWorkDayIds.size()));
    }

    static UnmarkResult confirmationRequired(List<PaymentRecord> affectedPayments) {
        String details = affectedPayments.stream()
            .map(payment -> String.format("£%s by %s on %s covering %d day(s)",
                payment.getAmount().setScale(2, RoundingMode.HALF_UP),
                payment.getPaymentType(),
                payment.getDate(),
                payment.getWorkDayIds().size()))
            .collect(Collectors.joining("; "));
        String message = String.format(
            "%d payment record(s) cover the selected work days: %s. Confirm to remove or shrink them.",
            affectedPayments.size(), details);
        return new UnmarkResult(false, List.of(), List.copyOf(affectedPayments), true, message);
    }
}
