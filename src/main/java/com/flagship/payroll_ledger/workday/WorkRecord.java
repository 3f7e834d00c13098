package com.flagship.payroll_ledger.workday;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.LocalDate;

/**
 * One employee's record for one calendar day.
 *
 * {@code worked} separates a logged day from a merely scheduled one.
 * {@code paid == true} should mean exactly one payment record covers the day;
 * the ledger engine checks and repairs that, it does not assume it.
 *
 * Immutable: flag changes produce a new instance.
 */
@Value
@Builder(toBuilder = true)
public class WorkRecord {
    String id;
    String employeeId;
    LocalDate date;
    boolean worked;
    boolean paid;
    BigDecimal customAmount;
    String notes;

    /**
     * @return a copy with the paid flag set to {@code paid}
     */
    public WorkRecord withPaid(boolean paid) {
        return toBuilder().paid(paid).build();
    }
}
