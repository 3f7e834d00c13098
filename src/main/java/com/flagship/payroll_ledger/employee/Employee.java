package com.flagship.payroll_ledger.employee;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.LocalDate;

/**
 * Employee as seen by the ledger.
 *
 * Only one prior wage is remembered: {@code previousWage} applies to work
 * dated before {@code wageChangeDate}, {@code dailyWage} from that date on.
 */
@Value
@Builder(toBuilder = true)
public class Employee {
    String id;
    String name;
    BigDecimal dailyWage;
    BigDecimal previousWage;
    LocalDate wageChangeDate;
    LocalDate startDate;
    String notes;

    public boolean hasWageHistory() {
        return wageChangeDate != null && previousWage != null;
    }
}
