package com.flagship.payroll_ledger.employee;

import lombok.Value;

import java.math.BigDecimal;

/**
 * Per-employee totals. {@code totalOwed} is earned pay minus the resolved
 * pay of days marked paid.
 */
@Value
public class EmployeeStats {
    String employeeId;
    int totalWorked;
    int totalPaid;
    BigDecimal totalEarned;
    BigDecimal totalOwed;
}
