package com.flagship.payroll_ledger.support;

import com.flagship.payroll_ledger.employee.Employee;
import com.flagship.payroll_ledger.payment.PaymentRecord;
import com.flagship.payroll_ledger.workday.WorkRecord;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.util.List;

/**
 * Small builders for ledger test data.
 */
public final class Fixtures {

    public static final String EMPLOYEE_ID = "emp-1";
    public static final LocalDate MONDAY = LocalDate.of(2024, 3, 4);

    private Fixtures() {
    }

    public static Employee employee(String dailyWage) {
        return Employee.builder()
            .id(EMPLOYEE_ID)
            .name("Sam Carter")
            .dailyWage(new BigDecimal(dailyWage))
            .startDate(MONDAY.minusMonths(6))
            .build();
    }

    public static WorkRecord workedDay(String id, int dayOffset) {
        return WorkRecord.builder()
            .id(id)
            .employeeId(EMPLOYEE_ID)
            .date(MONDAY.plusDays(dayOffset))
            .worked(true)
            .paid(false)
            .build();
    }

    public static WorkRecord paidDay(String id, int dayOffset) {
        return workedDay(id, dayOffset).withPaid(true);
    }

    public static PaymentRecord payment(String id, String amount, String... workDayIds) {
        return PaymentRecord.builder()
            .id(id)
            .employeeId(EMPLOYEE_ID)
            .workDayIds(List.of(workDayIds))
            .amount(new BigDecimal(amount))
            .paymentType("Cash")
            .date(MONDAY.plusDays(7))
            .createdAt(Instant.parse("2024-03-11T10:00:00Z"))
            .build();
    }

    public static void assertAmount(String expected, BigDecimal actual) {
        if (actual == null || new BigDecimal(expected).compareTo(actual) != 0) {
            throw new AssertionError("Expected amount " + expected + " but was " + actual);
        }
    }
}
