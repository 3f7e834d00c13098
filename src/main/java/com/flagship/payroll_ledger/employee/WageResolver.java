package com.flagship.payroll_ledger.employee;

import com.flagship.payroll_ledger.workday.WorkRecord;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.util.Collection;

/**
 * Resolves the pay owed for a single work day.
 *
 * Precedence: the day's custom amount, then the previous wage for days
 * before the wage change date, then the current daily wage.
 */
@Component
public class WageResolver {

    public BigDecimal resolveAmount(Employee employee, WorkRecord workRecord) {
        if (workRecord.getCustomAmount() != null) {
            return workRecord.getCustomAmount();
        }
        if (employee.hasWageHistory() && workRecord.getDate().isBefore(employee.getWageChangeDate())) {
            return employee.getPreviousWage();
        }
        return employee.getDailyWage();
    }

    public BigDecimal totalFor(Employee employee, Collection<WorkRecord> workRecords) {
        return workRecords.stream()
            .map(record -> resolveAmount(employee, record))
            .reduce(BigDecimal.ZERO, BigDecimal::add);
    }
}
