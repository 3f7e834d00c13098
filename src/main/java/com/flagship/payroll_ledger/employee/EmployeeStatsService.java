package com.flagship.payroll_ledger.employee;

import com.flagship.payroll_ledger.ledger.exception.LedgerReadException;
import com.flagship.payroll_ledger.ledger.exception.LedgerValidationException;
import com.flagship.payroll_ledger.workday.WorkRecord;
import com.flagship.payroll_ledger.workday.WorkRecordStore;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.util.List;
import java.util.Map;

/**
 * Worked, paid, earned and owed totals for one employee.
 *
 * Earned covers worked days; paid covers days whose paid flag is set,
 * both priced through the {@link WageResolver}.
 */
@Service
@RequiredArgsConstructor
public class EmployeeStatsService {

    private final EmployeeStore employeeStore;
    private final WorkRecordStore workRecordStore;
    private final WageResolver wageResolver;

    public EmployeeStats statsFor(String employeeId) {
        Employee employee;
        List<WorkRecord> workDays;
        try {
            employee = employeeStore.get(employeeId).orElse(null);
            workDays = employee == null ? List.of() : workRecordStore.listAll().stream()
                .filter(workDay -> employeeId.equals(workDay.getEmployeeId()))
                .toList();
        } catch (RuntimeException e) {
            throw new LedgerReadException("Failed to load records for employee " + employeeId, e);
        }
        if (employee == null) {
            throw new LedgerValidationException("Employee not found", Map.of(employeeId, "employee not found"));
        }

        List<WorkRecord> worked = workDays.stream().filter(WorkRecord::isWorked).toList();
        List<WorkRecord> paid = workDays.stream().filter(WorkRecord::isPaid).toList();

        BigDecimal totalEarned = wageResolver.totalFor(employee, worked);
        BigDecimal totalPaidAmount = wageResolver.totalFor(employee, paid);

        return new EmployeeStats(employeeId, worked.size(), paid.size(),
            totalEarned, totalEarned.subtract(totalPaidAmount));
    }
}
