package com.flagship.payroll_ledger.employee;

import java.util.Optional;

/**
 * Read-only employee lookup. The ledger never writes employees.
 */
public interface EmployeeStore {

    Optional<Employee> get(String id);
}
