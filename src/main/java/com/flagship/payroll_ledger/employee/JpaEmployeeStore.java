package com.flagship.payroll_ledger.employee;

import com.flagship.payroll_ledger.store.StoreException;
import lombok.RequiredArgsConstructor;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.util.Optional;

/**
 * {@link EmployeeStore} backed by the employees table.
 */
@Component
@RequiredArgsConstructor
public class JpaEmployeeStore implements EmployeeStore {

    private final EmployeeRepository employeeRepository;

    @Override
    @Transactional(readOnly = true)
    public Optional<Employee> get(String id) {
        try {
            return employeeRepository.findById(id).map(EmployeeEntity::toDomain);
        } catch (DataAccessException e) {
            throw new StoreException("Failed to read employee " + id, e);
        }
    }

    /**
     * Saves an employee. Used by fixtures and by the surrounding product's
     * import path; the ledger engine itself never calls this.
     */
    @Transactional
    public void save(Employee employee) {
        try {
            employeeRepository.saveAndFlush(EmployeeEntity.fromDomain(employee));
        } catch (DataAccessException e) {
            throw new StoreException("Failed to write employee " + employee.getId(), e);
        }
    }
}
