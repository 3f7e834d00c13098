package com.flagship.payroll_ledger.employee;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.LocalDate;

/**
 * JPA entity for employees.
 *
 * The ledger only reads this table; employees are maintained by the
 * surrounding product. Attribute names match the stored document fields.
 */
@Entity
@Table(name = "employees")
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class EmployeeEntity {

    @Id
    @Column(nullable = false, updatable = false, length = 64)
    private String id;

    @Column(nullable = false)
    private String name;

    @Column(name = "daily_wage", nullable = false, precision = 19, scale = 2)
    private BigDecimal dailyWage;

    @Column(name = "previous_wage", precision = 19, scale = 2)
    private BigDecimal previousWage;

    @Column(name = "wage_change_date")
    private LocalDate wageChangeDate;

    @Column(name = "start_date")
    private LocalDate startDate;

    @Column(name = "notes")
    private String notes;

    static EmployeeEntity fromDomain(Employee employee) {
        return new EmployeeEntity(
            employee.getId(),
            employee.getName(),
            employee.getDailyWage(),
            employee.getPreviousWage(),
            employee.getWageChangeDate(),
            employee.getStartDate(),
            employee.getNotes()
        );
    }

    public Employee toDomain() {
        return Employee.builder()
            .id(id)
            .name(name)
            .dailyWage(dailyWage)
            .previousWage(previousWage)
            .wageChangeDate(wageChangeDate)
            .startDate(startDate)
            .notes(notes)
            .build();
    }
}
