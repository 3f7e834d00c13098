package com.flagship.payroll_ledger.workday;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.Table;
import jakarta.persistence.UniqueConstraint;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.LocalDate;

/**
 * JPA entity for work records.
 *
 * No setters: state flows in through {@link #fromDomain} and
 * {@link #updateFromDomain} only. Id and employee never change after insert.
 */
@Entity
@Table(
    name = "work_days",
    indexes = @Index(name = "idx_work_days_employee", columnList = "employee_id"),
    uniqueConstraints = @UniqueConstraint(name = "uq_work_days_employee_date",
        columnNames = {"employee_id", "work_date"})
)
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class WorkRecordEntity {

    @Id
    @Column(nullable = false, updatable = false, length = 64)
    private String id;

    @Column(name = "employee_id", nullable = false, updatable = false, length = 64)
    private String employeeId;

    @Column(name = "work_date", nullable = false)
    private LocalDate date;

    @Column(nullable = false)
    private boolean worked;

    @Column(nullable = false)
    private boolean paid;

    @Column(name = "custom_amount", precision = 19, scale = 2)
    private BigDecimal customAmount;

    @Column(name = "notes")
    private String notes;

    static WorkRecordEntity fromDomain(WorkRecord record) {
        return new WorkRecordEntity(
            record.getId(),
            record.getEmployeeId(),
            record.getDate(),
            record.isWorked(),
            record.isPaid(),
            record.getCustomAmount(),
            record.getNotes()
        );
    }

    public WorkRecord toDomain() {
        return WorkRecord.builder()
            .id(id)
            .employeeId(employeeId)
            .date(date)
            .worked(worked)
            .paid(paid)
            .customAmount(customAmount)
            .notes(notes)
            .build();
    }

    /**
     * Copies the mutable fields of {@code record} onto this entity.
     * The record's id must match.
     */
    void updateFromDomain(WorkRecord record) {
        if (!id.equals(record.getId())) {
            throw new IllegalArgumentException(
                "Cannot update work day " + id + " from record " + record.getId());
        }
        this.date = record.getDate();
        this.worked = record.isWorked();
        this.paid = record.isPaid();
        this.customAmount = record.getCustomAmount();
        this.notes = record.getNotes();
    }
}
