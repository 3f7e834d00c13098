package com.flagship.payroll_ledger.payment;

import jakarta.persistence.CollectionTable;
import jakarta.persistence.Column;
import jakarta.persistence.ElementCollection;
import jakarta.persistence.Entity;
import jakarta.persistence.FetchType;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.JoinColumn;
import jakarta.persistence.OrderColumn;
import jakarta.persistence.PrePersist;
import jakarta.persistence.Table;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;

/**
 * JPA entity for payment records.
 *
 * Covered work day ids live in payment_work_days, ordered by position.
 * Only coverage and amount can change after insert; that is the shrink path.
 */
@Entity
@Table(
    name = "payments",
    indexes = @Index(name = "idx_payments_employee", columnList = "employee_id")
)
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class PaymentRecordEntity {

    @Id
    @Column(nullable = false, updatable = false, length = 64)
    private String id;

    @Column(name = "employee_id", nullable = false, updatable = false, length = 64)
    private String employeeId;

    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "payment_work_days", joinColumns = @JoinColumn(name = "payment_id"))
    @OrderColumn(name = "position")
    @Column(name = "work_day_id", nullable = false, length = 64)
    private List<String> workDayIds = new ArrayList<>();

    @Column(nullable = false, precision = 19, scale = 2)
    private BigDecimal amount;

    @Column(name = "payment_type", nullable = false, updatable = false, length = 64)
    private String paymentType;

    @Column(name = "payment_date", nullable = false, updatable = false)
    private LocalDate date;

    @Column(name = "notes")
    private String notes;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @PrePersist
    void onCreate() {
        if (createdAt == null) {
            createdAt = Instant.now();
        }
    }

    static PaymentRecordEntity fromDomain(PaymentRecord record) {
        return new PaymentRecordEntity(
            record.getId(),
            record.getEmployeeId(),
            new ArrayList<>(record.getWorkDayIds()),
            record.getAmount(),
            record.getPaymentType(),
            record.getDate(),
            record.getNotes(),
            record.getCreatedAt()
        );
    }

    public PaymentRecord toDomain() {
        return PaymentRecord.builder()
            .id(id)
            .employeeId(employeeId)
            .workDayIds(List.copyOf(workDayIds))
            .amount(amount)
            .paymentType(paymentType)
            .date(date)
            .notes(notes)
            .createdAt(createdAt)
            .build();
    }

    /**
     * Applies a coverage change. Everything else about a payment is fixed
     * once recorded.
     */
    void updateCoverageFromDomain(PaymentRecord record) {
        if (!id.equals(record.getId())) {
            throw new IllegalArgumentException(
                "Cannot update payment " + id + " from record " + record.getId());
        }
        this.workDayIds.clear();
        this.workDayIds.addAll(record.getWorkDayIds());
        this.amount = record.getAmount();
        this.notes = record.getNotes();
    }
}
