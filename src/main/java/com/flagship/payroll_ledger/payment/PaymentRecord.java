package com.flagship.payroll_ledger.payment;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.UUID;

/**
 * A payment that claims to cover a set of work days.
 *
 * Key principles:
 * - {@code workDayIds} is duplicate-free, keeps insertion order and is never
 *   empty while the record exists (an empty payment is deleted instead)
 * - {@code amount} should equal the resolved pay of the covered days
 * - Instances are immutable; coverage changes produce a new record
 */
@Value
@Builder(toBuilder = true)
public class PaymentRecord {
    String id;
    String employeeId;
    List<String> workDayIds;
    BigDecimal amount;
    String paymentType;
    LocalDate date;
    String notes;
    Instant createdAt;

    /**
     * Creates a new payment record with a fresh id.
     * Blank notes are dropped rather than stored.
     */
    public static PaymentRecord create(String employeeId, Collection<String> workDayIds, BigDecimal amount,
                                       String paymentType, LocalDate date, String notes, Instant createdAt) {
        return PaymentRecord.builder()
            .id(UUID.randomUUID().toString())
            .employeeId(employeeId)
            .workDayIds(distinct(workDayIds))
            .amount(amount)
            .paymentType(paymentType)
            .date(date)
            .notes(notes == null || notes.isBlank() ? null : notes.trim())
            .createdAt(createdAt)
            .build();
    }

    public boolean covers(String workDayId) {
        return workDayIds.contains(workDayId);
    }

    public boolean coversAny(Collection<String> ids) {
        return ids.stream().anyMatch(this::covers);
    }

    /**
     * @return the covered ids that are not in {@code removed}, in original order
     */
    public List<String> remainingAfterRemoving(Collection<String> removed) {
        List<String> remaining = new ArrayList<>(workDayIds);
        remaining.removeAll(removed);
        return List.copyOf(remaining);
    }

    /**
     * @return a copy covering only {@code remaining} with the given amount
     */
    public PaymentRecord withCoverage(List<String> remaining, BigDecimal newAmount) {
        if (remaining.isEmpty()) {
            throw new IllegalArgumentException("Payment " + id + " cannot cover zero work days");
        }
        return toBuilder()
            .workDayIds(distinct(remaining))
            .amount(newAmount)
            .build();
    }

    private static List<String> distinct(Collection<String> ids) {
        return List.copyOf(new LinkedHashSet<>(ids));
    }
}
