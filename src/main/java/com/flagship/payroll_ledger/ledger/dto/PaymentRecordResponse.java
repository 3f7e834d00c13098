package com.flagship.payroll_ledger.ledger.dto;

import com.flagship.payroll_ledger.payment.PaymentRecord;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.util.List;

/**
 * Payment as returned over HTTP. Field names match the stored document.
 */
@Value
@Builder
public class PaymentRecordResponse {
    String id;
    String employeeId;
    List<String> workDayIds;
    BigDecimal amount;
    String paymentType;
    LocalDate date;
    String notes;
    Instant createdAt;

    public static PaymentRecordResponse from(PaymentRecord payment) {
        return PaymentRecordResponse.builder()
            .id(payment.getId())
            .employeeId(payment.getEmployeeId())
            .workDayIds(payment.getWorkDayIds())
            .amount(payment.getAmount())
            .paymentType(payment.getPaymentType())
            .date(payment.getDate())
            .notes(payment.getNotes())
            .createdAt(payment.getCreatedAt())
            .build();
    }
}
