package com.flagship.payroll_ledger.ledger;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;

/**
 * Input to {@link LedgerEngine#createPaymentAndMark}.
 * {@code date} defaults to today, {@code notes} is optional.
 */
@Value
@Builder
public class CreatePaymentCommand {
    String employeeId;
    List<String> workDayIds;
    BigDecimal amount;
    String paymentType;
    String notes;
    LocalDate date;
}
