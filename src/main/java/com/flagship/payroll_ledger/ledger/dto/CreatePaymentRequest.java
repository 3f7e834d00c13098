package com.flagship.payroll_ledger.ledger.dto;

import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import lombok.Value;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;

/**
 * Request to record a payment for a set of worked days.
 *
 * {@code amount} may be omitted, in which case the resolved pay of the days
 * is used. {@code date} defaults to today.
 */
@Value
public class CreatePaymentRequest {

    @NotBlank(message = "Employee ID is required")
    String employeeId;

    @NotEmpty(message = "At least one work day is required")
    List<@NotBlank String> workDayIds;

    @DecimalMin(value = "0.01", message = "Amount must be greater than 0")
    BigDecimal amount;

    @NotBlank(message = "Payment type is required")
    String paymentType;

    String notes;

    LocalDate date;
}
