package com.flagship.payroll_ledger.ledger.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import lombok.Value;

import java.util.List;

@Value
public class WorkDaySelectionRequest {

    @NotEmpty(message = "At least one work day is required")
    List<@NotBlank String> workDayIds;
}
