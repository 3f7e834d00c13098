package com.flagship.payroll_ledger.ledger.dto;

import com.flagship.payroll_ledger.ledger.ResolutionPolicy;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import lombok.Value;

import java.util.List;

/**
 * Confirmed unmark: the caller has seen the affected payments and chosen
 * whether to delete or shrink them.
 */
@Value
public class ForceUnmarkRequest {

    @NotEmpty(message = "At least one work day is required")
    List<@NotBlank String> workDayIds;

    @NotNull(message = "Resolution policy is required")
    ResolutionPolicy resolutionPolicy;
}
