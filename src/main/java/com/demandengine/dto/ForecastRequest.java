package com.demandengine.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

@Value
@Builder
@Jacksonized
public class ForecastRequest {

    @NotBlank(message = "tenantId is required")
    String tenantId;

    /** Absent for the company-wide scope. */
    String productId;

    @NotNull(message = "horizonDays is required")
    Integer horizonDays;
}
