package com.demandengine.dto;

import com.demandengine.engine.model.Sensitivity;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

@Value
@Builder
@Jacksonized
public class RealtimeCheckRequest {

    @NotBlank(message = "tenantId is required")
    String tenantId;

    String productId;

    @NotNull(message = "currentValue is required")
    Double currentValue;

    @Builder.Default
    Sensitivity sensitivity = Sensitivity.MEDIUM;
}
