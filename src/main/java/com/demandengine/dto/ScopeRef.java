package com.demandengine.dto;

import jakarta.validation.constraints.NotBlank;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

@Value
@Builder
@Jacksonized
public class ScopeRef {

    @NotBlank(message = "tenantId is required")
    String tenantId;

    String productId;
}
