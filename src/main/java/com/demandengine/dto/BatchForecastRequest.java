package com.demandengine.dto;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.List;

@Value
@Builder
@Jacksonized
public class BatchForecastRequest {

    @NotNull(message = "horizonDays is required")
    Integer horizonDays;

    @NotEmpty(message = "scopes must contain at least one scope")
    List<@Valid ScopeRef> scopes;
}
