package com.demandengine.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;
import lombok.Value;

@Value
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class BatchItemResult {

    public enum Outcome { SUCCEEDED, FAILED }

    String tenantId;
    String productId;
    Outcome outcome;
    ForecastBundle bundle;
    String errorCode;
    String message;

    public static BatchItemResult succeeded(ScopeRef ref, ForecastBundle bundle) {
        return BatchItemResult.builder()
            .tenantId(ref.getTenantId())
            .productId(ref.getProductId())
            .outcome(Outcome.SUCCEEDED)
            .bundle(bundle)
            .build();
    }

    public static BatchItemResult failed(ScopeRef ref, String errorCode, String message) {
        return BatchItemResult.builder()
            .tenantId(ref.getTenantId())
            .productId(ref.getProductId())
            .outcome(Outcome.FAILED)
            .errorCode(errorCode)
            .message(message)
            .build();
    }
}
