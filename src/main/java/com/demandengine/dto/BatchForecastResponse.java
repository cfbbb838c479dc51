package com.demandengine.dto;

import lombok.Builder;
import lombok.Value;

import java.util.List;

@Value
@Builder
public class BatchForecastResponse {
    int requested;
    int succeeded;
    int failed;
    List<BatchItemResult> results;

    public static BatchForecastResponse of(List<BatchItemResult> results) {
        int ok = (int) results.stream().filter(r -> r.getOutcome() == BatchItemResult.Outcome.SUCCEEDED).count();
        return BatchForecastResponse.builder()
            .requested(results.size())
            .succeeded(ok)
            .failed(results.size() - ok)
            .results(results)
            .build();
    }
}
