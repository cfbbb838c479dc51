package com.demandengine.dto;

import com.demandengine.engine.model.AnomalyFinding;
import com.demandengine.engine.model.AnomalyMethod;
import com.demandengine.engine.model.ScopeId;
import com.demandengine.engine.model.Severity;
import com.fasterxml.jackson.annotation.JsonFormat;
import lombok.Builder;
import lombok.Value;

import java.time.LocalDate;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

@Value
@Builder
public class AnomalyReport {
    ScopeId scope;
    @JsonFormat(pattern = "yyyy-MM-dd")
    LocalDate periodStart;
    @JsonFormat(pattern = "yyyy-MM-dd")
    LocalDate periodEnd;
    Set<AnomalyMethod> methods;
    List<AnomalyFinding> findings;
    Summary summary;

    @Value
    @Builder
    public static class Summary {
        int total;
        int highSeverity;
        Map<AnomalyMethod, Integer> byMethod;

        public static Summary of(Set<AnomalyMethod> methods, List<AnomalyFinding> findings) {
            Map<AnomalyMethod, Integer> byMethod = new EnumMap<>(AnomalyMethod.class);
            methods.forEach(m -> byMethod.put(m, 0));
            findings.forEach(f -> byMethod.merge(f.getMethod(), 1, Integer::sum));
            return Summary.builder()
                .total(findings.size())
                .highSeverity((int) findings.stream().filter(f -> f.getSeverity() == Severity.HIGH).count())
                .byMethod(byMethod)
                .build();
        }
    }
}
