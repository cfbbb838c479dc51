package com.demandengine.engine;

import com.demandengine.config.EngineProperties;
import com.demandengine.engine.model.StaffingRecommendation;
import org.springframework.stereotype.Component;

import java.time.LocalDate;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Capacity-based staffing: {@code max(minimumStaff, ceil(demand / unitsPerWorkerPerDay))}
 * per role.
 * <p>
 * Known limitation: this is a straight division. Variance in arrival timing and
 * uneven shift coverage are ignored; a queueing model would be a separate strategy.
 */
@Component
public class StaffingCalculator {

    private final Map<String, EngineProperties.Role> roles;

    public StaffingCalculator(EngineProperties properties) {
        this.roles = properties.staffing().roles();
    }

    public Map<String, Integer> requiredStaff(double predictedDemand) {
        return requiredStaff(predictedDemand, roles);
    }

    public Map<String, Integer> requiredStaff(double predictedDemand, Map<String, EngineProperties.Role> roleTable) {
        double demand = Math.max(0.0, predictedDemand);
        Map<String, Integer> required = new LinkedHashMap<>();
        roleTable.entrySet().stream()
            .sorted(Map.Entry.comparingByKey())
            .forEach(e -> {
                EngineProperties.Role role = e.getValue();
                int byThroughput = (int) Math.ceil(demand / role.unitsPerWorkerPerDay());
                required.put(e.getKey(), Math.max(role.minimumStaff(), byThroughput));
            });
        return required;
    }

    public StaffingRecommendation recommend(LocalDate date, double predictedDemand) {
        Map<String, Integer> required = requiredStaff(predictedDemand);
        String staff = required.entrySet().stream()
            .map(e -> e.getValue() + " " + e.getKey())
            .collect(Collectors.joining(", "));
        return StaffingRecommendation.builder()
            .date(date)
            .predictedDemand(predictedDemand)
            .requiredStaff(required)
            .reasoning("Based on predicted demand of " + Math.round(predictedDemand) + " units, recommend " + staff + ".")
            .build();
    }
}
