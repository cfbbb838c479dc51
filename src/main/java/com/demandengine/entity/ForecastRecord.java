package com.demandengine.entity;

import jakarta.persistence.*;
import lombok.*;

import java.time.Instant;
import java.time.LocalDate;
import java.util.UUID;

@Entity
@Table(
    name = "forecasts",
    uniqueConstraints = @UniqueConstraint(
        name = "uk_forecast_scope_date_horizon",
        columnNames = {"scope_key", "forecast_date", "horizon_days"}),
    indexes = {
        @Index(name = "idx_forecast_scope",     columnList = "scope_key"),
        @Index(name = "idx_forecast_date",      columnList = "forecast_date"),
        @Index(name = "idx_forecast_generated", columnList = "generated_at"),
    }
)
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class ForecastRecord {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    @Column(updatable = false, nullable = false)
    private UUID id;

    @Version
    private long version;

    @Column(name = "scope_key", nullable = false, length = 130)
    private String scopeKey;

    @Column(name = "tenant_id", nullable = false, length = 64)
    private String tenantId;

    @Column(name = "product_id", length = 64)
    private String productId;

    @Column(name = "forecast_date", nullable = false)
    private LocalDate forecastDate;

    @Column(name = "horizon_days", nullable = false)
    private int horizonDays;

    @Column(name = "lead_day", nullable = false)
    private int leadDay;

    @Column(nullable = false, length = 50)
    private String method;

    @Column(name = "predicted_demand", nullable = false)
    private double predictedDemand;

    @Column(name = "confidence_lower", nullable = false)
    private double confidenceLower;

    @Column(name = "confidence_upper", nullable = false)
    private double confidenceUpper;

    @Column(name = "confidence_score", nullable = false)
    private double confidenceScore;

    @Column(name = "insufficient_history")
    private boolean insufficientHistory;

    @Column(length = 20)
    private String trend;

    @Column(name = "generated_at", nullable = false)
    private Instant generatedAt;

    @Column(name = "observed_actual")
    private Double observedActual;

    @Column(name = "accuracy_score")
    private Double accuracyScore;

    @Column(name = "scored_at")
    private Instant scoredAt;

    public boolean isScored() {
        return accuracyScore != null;
    }
}
