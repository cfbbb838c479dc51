package com.demandengine.entity;

import jakarta.persistence.*;
import lombok.*;

import java.time.Instant;
import java.util.UUID;

@Entity
@Table(
    name = "seasonal_patterns",
    uniqueConstraints = @UniqueConstraint(
        name = "uk_pattern_scope_type_period",
        columnNames = {"scope_key", "pattern_type", "period_index"}),
    indexes = @Index(name = "idx_pattern_scope", columnList = "scope_key")
)
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class SeasonalPatternRecord {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    @Column(updatable = false, nullable = false)
    private UUID id;

    @Column(name = "scope_key", nullable = false, length = 130)
    private String scopeKey;

    @Column(name = "tenant_id", nullable = false, length = 64)
    private String tenantId;

    @Column(name = "product_id", length = 64)
    private String productId;

    @Column(name = "pattern_type", nullable = false, length = 10)
    private String patternType;

    @Column(name = "period_index", nullable = false)
    private int periodIndex;

    @Column(name = "demand_multiplier", nullable = false)
    private double demandMultiplier;

    @Column(name = "confidence_score", nullable = false)
    private double confidenceScore;

    @Column(name = "sample_size", nullable = false)
    private int sampleSize;

    @Column(name = "computed_at", nullable = false)
    private Instant computedAt;
}
