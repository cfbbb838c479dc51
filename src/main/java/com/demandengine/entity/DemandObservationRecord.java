package com.demandengine.entity;

import jakarta.persistence.*;
import lombok.*;

import java.time.LocalDate;
import java.util.UUID;

/**
 * Daily demand as supplied by the surrounding system. The engine only reads it.
 */
@Entity
@Table(
    name = "demand_observations",
    uniqueConstraints = @UniqueConstraint(
        name = "uk_observation_scope_date",
        columnNames = {"scope_key", "observation_date"})
)
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class DemandObservationRecord {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    @Column(updatable = false, nullable = false)
    private UUID id;

    @Column(name = "scope_key", nullable = false, length = 130)
    private String scopeKey;

    @Column(name = "observation_date", nullable = false)
    private LocalDate observationDate;

    @Column(name = "observed_demand", nullable = false)
    private double observedDemand;

    private boolean imputed;
}
