package com.demandengine.repository;

import com.demandengine.entity.ForecastRecord;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.time.LocalDate;
import java.util.Collection;
import java.util.List;
import java.util.UUID;

public interface ForecastRecordRepository extends JpaRepository<ForecastRecord, UUID> {

    List<ForecastRecord> findByScopeKeyAndHorizonDaysAndForecastDateIn(
        String scopeKey, int horizonDays, Collection<LocalDate> forecastDates);

    List<ForecastRecord> findByScopeKeyAndForecastDateBetweenOrderByForecastDateAscHorizonDaysAsc(
        String scopeKey, LocalDate from, LocalDate to);

    @Query("""
        SELECT f FROM ForecastRecord f
        WHERE f.scopeKey = :scopeKey
          AND f.accuracyScore IS NOT NULL
          AND f.forecastDate BETWEEN :from AND :to
        ORDER BY f.forecastDate ASC
    """)
    List<ForecastRecord> findScored(
        @Param("scopeKey") String scopeKey,
        @Param("from") LocalDate from,
        @Param("to") LocalDate to);

    @Query("""
        SELECT f FROM ForecastRecord f
        WHERE f.scopeKey = :scopeKey
          AND f.accuracyScore IS NULL
          AND f.forecastDate <= :upTo
        ORDER BY f.forecastDate ASC
    """)
    List<ForecastRecord> findPending(
        @Param("scopeKey") String scopeKey,
        @Param("upTo") LocalDate upTo);
}
