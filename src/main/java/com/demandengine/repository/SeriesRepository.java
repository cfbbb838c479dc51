package com.demandengine.repository;

import com.demandengine.engine.model.Forecast;
import com.demandengine.engine.model.Observation;
import com.demandengine.engine.model.ScopeId;
import com.demandengine.engine.model.SeasonalProfile;

import java.time.LocalDate;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Storage port of the engine. Implementations return observations sorted ascending
 * by date and never modify them.
 */
public interface SeriesRepository {

    List<Observation> findObservations(ScopeId scope, LocalDate from, LocalDate to);

    /** Stored forecasts of a scope whose forecast date falls in {@code [from, to]}. */
    List<Forecast> findForecasts(ScopeId scope, LocalDate from, LocalDate to);

    Optional<Forecast> findForecast(UUID id);

    /**
     * Persists a generation run. A pending record with the same scope, date and
     * horizon is superseded in place and keeps its id. When any of those records is
     * already scored nothing is written and
     * {@link com.demandengine.exception.ForecastImmutableException} is raised.
     */
    List<Forecast> saveForecasts(List<Forecast> forecasts);

    /**
     * Records the actual and score of a pending forecast. A stored record that is
     * already scored is rejected.
     */
    Forecast saveScored(Forecast forecast);

    List<Forecast> findScoredForecasts(ScopeId scope, LocalDate from, LocalDate to);

    List<Forecast> findPendingForecasts(ScopeId scope, LocalDate upTo);

    Optional<SeasonalProfile> findPatterns(ScopeId scope);

    /** Replaces every stored pattern of the profile's scope with the profile. */
    SeasonalProfile replacePatterns(SeasonalProfile profile);
}
