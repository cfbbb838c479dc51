package com.demandengine.service;

import com.demandengine.config.EngineProperties;
import com.demandengine.engine.model.Observation;
import com.demandengine.engine.model.ScopeId;
import com.demandengine.repository.SeriesRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDate;
import java.util.Comparator;
import java.util.List;

/**
 * Loads observation series in ascending date order, whatever order the repository
 * returns them in.
 */
@Service
@RequiredArgsConstructor
public class ObservationHistoryService {

    private final SeriesRepository repository;
    private final EngineProperties properties;
    private final Clock clock;

    public LocalDate today() {
        return LocalDate.now(clock);
    }

    /** The configured lookback window ending today. */
    public List<Observation> recent(ScopeId scope) {
        LocalDate today = today();
        return between(scope, today.minusDays(properties.history().lookbackDays()), today);
    }

    public List<Observation> between(ScopeId scope, LocalDate from, LocalDate to) {
        return repository.findObservations(scope, from, to).stream()
            .sorted(Comparator.comparing(Observation::date))
            .toList();
    }
}
