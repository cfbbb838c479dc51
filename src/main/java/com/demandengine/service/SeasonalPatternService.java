package com.demandengine.service;

import com.demandengine.config.EngineProperties;
import com.demandengine.engine.SeasonalPatternDetector;
import com.demandengine.engine.model.Observation;
import com.demandengine.engine.model.ScopeId;
import com.demandengine.engine.model.SeasonalProfile;
import com.demandengine.exception.NoDataException;
import com.demandengine.repository.SeriesRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Keeps one stored seasonal snapshot per scope. A snapshot older than the refresh
 * interval is recomputed from the supplied history and replaces the stored set.
 * Every read-recompute-store runs under the scope's lock.
 */
@Slf4j
@Service
public class SeasonalPatternService {

    private final SeriesRepository repository;
    private final SeasonalPatternDetector detector;
    private final ObservationHistoryService history;
    private final ScopeLocks scopeLocks;
    private final Duration refreshInterval;
    private final Clock clock;

    public SeasonalPatternService(SeriesRepository repository, SeasonalPatternDetector detector,
                                  ObservationHistoryService history, EngineProperties properties,
                                  ScopeLocks scopeLocks, Clock clock) {
        this.repository = repository;
        this.detector = detector;
        this.history = history;
        this.scopeLocks = scopeLocks;
        this.refreshInterval = properties.seasonal().refreshInterval();
        this.clock = clock;
    }

    public SeasonalProfile currentProfile(ScopeId scope, List<Observation> series) {
        return scopeLocks.withLock(scope, () -> {
            Instant now = clock.instant();
            Optional<SeasonalProfile> stored = repository.findPatterns(scope);
            if (stored.isPresent() && !isStale(stored.get(), now)) {
                return stored.get();
            }
            return store(detector.detect(scope, series, now));
        });
    }

    /** Snapshot for a scope, loading history only when the stored one is missing or stale. */
    public SeasonalProfile currentProfile(ScopeId scope) {
        return scopeLocks.withLock(scope, () -> {
            Optional<SeasonalProfile> stored = repository.findPatterns(scope);
            if (stored.isPresent() && !isStale(stored.get(), clock.instant())) {
                return stored.get();
            }
            return refresh(scope);
        });
    }

    public SeasonalProfile refresh(ScopeId scope) {
        return scopeLocks.withLock(scope, () -> {
            List<Observation> series = history.recent(scope);
            if (series.isEmpty()) {
                throw new NoDataException(scope.key());
            }
            return store(detector.detect(scope, series, clock.instant()));
        });
    }

    private SeasonalProfile store(SeasonalProfile profile) {
        SeasonalProfile stored = repository.replacePatterns(profile);
        log.info("Patterns refreshed | scope={} | weekly={} | monthly={} | computedAt={}",
                 profile.getScope(), profile.hasWeeklyPattern(), profile.hasMonthlyPattern(), profile.getComputedAt());
        return stored;
    }

    private boolean isStale(SeasonalProfile profile, Instant now) {
        return profile.getComputedAt() == null
            || Duration.between(profile.getComputedAt(), now).compareTo(refreshInterval) >= 0;
    }
}
