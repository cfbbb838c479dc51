package com.demandengine.repository;

import com.demandengine.engine.model.Forecast;
import com.demandengine.engine.model.Observation;
import com.demandengine.engine.model.PatternType;
import com.demandengine.engine.model.ScopeId;
import com.demandengine.engine.model.SeasonalPattern;
import com.demandengine.engine.model.SeasonalProfile;
import com.demandengine.entity.DemandObservationRecord;
import com.demandengine.entity.SeasonalPatternRecord;
import com.demandengine.exception.ForecastImmutableException;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.boot.test.context.TestConfiguration;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Import;
import org.springframework.dao.DataIntegrityViolationException;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

import static com.demandengine.engine.SeriesFixtures.*;
import static org.assertj.core.api.Assertions.*;

@DataJpaTest
@Import({JpaSeriesRepository.class, JpaSeriesRepositoryTest.FixedClock.class})
class JpaSeriesRepositoryTest {

    private static final LocalDate START = LocalDate.of(2025, 3, 2);

    @TestConfiguration
    static class FixedClock {
        @Bean
        Clock clock() {
            return Clock.fixed(NOW, ZoneOffset.UTC);
        }
    }

    @Autowired JpaSeriesRepository repository;
    @Autowired DemandObservationRepository observationRecords;
    @Autowired ForecastRecordRepository forecastRecords;
    @Autowired SeasonalPatternRecordRepository patternRecords;

    @Test
    void saveForecasts_rerunSupersedesPendingRowsInPlace() {
        List<Forecast> first = repository.saveForecasts(forecasts(START, 50, 55, 60));
        List<Forecast> second = repository.saveForecasts(forecasts(START, 70, 75, 80));

        assertThat(second).extracting(Forecast::getId)
            .containsExactlyElementsOf(first.stream().map(Forecast::getId).toList());
        assertThat(repository.findForecasts(SCOPE, START, START.plusDays(2)))
            .extracting(Forecast::getPredictedDemand)
            .containsExactly(70.0, 75.0, 80.0);
    }

    @Test
    void saveForecasts_differentHorizonIsStoredSeparately() {
        repository.saveForecasts(forecasts(START, 50, 55, 60));
        repository.saveForecasts(forecasts(START, 40, 45));

        assertThat(repository.findForecasts(SCOPE, START, START))
            .extracting(Forecast::getHorizonDays)
            .containsExactly(2, 3);
    }

    @Test
    void saveForecasts_scoredRowBlocksWholeRun() {
        List<Forecast> stored = repository.saveForecasts(forecasts(START, 50, 55, 60));
        Forecast scored = repository.saveScored(stored.get(1).scored(50, 0.9));

        assertThatThrownBy(() -> repository.saveForecasts(forecasts(START, 70, 75, 80)))
            .isInstanceOf(ForecastImmutableException.class)
            .hasMessageContaining(START.plusDays(1).toString());

        Forecast reloaded = repository.findForecast(scored.getId()).orElseThrow();
        assertThat(reloaded.getPredictedDemand()).isEqualTo(55.0);
        assertThat(reloaded.getAccuracyScore()).isEqualTo(0.9);
        assertThat(repository.findForecast(stored.get(0).getId()).orElseThrow().getPredictedDemand())
            .isEqualTo(50.0);
    }

    @Test
    void saveScored_stampsScoringTimeFromClock() {
        Forecast stored = repository.saveForecasts(forecasts(START, 50)).get(0);

        repository.saveScored(stored.scored(50, 1.0));

        assertThat(forecastRecords.findById(stored.getId()).orElseThrow().getScoredAt()).isEqualTo(NOW);
    }

    @Test
    void saveScored_onlyOnce() {
        Forecast stored = repository.saveForecasts(forecasts(START, 50)).get(0);
        Forecast scored = repository.saveScored(stored.scored(48, 0.96));

        assertThat(scored.getObservedActual()).isEqualTo(48.0);
        assertThatThrownBy(() -> repository.saveScored(stored.scored(60, 0.8)))
            .isInstanceOf(ForecastImmutableException.class);
        assertThat(repository.findScoredForecasts(SCOPE, START, START)).singleElement()
            .satisfies(f -> assertThat(f.getAccuracyScore()).isEqualTo(0.96));
        assertThat(repository.findPendingForecasts(SCOPE, START)).isEmpty();
    }

    @Test
    void findPendingForecasts_cutsOffAtDate() {
        repository.saveForecasts(forecasts(START, 50, 55, 60));

        assertThat(repository.findPendingForecasts(SCOPE, START.plusDays(1)))
            .extracting(Forecast::getForecastDate)
            .containsExactly(START, START.plusDays(1));
    }

    @Test
    void replacePatterns_replacesWholeSnapshot() {
        Instant earlier = NOW.minusSeconds(86_400);
        repository.replacePatterns(SeasonalProfile.neutral(SCOPE, earlier));
        repository.replacePatterns(profileWithMondayPeak(NOW));

        SeasonalProfile loaded = repository.findPatterns(SCOPE).orElseThrow();

        assertThat(loaded.getComputedAt()).isEqualTo(NOW);
        assertThat(loaded.getWeekly()).hasSize(7);
        assertThat(loaded.getMonthly()).hasSize(12);
        assertThat(loaded.weeklyMultiplier(MONDAY)).isEqualTo(1.6);
        assertThat(loaded.hasWeeklyPattern()).isTrue();
        assertThat(repository.findPatterns(ScopeId.companyWide("acme"))).isEmpty();
    }

    @Test
    void patternTable_rejectsSecondCopyOfAPeriod() {
        repository.replacePatterns(SeasonalProfile.neutral(SCOPE, NOW));
        patternRecords.flush();

        SeasonalPatternRecord duplicate = SeasonalPatternRecord.builder()
            .scopeKey(SCOPE.key())
            .tenantId(SCOPE.tenantId())
            .productId(SCOPE.productId())
            .patternType(PatternType.WEEKLY.name())
            .periodIndex(0)
            .demandMultiplier(1.0)
            .confidenceScore(0.0)
            .sampleSize(0)
            .computedAt(NOW)
            .build();

        assertThatThrownBy(() -> patternRecords.saveAndFlush(duplicate))
            .isInstanceOf(DataIntegrityViolationException.class);
    }

    @Test
    void replacePatterns_repeatedRefreshKeepsOneCopy() {
        for (int i = 0; i < 3; i++) {
            repository.replacePatterns(SeasonalProfile.neutral(SCOPE, NOW.plusSeconds(i)));
        }

        assertThat(patternRecords.findByScopeKeyOrderByPatternTypeAscPeriodIndexAsc(SCOPE.key())).hasSize(19);
    }

    @Test
    void findObservations_filtersByScopeAndSortsByDate() {
        ScopeId other = ScopeId.companyWide("acme");
        observationRecords.save(observation(SCOPE, START.plusDays(2), 30, false));
        observationRecords.save(observation(SCOPE, START, 10, false));
        observationRecords.save(observation(SCOPE, START.plusDays(1), 20, true));
        observationRecords.save(observation(other, START, 99, false));

        List<Observation> series = repository.findObservations(SCOPE, START, START.plusDays(2));

        assertThat(series).extracting(Observation::demand).containsExactly(10.0, 20.0, 30.0);
        assertThat(series.get(1).imputed()).isTrue();
        assertThat(repository.findObservations(other, START, START)).singleElement()
            .satisfies(o -> assertThat(o.demand()).isEqualTo(99.0));
    }

    @Test
    void findForecast_unknownIdIsEmpty() {
        assertThat(repository.findForecast(UUID.randomUUID())).isEmpty();
    }

    private static SeasonalProfile profileWithMondayPeak(Instant computedAt) {
        List<SeasonalPattern> weekly = new ArrayList<>();
        for (int i = 0; i < 7; i++) {
            weekly.add(SeasonalPattern.builder()
                .scope(SCOPE).patternType(PatternType.WEEKLY).periodIndex(i)
                .demandMultiplier(i == PatternType.WEEKLY.periodIndex(MONDAY) ? 1.6 : 0.9)
                .confidenceScore(0.8).sampleSize(8).computedAt(computedAt)
                .build());
        }
        return SeasonalProfile.builder()
            .scope(SCOPE)
            .computedAt(computedAt)
            .weekly(weekly)
            .monthly(SeasonalProfile.neutralPatterns(SCOPE, PatternType.MONTHLY, computedAt, new int[12]))
            .build();
    }

    private static DemandObservationRecord observation(ScopeId scope, LocalDate date, double demand, boolean imputed) {
        return DemandObservationRecord.builder()
            .scopeKey(scope.key())
            .observationDate(date)
            .observedDemand(demand)
            .imputed(imputed)
            .build();
    }
}
