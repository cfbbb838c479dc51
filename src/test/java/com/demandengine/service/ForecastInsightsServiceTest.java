package com.demandengine.service;

import com.demandengine.config.EngineProperties;
import com.demandengine.dto.AnomalyReport;
import com.demandengine.dto.ScoringSummary;
import com.demandengine.engine.AccuracyScorer;
import com.demandengine.engine.AnomalyDetector;
import com.demandengine.engine.model.AccuracyMetric;
import com.demandengine.engine.model.AnomalyMethod;
import com.demandengine.engine.model.Forecast;
import com.demandengine.engine.model.Observation;
import com.demandengine.engine.model.RealtimeAssessment;
import com.demandengine.engine.model.Severity;
import com.demandengine.exception.ForecastImmutableException;
import com.demandengine.exception.ForecastNotFoundException;
import com.demandengine.exception.InvalidObservationException;
import com.demandengine.exception.InvalidPeriodException;
import com.demandengine.exception.NoDataException;
import com.demandengine.repository.SeriesRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.LocalDate;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;

import static com.demandengine.engine.SeriesFixtures.*;
import static org.assertj.core.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class ForecastInsightsServiceTest {

    private static final LocalDate TODAY = LocalDate.of(2025, 3, 1);

    @Mock SeriesRepository repository;
    @Mock ObservationHistoryService history;
    @Mock SeasonalPatternService patterns;

    private ForecastInsightsService service;

    @BeforeEach
    void setUp() {
        EngineProperties properties = EngineProperties.defaults();
        service = new ForecastInsightsService(repository, history, patterns,
            new AccuracyScorer(properties), new AnomalyDetector(properties), properties);
        lenient().when(history.today()).thenReturn(TODAY);
        lenient().when(repository.saveScored(any())).thenAnswer(inv -> inv.getArgument(0));
    }

    @Test
    void recordActual_scoresPendingForecast() {
        Forecast forecast = pending(TODAY, 7, 1, 95);
        when(repository.findForecast(forecast.getId())).thenReturn(Optional.of(forecast));

        Forecast scored = service.recordActual(forecast.getId(), 100);

        assertThat(scored.getObservedActual()).isEqualTo(100.0);
        assertThat(scored.getAccuracyScore()).isEqualTo(0.95);
        assertThat(scored.isScored()).isTrue();
    }

    @Test
    void recordActual_unknownId_raisesNotFound() {
        UUID id = UUID.randomUUID();
        when(repository.findForecast(id)).thenReturn(Optional.empty());

        assertThatThrownBy(() -> service.recordActual(id, 10)).isInstanceOf(ForecastNotFoundException.class);
    }

    @Test
    void recordActual_alreadyScored_leavesStoredScoreAlone() {
        Forecast scored = scored(95, 100);
        when(repository.findForecast(scored.getId())).thenReturn(Optional.of(scored));

        assertThatThrownBy(() -> service.recordActual(scored.getId(), 120))
            .isInstanceOf(ForecastImmutableException.class);
        verify(repository, never()).saveScored(any());
    }

    @Test
    void scorePending_onlyScoresDaysWithRealObservations() {
        LocalDate d1 = TODAY.minusDays(3);
        LocalDate d2 = TODAY.minusDays(2);
        LocalDate d3 = TODAY.minusDays(1);
        when(repository.findPendingForecasts(SCOPE, TODAY)).thenReturn(List.of(
            pending(d1, 3, 1, 95), pending(d2, 3, 2, 80), pending(d3, 3, 3, 70)));
        when(history.between(SCOPE, d1, TODAY)).thenReturn(List.of(
            Observation.of(d1, 100),
            new Observation(d2, 80, true)));

        ScoringSummary summary = service.scorePending(SCOPE, null);

        assertThat(summary.getUpTo()).isEqualTo(TODAY);
        assertThat(summary.getPending()).isEqualTo(3);
        assertThat(summary.getScored()).isEqualTo(1);
        assertThat(summary.getAwaitingActual()).isEqualTo(2);
        assertThat(summary.getScoredForecasts()).singleElement().satisfies(f -> {
            assertThat(f.getForecastDate()).isEqualTo(d1);
            assertThat(f.getAccuracyScore()).isEqualTo(0.95);
        });
        verify(repository, times(1)).saveScored(any());
    }

    @Test
    void scorePending_nothingPending_skipsHistoryLookup() {
        when(repository.findPendingForecasts(SCOPE, TODAY)).thenReturn(List.of());

        ScoringSummary summary = service.scorePending(SCOPE, TODAY);

        assertThat(summary.getPending()).isZero();
        assertThat(summary.getScoredForecasts()).isEmpty();
        verify(history, never()).between(any(), any(), any());
    }

    @Test
    void accuracy_defaultsToTrailingThirtyDays() {
        when(repository.findScoredForecasts(SCOPE, TODAY.minusDays(29), TODAY))
            .thenReturn(List.of(scored(90, 100), scored(100, 100)));

        AccuracyMetric metric = service.accuracy(SCOPE, null, null);

        assertThat(metric.getPeriodStart()).isEqualTo(TODAY.minusDays(29));
        assertThat(metric.getSampleSize()).isEqualTo(2);
        assertThat(metric.getMae()).isEqualTo(5.0);
        assertThat(metric.getAccuracyRateWithinTolerance()).isEqualTo(1.0);
    }

    @Test
    void accuracy_invertedPeriod_rejected() {
        assertThatThrownBy(() -> service.accuracy(SCOPE, TODAY, TODAY.minusDays(1)))
            .isInstanceOf(InvalidPeriodException.class);
        verifyNoInteractions(repository);
    }

    @Test
    void anomalies_reportsOnlyFindingsInsideThePeriod() {
        List<Observation> series = constant(TODAY.minusDays(29), 30, 50);
        series = replace(series, 10, 120);
        series = replace(series, 29, 200);
        when(history.between(eq(SCOPE), any(), eq(TODAY))).thenReturn(series);

        AnomalyReport report = service.anomalies(SCOPE, TODAY.minusDays(6), TODAY, Set.of(AnomalyMethod.STATISTICAL));

        assertThat(report.getFindings()).singleElement().satisfies(f -> {
            assertThat(f.getDate()).isEqualTo(TODAY);
            assertThat(f.getSeverity()).isEqualTo(Severity.HIGH);
        });
        assertThat(report.getSummary().getTotal()).isEqualTo(1);
        assertThat(report.getSummary().getHighSeverity()).isEqualTo(1);
        assertThat(report.getSummary().getByMethod()).containsExactly(entry(AnomalyMethod.STATISTICAL, 1));
        verifyNoInteractions(patterns);
    }

    @Test
    void anomalies_noMethodsMeansAll() {
        when(history.between(eq(SCOPE), any(), eq(TODAY))).thenReturn(List.of());

        AnomalyReport report = service.anomalies(SCOPE, null, null, null);

        assertThat(report.getMethods()).containsExactlyInAnyOrder(AnomalyMethod.values());
        assertThat(report.getFindings()).isEmpty();
        assertThat(report.getSummary().getByMethod()).containsOnlyKeys(AnomalyMethod.values());
    }

    @Test
    void check_flagsSurgeAgainstRecentHistory() {
        List<Observation> recent = of(TODAY.minusDays(10), 40, 60, 40, 60, 40, 60, 40, 60, 40, 60);
        when(history.recent(SCOPE)).thenReturn(recent);

        RealtimeAssessment assessment = service.check(SCOPE, 95, null);

        assertThat(assessment.isAnomaly()).isTrue();
        assertThat(assessment.getSeverity()).isEqualTo(Severity.HIGH);
        assertThat(assessment.getExpectedLow()).isEqualTo(30.0);
        assertThat(assessment.getExpectedHigh()).isEqualTo(70.0);
    }

    @Test
    void check_invalidValue_rejectedBeforeLookup() {
        assertThatThrownBy(() -> service.check(SCOPE, -1, null)).isInstanceOf(InvalidObservationException.class);
        assertThatThrownBy(() -> service.check(SCOPE, Double.NaN, null)).isInstanceOf(InvalidObservationException.class);
        verifyNoInteractions(history);
    }

    @Test
    void check_noHistory_raisesNoData() {
        when(history.recent(SCOPE)).thenReturn(List.of());

        assertThatThrownBy(() -> service.check(SCOPE, 10, null)).isInstanceOf(NoDataException.class);
    }
}
