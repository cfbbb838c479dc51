package com.demandengine.engine;

import com.demandengine.config.EngineProperties;
import com.demandengine.engine.model.AccuracyMetric;
import com.demandengine.engine.model.Forecast;
import com.demandengine.engine.model.ForecastStatus;
import com.demandengine.exception.ForecastImmutableException;
import com.demandengine.exception.InvalidObservationException;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.util.List;

import static com.demandengine.engine.SeriesFixtures.*;
import static org.assertj.core.api.Assertions.*;

class AccuracyScorerTest {

    private static final LocalDate START = LocalDate.of(2025, 1, 1);
    private static final LocalDate END = LocalDate.of(2025, 1, 31);

    private final AccuracyScorer scorer = new AccuracyScorer(EngineProperties.defaults());

    @Test
    void perForecastScore_usesRelativeErrorFlooredAtOne() {
        assertThat(AccuracyScorer.relativeError(100, 110)).isCloseTo(0.1, within(1e-12));
        assertThat(AccuracyScorer.accuracyScore(100, 110)).isCloseTo(0.9, within(1e-12));
        assertThat(AccuracyScorer.accuracyScore(0, 0.5)).isCloseTo(0.5, within(1e-12));
        assertThat(AccuracyScorer.accuracyScore(0, 5)).isZero();
    }

    @Test
    void score_transitionsPendingForecastToScored() {
        Forecast pending = pending(START, 7, 1, 100);

        Forecast scored = scorer.score(pending, 95);

        assertThat(scored.getStatus()).isEqualTo(ForecastStatus.SCORED);
        assertThat(scored.getObservedActual()).isEqualTo(95.0);
        assertThat(scored.getAccuracyScore()).isEqualTo(0.9474);
        assertThat(scored.getId()).isEqualTo(pending.getId());
        assertThat(pending.getStatus()).isEqualTo(ForecastStatus.PENDING);
    }

    @Test
    void rescoring_isRejectedAndKeepsOriginalScore() {
        Forecast scored = scorer.score(pending(START, 7, 1, 100), 100);

        assertThatThrownBy(() -> scorer.score(scored, 10))
            .isInstanceOf(ForecastImmutableException.class)
            .hasMessageContaining(scored.getId().toString());
        assertThat(scored.getAccuracyScore()).isEqualTo(1.0);
        assertThat(scored.getObservedActual()).isEqualTo(100.0);
    }

    @Test
    void negativeActual_isRejected() {
        assertThatThrownBy(() -> scorer.score(pending(START, 7, 1, 100), -1))
            .isInstanceOf(InvalidObservationException.class);
        assertThatThrownBy(() -> scorer.score(pending(START, 7, 1, 100), Double.NaN))
            .isInstanceOf(InvalidObservationException.class);
    }

    @Test
    void aggregate_emptyPeriod_returnsNullMeasures() {
        AccuracyMetric metric = scorer.aggregate(SCOPE, START, END, List.of());

        assertThat(metric.getSampleSize()).isZero();
        assertThat(metric.getMae()).isNull();
        assertThat(metric.getMape()).isNull();
        assertThat(metric.getRmse()).isNull();
        assertThat(metric.getAccuracyRateWithinTolerance()).isNull();
        assertThat(metric.getPeriodStart()).isEqualTo(START);
        assertThat(metric.getPeriodEnd()).isEqualTo(END);
    }

    @Test
    void aggregate_zeroActualIsExcludedFromMapeOnly() {
        List<Forecast> forecasts = List.of(scored(110, 100), scored(90, 100), scored(5, 0));

        AccuracyMetric metric = scorer.aggregate(SCOPE, START, END, forecasts);

        assertThat(metric.getSampleSize()).isEqualTo(3);
        assertThat(metric.getMae()).isEqualTo(8.3333);
        assertThat(metric.getRmse()).isEqualTo(8.6603);
        assertThat(metric.getMape()).isEqualTo(0.1);
        assertThat(metric.getMape()).isFinite();
        assertThat(metric.getAccuracyRateWithinTolerance()).isEqualTo(0.6667);
    }

    @Test
    void aggregate_allZeroActuals_leavesMapeNull() {
        AccuracyMetric metric = scorer.aggregate(SCOPE, START, END, List.of(scored(3, 0), scored(0, 0)));

        assertThat(metric.getMape()).isNull();
        assertThat(metric.getMae()).isEqualTo(1.5);
    }

    @Test
    void aggregate_ignoresPendingForecasts() {
        AccuracyMetric metric = scorer.aggregate(SCOPE, START, END, List.of(scored(100, 100), pending(START, 1, 1, 10)));

        assertThat(metric.getSampleSize()).isEqualTo(1);
        assertThat(metric.getAccuracyRateWithinTolerance()).isEqualTo(1.0);
    }
}
