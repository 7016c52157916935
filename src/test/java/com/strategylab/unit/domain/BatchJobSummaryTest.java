package com.strategylab.unit.domain;

import static org.assertj.core.api.Assertions.assertThat;

import com.strategylab.domain.model.BatchJobSummary;
import com.strategylab.domain.model.RunMetrics;
import com.strategylab.domain.model.RunResult;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

/** Unit tests for BatchJobSummary aggregation. */
class BatchJobSummaryTest {

    private static RunResult ok(int index, double totalReturn) {
        return RunResult.builder()
                .runIndex(index)
                .metrics(RunMetrics.of(Map.of(RunMetrics.TOTAL_RETURN, totalReturn)))
                .build();
    }

    private static RunResult failed(int index) {
        return RunResult.builder().runIndex(index).error("boom").build();
    }

    @Test
    @DisplayName("best, worst and average over successful runs only, rounded to 4 decimals")
    void aggregatesSuccessfulRuns() {
        BatchJobSummary summary = BatchJobSummary.of(List.of(ok(0, 0.1), ok(1, -0.05), failed(2), ok(2, 0.12345)));

        assertThat(summary.getTotalRuns()).isEqualTo(4);
        assertThat(summary.getSuccessfulRuns()).isEqualTo(3);
        assertThat(summary.getFailedRuns()).isEqualTo(1);
        assertThat(summary.getBestTotalReturn()).isEqualTo(0.1235);
        assertThat(summary.getWorstTotalReturn()).isEqualTo(-0.05);
        assertThat(summary.getAvgTotalReturn()).isEqualTo(0.0578);
    }

    @Test
    @DisplayName("best and worst are rounded half-up like the average")
    void extremesRounded() {
        BatchJobSummary summary = BatchJobSummary.of(List.of(ok(0, 0.234567), ok(1, -0.123449), ok(2, 0.05)));

        assertThat(summary.getBestTotalReturn()).isEqualTo(0.2346);
        assertThat(summary.getWorstTotalReturn()).isEqualTo(-0.1234);
        assertThat(summary.getAvgTotalReturn()).isEqualTo(0.0537);
    }

    @Test
    @DisplayName("no successful run gives zero returns")
    void noSuccess() {
        BatchJobSummary summary = BatchJobSummary.of(List.of(failed(0), failed(1)));

        assertThat(summary.getTotalRuns()).isEqualTo(2);
        assertThat(summary.getFailedRuns()).isEqualTo(2);
        assertThat(summary.getBestTotalReturn()).isZero();
        assertThat(summary.getAvgTotalReturn()).isZero();
    }

    @Test
    @DisplayName("empty input is the empty summary")
    void empty() {
        assertThat(BatchJobSummary.of(List.of())).isEqualTo(BatchJobSummary.empty());
    }
}
