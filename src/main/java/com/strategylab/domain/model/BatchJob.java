package com.strategylab.domain.model;

import com.strategylab.domain.enums.BatchJobStatus;
import java.time.Instant;
import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Snapshot of a batch job: one sweep of backtests over the assignments of a strategy.
 *
 * <p>The orchestrator never mutates a published snapshot. Every change produces a new
 * instance via {@code toBuilder()}, so readers can hold one without locking. Once the
 * status is terminal the snapshot is final.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class BatchJob {

    private String id;
    private String name;
    private BatchJobStatus status;

    /** Number of assignments in the sweep. */
    private int total;

    /** Runs done so far, successful or not. Never decreases and never exceeds total. */
    private int completed;

    private int failedRuns;

    private List<VariableDetail> detail;

    private boolean truncated;

    private String benchmarkSymbol;
    private String startDate;
    private String endDate;

    private Instant createdAt;
    private Instant updatedAt;
    private Instant startedAt;
    private Instant completedAt;
    private Long durationMs;

    /** Human-readable reason, set only when the job failed. */
    private String error;

    private BatchJobSummary summary;

    /** Relative URL of the paginated result view; set once the job is terminal. */
    private String viewRef;

    /** Relative URL of the CSV export; set once the job is terminal. */
    private String csvRef;

    public boolean isTerminal() {
        return status != null && status.isTerminal();
    }
}
