package com.strategylab.api.dto.response;

import com.strategylab.domain.model.BatchJobSummary;
import com.strategylab.domain.model.VariableDetail;
import java.time.Instant;
import java.util.List;
import lombok.Builder;
import lombok.Getter;

/**
 * Snapshot of a batch job as returned by the create, status, list and cancel endpoints.
 *
 * <p>{@code durationMs} is live while the job runs (now minus start) and final once it is
 * terminal. {@code viewRef}/{@code csvRef} are null until results can be read.
 */
@Getter
@Builder
public class BatchJobResponse {

    private final String id;
    private final String jobId;
    private final String name;
    private final String status;
    private final int total;
    private final int completed;
    private final int failedRuns;
    private final boolean truncated;
    private final List<VariableDetail> detail;
    private final String benchmarkSymbol;
    private final String startDate;
    private final String endDate;
    private final Instant createdAt;
    private final Instant updatedAt;
    private final Instant startedAt;
    private final Instant completedAt;
    private final Long durationMs;
    private final String error;
    private final BatchJobSummary summary;
    private final String viewRef;
    private final String csvRef;
}
