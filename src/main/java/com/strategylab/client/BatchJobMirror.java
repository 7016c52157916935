package com.strategylab.client;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.strategylab.domain.enums.BatchJobStatus;
import com.strategylab.domain.model.BatchJobSummary;
import com.strategylab.domain.model.VariableDetail;
import java.time.Instant;
import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * The client's durable copy of a server-side batch job. It is only ever replaced by
 * merging a server snapshot into it (see {@link BatchJobReconciler}), except for the
 * initial {@code queued} entry written before submission and the {@code failed} entry
 * written when submission itself fails.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class BatchJobMirror {

    private String id;
    private String name;
    private BatchJobStatus status;
    private int total;
    private int completed;
    private int failedRuns;
    private boolean truncated;
    private List<VariableDetail> detail;
    private Instant createdAt;
    private Instant updatedAt;
    private Instant startedAt;
    private Instant completedAt;
    private Long durationMs;
    private String error;
    private BatchJobSummary summary;
    private String viewRef;
    private String csvRef;

    /** When the last server snapshot was merged in; null if never. */
    private Instant lastSyncedAt;

    @JsonIgnore
    public boolean isTerminal() {
        return status != null && status.isTerminal();
    }
}
