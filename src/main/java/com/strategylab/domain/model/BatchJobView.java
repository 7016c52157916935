package com.strategylab.domain.model;

import com.strategylab.domain.enums.BatchJobStatus;
import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** One page of a terminal job's results, with the job-level context needed to read it. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class BatchJobView {

    private String jobId;
    private String name;
    private BatchJobStatus status;
    private BatchJobSummary summary;
    private int total;
    private int completed;
    private boolean truncated;
    private String error;
    private List<VariableDetail> detail;

    /** Number of stored runs; pages are taken from this sequence. */
    private long runsTotal;

    private long offset;
    private int limit;
    private List<RunResult> runs;
}
