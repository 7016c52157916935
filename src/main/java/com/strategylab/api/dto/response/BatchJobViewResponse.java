package com.strategylab.api.dto.response;

import com.strategylab.domain.model.BatchJobSummary;
import com.strategylab.domain.model.VariableDetail;
import java.util.List;
import lombok.Builder;
import lombok.Getter;

/** A page of a terminal job's runs together with its summary and variable detail. */
@Getter
@Builder
public class BatchJobViewResponse {

    private final String jobId;
    private final String name;
    private final String status;
    private final BatchJobSummary summary;
    private final int total;
    private final int completed;
    private final boolean truncated;
    private final String error;
    private final List<VariableDetail> detail;
    private final long runsTotal;
    private final long offset;
    private final int limit;
    private final List<RunResultResponse> runs;
}
