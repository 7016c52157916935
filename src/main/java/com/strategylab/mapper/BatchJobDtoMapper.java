package com.strategylab.mapper;

import com.strategylab.api.dto.request.CreateBatchJobRequest;
import com.strategylab.api.dto.request.VariableRequest;
import com.strategylab.api.dto.response.BatchJobResponse;
import com.strategylab.api.dto.response.BatchJobViewResponse;
import com.strategylab.api.dto.response.RunResultResponse;
import com.strategylab.batch.BatchJobCommand;
import com.strategylab.domain.model.BatchJob;
import com.strategylab.domain.model.BatchJobView;
import com.strategylab.domain.model.RunMetrics;
import com.strategylab.domain.model.RunResult;
import com.strategylab.domain.model.VariableList;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import org.mapstruct.Mapper;
import org.mapstruct.Mapping;

/**
 * MapStruct mapper between the batch API DTOs and the domain model.
 *
 * <p>Statuses are rendered lower-case. Variable names from requests are normalized
 * through {@link VariableList#of}.
 */
@Mapper
public interface BatchJobDtoMapper {

    @Mapping(target = "jobId", source = "id")
    @Mapping(target = "status", expression = "java(job.getStatus() != null ? job.getStatus().getValue() : null)")
    @Mapping(target = "durationMs", expression = "java(liveDurationMs(job))")
    BatchJobResponse toResponse(BatchJob job);

    List<BatchJobResponse> toResponseList(List<BatchJob> jobs);

    @Mapping(target = "status", expression = "java(view.getStatus() != null ? view.getStatus().getValue() : null)")
    BatchJobViewResponse toViewResponse(BatchJobView view);

    RunResultResponse toRunResponse(RunResult run);

    @Mapping(target = "name", source = "jobName")
    @Mapping(target = "strategy", source = "baseStrategy")
    BatchJobCommand toCommand(CreateBatchJobRequest request);

    default VariableList toVariableList(VariableRequest request) {
        return VariableList.of(request.getName(), null, request.getValues());
    }

    default Map<String, Double> metricsToMap(RunMetrics metrics) {
        return metrics != null ? metrics.toMap() : null;
    }

    /** Final duration once set, otherwise time elapsed since the job started (or was created). */
    default Long liveDurationMs(BatchJob job) {
        if (job.getDurationMs() != null) {
            return job.getDurationMs();
        }
        Instant start = job.getStartedAt() != null ? job.getStartedAt() : job.getCreatedAt();
        if (start == null) {
            return null;
        }
        Instant end = job.getCompletedAt() != null ? job.getCompletedAt() : Instant.now();
        return Math.max(0L, Duration.between(start, end).toMillis());
    }
}
