package com.strategylab.client;

import com.fasterxml.jackson.databind.JsonNode;
import com.strategylab.api.dto.request.BaseStrategyRequest;
import com.strategylab.api.dto.request.CreateBatchJobRequest;
import com.strategylab.api.dto.request.VariableRequest;
import com.strategylab.batch.AssignmentBatch;
import com.strategylab.batch.AssignmentGenerator;
import com.strategylab.domain.enums.BatchJobStatus;
import com.strategylab.domain.model.StrategyDefinition;
import com.strategylab.domain.model.VariableDetail;
import com.strategylab.domain.model.VariableList;
import com.strategylab.exception.ValidationException;
import com.strategylab.variable.VariableResolver;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Client side of batch submission.
 *
 * <p>Everything that can be checked locally is checked before the server is contacted.
 * The mirror is written under a client-chosen job id before the POST, so a crash between
 * the two leaves a {@code queued} entry behind instead of an untracked server job.
 */
public class BatchSubmissionService {

    private static final Logger log = LoggerFactory.getLogger(BatchSubmissionService.class);

    private final VariableResolver variableResolver;
    private final AssignmentGenerator assignmentGenerator;
    private final BatchJobApiClient apiClient;
    private final BatchJobMirrorStore mirrorStore;
    private final BatchJobReconciler reconciler;
    private final BatchJobPoller poller;
    private final Clock clock;
    private final int maxAssignments;

    public BatchSubmissionService(
            VariableResolver variableResolver,
            AssignmentGenerator assignmentGenerator,
            BatchJobApiClient apiClient,
            BatchJobMirrorStore mirrorStore,
            BatchJobReconciler reconciler,
            BatchJobPoller poller,
            Clock clock,
            int maxAssignments) {
        this.variableResolver = variableResolver;
        this.assignmentGenerator = assignmentGenerator;
        this.apiClient = apiClient;
        this.mirrorStore = mirrorStore;
        this.reconciler = reconciler;
        this.poller = poller;
        this.clock = clock;
        this.maxAssignments = maxAssignments;
    }

    /**
     * Validates, enumerates and submits a batch, then starts polling it.
     *
     * @return the mirror after merging the server's first snapshot
     * @throws ValidationException  if a variable is unbound or has no values; nothing is sent
     * @throws BatchClientException if the server rejects the job or cannot be reached; the
     *                              mirror is then stored as {@code failed}
     */
    public BatchJobMirror submit(BatchSubmission submission) {
        StrategyDefinition strategy = submission.getStrategy();
        if (strategy == null || strategy.getElements() == null || strategy.getElements().isEmpty()) {
            throw new ValidationException("Elements array is required for batch strategy backtests");
        }
        List<VariableList> lists = submission.getVariables() != null ? submission.getVariables() : List.of();
        variableResolver.requireBindings(strategy.getElements(), lists);
        List<VariableDetail> detail = variableResolver.buildDetail(strategy.getElements(), lists);
        for (VariableDetail entry : detail) {
            if (entry.getCount() == 0) {
                throw ValidationException.emptyVariable(entry.getName());
            }
        }
        AssignmentBatch batch = assignmentGenerator.generate(detail, maxAssignments);

        String jobId = UUID.randomUUID().toString();
        Instant now = clock.instant();
        BatchJobMirror queued = BatchJobMirror.builder()
                .id(jobId)
                .name(submission.getJobName())
                .status(BatchJobStatus.QUEUED)
                .total(batch.size())
                .detail(detail)
                .truncated(batch.isTruncated())
                .createdAt(now)
                .updatedAt(now)
                .build();
        mirrorStore.put(queued);

        JsonNode accepted;
        try {
            accepted = apiClient.create(toRequest(jobId, submission, detail, batch));
        } catch (BatchClientException e) {
            log.warn("Submission of batch job {} failed: {}", jobId, e.getMessage());
            Instant failedAt = clock.instant();
            mirrorStore.put(queued.toBuilder()
                    .status(BatchJobStatus.FAILED)
                    .error(e.getMessage())
                    .updatedAt(failedAt)
                    .completedAt(failedAt)
                    .build());
            throw e;
        }

        BatchJobMirror merged = reconciler.merge(queued, accepted, clock.instant());
        mirrorStore.put(merged);
        if (!merged.isTerminal()) {
            poller.track(jobId);
        }
        log.info("Submitted batch job {} with {} runs (truncated={})", jobId, batch.size(), batch.isTruncated());
        return merged;
    }

    /**
     * Asks the server to cancel {@code jobId} and stores the returned snapshot. The write
     * goes through the poller so it is serialized with ticks of the same job.
     */
    public BatchJobMirror cancel(String jobId) {
        return poller.apply(jobId, apiClient.cancel(jobId));
    }

    private static CreateBatchJobRequest toRequest(
            String jobId, BatchSubmission submission, List<VariableDetail> detail, AssignmentBatch batch) {
        List<VariableRequest> variables = new ArrayList<>();
        for (VariableDetail entry : detail) {
            VariableRequest variable = new VariableRequest();
            variable.setName(entry.getName());
            variable.setValues(new ArrayList<>(entry.getValues()));
            variables.add(variable);
        }
        StrategyDefinition strategy = submission.getStrategy();
        BaseStrategyRequest base = new BaseStrategyRequest();
        base.setElements(strategy.getElements());
        base.setBenchmarkSymbol(strategy.getBenchmarkSymbol());
        base.setStartDate(strategy.getStartDate());
        base.setEndDate(strategy.getEndDate());

        CreateBatchJobRequest request = new CreateBatchJobRequest();
        request.setJobId(jobId);
        request.setJobName(submission.getJobName());
        request.setVariables(variables);
        request.setAssignments(batch.getAssignments());
        request.setTruncated(batch.isTruncated());
        request.setBaseStrategy(base);
        return request;
    }
}
