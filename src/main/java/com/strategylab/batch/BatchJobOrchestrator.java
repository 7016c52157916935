package com.strategylab.batch;

import com.strategylab.config.BatchProperties;
import com.strategylab.config.EvaluatorProperties;
import com.strategylab.domain.enums.BatchJobStatus;
import com.strategylab.domain.model.BatchJob;
import com.strategylab.domain.model.BatchJobSummary;
import com.strategylab.domain.model.DateRange;
import com.strategylab.domain.model.Element;
import com.strategylab.domain.model.RunMetrics;
import com.strategylab.domain.model.RunResult;
import com.strategylab.domain.model.StrategyDefinition;
import com.strategylab.domain.model.VariableDetail;
import com.strategylab.domain.model.VariableList;
import com.strategylab.evaluator.BacktestEvaluator;
import com.strategylab.event.BatchJobCompletedEvent;
import com.strategylab.event.BatchJobCreatedEvent;
import com.strategylab.event.BatchJobProgressEvent;
import com.strategylab.exception.BaseException;
import com.strategylab.exception.InvalidStateException;
import com.strategylab.exception.ResourceNotFoundException;
import com.strategylab.exception.ValidationException;
import com.strategylab.variable.VariableResolver;
import com.strategylab.variable.VariableTokens;
import java.math.BigInteger;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.Semaphore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;

/**
 * Accepts batch jobs and drives each one through its sweep of backtests.
 *
 * <p>Lifecycle of a job:
 * <ol>
 *   <li>{@link #create} validates the request, persists the job as {@code queued} and
 *       hands the run loop to the {@code batchJobExecutor}; it returns at once</li>
 *   <li>the run loop stamps {@code startedAt}, moves to {@code running} and dispatches the
 *       assignments in order, at most {@code strategylab.batch.concurrency} at a time, to
 *       the {@code evaluatorExecutor}</li>
 *   <li>every finished run is persisted immediately together with the new progress, so a
 *       restart loses at most the runs that were in flight</li>
 *   <li>the job ends {@code finished}, or {@code failed} when it was cancelled or every run
 *       failed</li>
 * </ol>
 *
 * <p>A failed run does not stop the sweep: its error is stored on the run, it counts
 * towards {@code completed} and {@code failedRuns}, and it is left out of the summary.
 *
 * <p>Cancellation is cooperative. The flag is checked before every dispatch; runs already
 * handed to the evaluator are allowed to finish.
 */
@Service
public class BatchJobOrchestrator {

    private static final Logger log = LoggerFactory.getLogger(BatchJobOrchestrator.class);

    static final String CANCELLED_ERROR = "Cancelled by user";

    /** Log progress every N completed runs. */
    private static final int PROGRESS_LOG_INTERVAL = 100;

    private static final int MAX_LIST_LIMIT = 500;

    private final VariableResolver variableResolver;
    private final AssignmentGenerator assignmentGenerator;
    private final BatchJobStore batchJobStore;
    private final BatchJobRegistry batchJobRegistry;
    private final BacktestEvaluator backtestEvaluator;
    private final BatchProperties batchProperties;
    private final EvaluatorProperties evaluatorProperties;
    private final ApplicationEventPublisher applicationEventPublisher;
    private final Executor batchJobExecutor;
    private final Executor evaluatorExecutor;

    public BatchJobOrchestrator(
            VariableResolver variableResolver,
            AssignmentGenerator assignmentGenerator,
            BatchJobStore batchJobStore,
            BatchJobRegistry batchJobRegistry,
            BacktestEvaluator backtestEvaluator,
            BatchProperties batchProperties,
            EvaluatorProperties evaluatorProperties,
            ApplicationEventPublisher applicationEventPublisher,
            @Qualifier("batchJobExecutor") Executor batchJobExecutor,
            @Qualifier("evaluatorExecutor") Executor evaluatorExecutor) {
        this.variableResolver = variableResolver;
        this.assignmentGenerator = assignmentGenerator;
        this.batchJobStore = batchJobStore;
        this.batchJobRegistry = batchJobRegistry;
        this.backtestEvaluator = backtestEvaluator;
        this.batchProperties = batchProperties;
        this.evaluatorProperties = evaluatorProperties;
        this.applicationEventPublisher = applicationEventPublisher;
        this.batchJobExecutor = batchJobExecutor;
        this.evaluatorExecutor = evaluatorExecutor;
    }

    // ---- Public contract ----

    /**
     * Validates and registers a new batch job and starts it in the background.
     *
     * @return the initial snapshot: {@code queued}, or {@code finished} when there is
     *         nothing to run
     * @throws ValidationException   if variables are unbound or empty, or an assignment
     *                               does not bind every referenced variable
     * @throws InvalidStateException if a job with the requested id already exists
     */
    public BatchJob create(BatchJobCommand command) {
        StrategyDefinition strategy = command.getStrategy();
        if (strategy == null || strategy.getElements() == null || strategy.getElements().isEmpty()) {
            throw new ValidationException("Base strategy has no elements");
        }

        String jobId = hasText(command.getJobId()) ? command.getJobId().trim() : UUID.randomUUID().toString();
        if (batchJobRegistry.contains(jobId) || batchJobStore.exists(jobId)) {
            throw new InvalidStateException("Batch job already exists: " + jobId, Map.of("jobId", jobId));
        }

        List<VariableList> lists = command.getVariables() != null ? command.getVariables() : List.of();
        List<VariableDetail> detail = variableResolver.buildDetail(strategy.getElements(), lists);
        for (VariableDetail entry : detail) {
            if (entry.getCount() == 0) {
                throw ValidationException.emptyVariable(entry.getName());
            }
        }

        List<Map<String, String>> assignments;
        boolean truncated;
        if (command.getAssignments() == null || command.getAssignments().isEmpty()) {
            AssignmentBatch generated = assignmentGenerator.generate(detail, batchProperties.getMaxAssignments());
            assignments = generated.getAssignments();
            truncated = generated.isTruncated();
        } else {
            if (command.getAssignments().size() > batchProperties.getMaxAssignments()) {
                throw new ValidationException(
                        "Too many assignments: " + command.getAssignments().size() + " exceeds the limit of "
                                + batchProperties.getMaxAssignments(),
                        Map.of("maxAssignments", batchProperties.getMaxAssignments()));
            }
            assignments = normalizeAssignments(command.getAssignments(), detail);
            truncated = command.getTruncated() != null
                    ? command.getTruncated()
                    : assignmentGenerator.productSize(detail).compareTo(BigInteger.valueOf(assignments.size())) > 0;
        }

        Instant now = Instant.now();
        BatchJob initial = BatchJob.builder()
                .id(jobId)
                .name(hasText(command.getName()) ? command.getName().trim() : defaultName(jobId))
                .status(BatchJobStatus.QUEUED)
                .total(assignments.size())
                .completed(0)
                .failedRuns(0)
                .detail(detail)
                .truncated(truncated)
                .benchmarkSymbol(hasText(strategy.getBenchmarkSymbol())
                        ? strategy.getBenchmarkSymbol().trim().toUpperCase(Locale.ROOT)
                        : evaluatorProperties.getDefaultBenchmark())
                .startDate(strategy.getStartDate())
                .endDate(strategy.getEndDate())
                .createdAt(now)
                .updatedAt(now)
                .build();

        if (assignments.isEmpty()) {
            BatchJob finished = initial.toBuilder()
                    .status(BatchJobStatus.FINISHED)
                    .startedAt(now)
                    .completedAt(now)
                    .durationMs(0L)
                    .summary(BatchJobSummary.empty())
                    .viewRef(viewRefOf(jobId))
                    .csvRef(csvRefOf(jobId))
                    .build();
            batchJobStore.insert(finished, strategy, assignments);
            batchJobRegistry.cacheTerminal(finished);
            log.info("Batch job {} has no assignments, finished immediately", jobId);
            applicationEventPublisher.publishEvent(new BatchJobCreatedEvent(this, finished));
            applicationEventPublisher.publishEvent(new BatchJobCompletedEvent(this, finished));
            return finished;
        }

        batchJobStore.insert(initial, strategy, assignments);
        BatchJobHandle handle = batchJobRegistry.register(initial);
        log.info(
                "Batch job accepted: id={}, name='{}', runs={}, variables={}, truncated={}",
                jobId,
                initial.getName(),
                initial.getTotal(),
                detail.size(),
                truncated);
        applicationEventPublisher.publishEvent(new BatchJobCreatedEvent(this, initial));

        dispatch(handle, strategy, assignments, Set.of());
        return handle.current();
    }

    /**
     * Requests cancellation of a queued or running job. The job turns {@code failed} with
     * "Cancelled by user" once the run loop observes the request.
     *
     * @return the snapshot at the time of the request
     * @throws ResourceNotFoundException if the job does not exist
     * @throws InvalidStateException     if the job is already terminal
     */
    public BatchJob cancel(String jobId) {
        BatchJobHandle handle = batchJobRegistry.handle(jobId).orElse(null);
        if (handle == null) {
            BatchJob stored = get(jobId);
            throw new InvalidStateException(
                    "Batch job " + jobId + " is already " + stored.getStatus().getValue(),
                    Map.of("status", stored.getStatus().getValue()));
        }
        BatchJob current = handle.current();
        if (current.isTerminal()) {
            throw new InvalidStateException(
                    "Batch job " + jobId + " is already " + current.getStatus().getValue(),
                    Map.of("status", current.getStatus().getValue()));
        }
        if (handle.requestCancel()) {
            log.info("Cancellation requested for batch job {} at {}/{}", jobId, current.getCompleted(), current.getTotal());
        }
        return current;
    }

    /**
     * Current snapshot of a job: live state, then the terminal cache, then the database.
     *
     * @throws ResourceNotFoundException if the job does not exist
     */
    public BatchJob get(String jobId) {
        return batchJobRegistry.snapshot(jobId).orElseGet(() -> {
            BatchJob stored = batchJobStore
                    .find(jobId)
                    .orElseThrow(() -> new ResourceNotFoundException("BatchJob", jobId));
            batchJobRegistry.cacheTerminal(stored);
            return stored;
        });
    }

    /** Most recent jobs first. Live jobs are reported with their in-memory progress. */
    public List<BatchJob> list(BatchJobStatus status, int limit) {
        int boundedLimit = Math.max(1, Math.min(limit, MAX_LIST_LIMIT));
        List<BatchJob> stored = batchJobStore.list(status, boundedLimit);
        List<BatchJob> result = new ArrayList<>(stored.size());
        for (BatchJob job : stored) {
            BatchJob current = batchJobRegistry.snapshot(job.getId()).orElse(job);
            if (status == null || current.getStatus() == status) {
                result.add(current);
            }
        }
        return result;
    }

    /**
     * Picks up a job that was queued or running when the service stopped. Runs already
     * stored are kept and skipped; the rest of the sweep is executed.
     */
    public BatchJob resume(BatchJob persisted) {
        StrategyDefinition strategy = batchJobStore.loadStrategy(persisted.getId());
        List<Map<String, String>> assignments = batchJobStore.loadAssignments(persisted.getId());
        List<RunResult> done = batchJobStore.findAllRuns(persisted.getId());

        int failed = (int) done.stream().filter(run -> !run.isSuccessful()).count();
        BatchJob restored = persisted.toBuilder()
                .total(assignments.size())
                .completed(done.size())
                .failedRuns(failed)
                .updatedAt(Instant.now())
                .build();
        BatchJobHandle handle = batchJobRegistry.register(restored);
        handle.addResults(done);

        if (strategy == null || strategy.getElements() == null) {
            return fail(handle, "Missing strategy payload");
        }

        Set<Integer> skip = batchJobStore.findRunIndexes(persisted.getId());
        log.info(
                "Resuming batch job {}: {}/{} runs already stored",
                persisted.getId(),
                done.size(),
                assignments.size());
        dispatch(handle, strategy, assignments, skip);
        return handle.current();
    }

    /** Fails a job that cannot be resumed, e.g. after a restart with resume disabled. */
    public BatchJob abandon(BatchJob persisted, String reason) {
        BatchJobHandle handle = batchJobRegistry.register(persisted);
        handle.addResults(batchJobStore.findAllRuns(persisted.getId()));
        return fail(handle, reason);
    }

    // ---- Run loop ----

    private void dispatch(
            BatchJobHandle handle, StrategyDefinition strategy, List<Map<String, String>> assignments, Set<Integer> skip) {
        try {
            batchJobExecutor.execute(() -> runJob(handle, strategy, assignments, skip));
        } catch (RejectedExecutionException e) {
            log.error("Batch job {} rejected by executor: {}", handle.getJobId(), e.getMessage());
            fail(handle, "Batch queue is full, job could not be started");
        }
    }

    void runJob(
            BatchJobHandle handle, StrategyDefinition strategy, List<Map<String, String>> assignments, Set<Integer> skip) {
        String jobId = handle.getJobId();
        if (handle.isCancelRequested()) {
            log.info("Batch job {} cancelled before it started", jobId);
            finish(handle, true);
            return;
        }

        Instant startedAt = Instant.now();
        BatchJob running = handle.update(job -> job.toBuilder()
                .status(BatchJobStatus.RUNNING)
                .startedAt(job.getStartedAt() != null ? job.getStartedAt() : startedAt)
                .updatedAt(startedAt)
                .build());
        batchJobStore.update(running);
        log.info(
                "Batch job {} started: {} runs, concurrency={}",
                jobId,
                running.getTotal(),
                batchProperties.getConcurrency());

        DateRange dateRange = DateRange.of(strategy.getStartDate(), strategy.getEndDate());
        Semaphore permits = new Semaphore(Math.max(1, batchProperties.getConcurrency()));
        List<CompletableFuture<Void>> inFlight = new ArrayList<>();
        boolean cancelled = false;

        try {
            for (int runIndex = 0; runIndex < assignments.size(); runIndex++) {
                if (skip.contains(runIndex)) {
                    continue;
                }
                if (handle.isCancelRequested()) {
                    cancelled = true;
                    break;
                }
                permits.acquire();
                if (handle.isCancelRequested()) {
                    permits.release();
                    cancelled = true;
                    break;
                }
                int index = runIndex;
                Map<String, String> assignment = assignments.get(runIndex);
                inFlight.add(CompletableFuture.runAsync(
                        () -> {
                            try {
                                executeRun(handle, strategy.getElements(), running.getBenchmarkSymbol(), dateRange,
                                        index, assignment);
                            } finally {
                                permits.release();
                            }
                        },
                        evaluatorExecutor));
            }
            if (cancelled) {
                log.info("Batch job {} observed cancellation, waiting for {} in-flight runs", jobId, permitsInUse(permits));
            }
            CompletableFuture.allOf(inFlight.toArray(new CompletableFuture[0])).join();
            finish(handle, cancelled);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Batch job {} interrupted", jobId);
            fail(handle, "Batch execution interrupted");
        } catch (CompletionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            log.error("Batch job {} aborted: {}", jobId, cause.getMessage(), cause);
            fail(handle, messageOf(cause));
        } catch (RuntimeException e) {
            log.error("Batch job {} aborted: {}", jobId, e.getMessage(), e);
            fail(handle, messageOf(e));
        }
    }

    private void executeRun(
            BatchJobHandle handle,
            List<Element> elements,
            String benchmarkSymbol,
            DateRange dateRange,
            int runIndex,
            Map<String, String> assignment) {
        RunResult.RunResultBuilder result = RunResult.builder().runIndex(runIndex).variables(assignment);
        try {
            List<Element> resolved = variableResolver.substituteAll(elements, assignment);
            RunMetrics metrics = backtestEvaluator.runBacktest(resolved, benchmarkSymbol, dateRange);
            result.metrics(metrics);
        } catch (BaseException e) {
            log.warn("Batch job {} run {} failed: {}", handle.getJobId(), runIndex, e.getMessage());
            result.error(messageOf(e));
        } catch (RuntimeException e) {
            log.error("Batch job {} run {} failed unexpectedly", handle.getJobId(), runIndex, e);
            result.error(messageOf(e));
        }
        recordRun(handle, result.completedAt(Instant.now()).build());
    }

    /** The single point where run results change a job's progress. */
    private void recordRun(BatchJobHandle handle, RunResult run) {
        BatchJob progressed;
        synchronized (handle) {
            progressed = handle.update(job -> job.toBuilder()
                    .completed(job.getCompleted() + 1)
                    .failedRuns(job.getFailedRuns() + (run.isSuccessful() ? 0 : 1))
                    .updatedAt(run.getCompletedAt())
                    .build());
            handle.addResult(run);
            batchJobStore.saveRun(progressed, run);
        }

        int completed = progressed.getCompleted();
        if (completed % PROGRESS_LOG_INTERVAL == 0 || completed == progressed.getTotal()) {
            log.info(
                    "Batch job {} progress: {}/{} ({} failed)",
                    progressed.getId(),
                    completed,
                    progressed.getTotal(),
                    progressed.getFailedRuns());
        }
        applicationEventPublisher.publishEvent(new BatchJobProgressEvent(
                this, progressed.getId(), completed, progressed.getTotal(), !run.isSuccessful()));
    }

    private BatchJob finish(BatchJobHandle handle, boolean cancelled) {
        List<RunResult> results = handle.results();
        BatchJobSummary summary = BatchJobSummary.of(results);
        String error = null;
        if (cancelled) {
            error = CANCELLED_ERROR;
        } else if (!results.isEmpty() && summary.getSuccessfulRuns() == 0) {
            String firstError = results.stream()
                    .min(Comparator.comparingInt(RunResult::getRunIndex))
                    .map(RunResult::getError)
                    .orElse("unknown error");
            error = "All " + results.size() + " backtests failed: " + firstError;
        }
        return terminate(handle, error == null ? BatchJobStatus.FINISHED : BatchJobStatus.FAILED, error, summary);
    }

    private BatchJob fail(BatchJobHandle handle, String error) {
        BatchJob current = handle.current();
        if (current.isTerminal()) {
            log.warn("Batch job {} already {}, not failing it again: {}", current.getId(), current.getStatus().getValue(), error);
            batchJobRegistry.retire(current);
            return current;
        }
        return terminate(handle, BatchJobStatus.FAILED, error, BatchJobSummary.of(handle.results()));
    }

    private BatchJob terminate(BatchJobHandle handle, BatchJobStatus status, String error, BatchJobSummary summary) {
        Instant now = Instant.now();
        BatchJob done;
        synchronized (handle) {
            done = handle.update(job -> job.toBuilder()
                    .status(status)
                    .error(error)
                    .summary(summary)
                    .completedAt(now)
                    .updatedAt(now)
                    .durationMs(Duration.between(job.getStartedAt() != null ? job.getStartedAt() : job.getCreatedAt(), now)
                            .toMillis())
                    .viewRef(viewRefOf(job.getId()))
                    .csvRef(csvRefOf(job.getId()))
                    .build());
            batchJobStore.update(done);
        }
        batchJobRegistry.retire(done);

        if (status == BatchJobStatus.FINISHED) {
            double seconds = Math.max(done.getDurationMs(), 1L) / 1000.0;
            log.info(
                    "Batch job {} finished in {}s: {} runs, {} failed ({} runs/sec)",
                    done.getId(),
                    String.format("%.1f", seconds),
                    done.getCompleted(),
                    done.getFailedRuns(),
                    String.format("%.1f", done.getCompleted() / seconds));
        } else {
            log.warn("Batch job {} failed after {}/{} runs: {}", done.getId(), done.getCompleted(), done.getTotal(), error);
        }
        applicationEventPublisher.publishEvent(new BatchJobCompletedEvent(this, done));
        return done;
    }

    // ---- Helpers ----

    private static List<Map<String, String>> normalizeAssignments(
            List<Map<String, String>> raw, List<VariableDetail> detail) {
        List<Map<String, String>> normalized = new ArrayList<>(raw.size());
        for (int i = 0; i < raw.size(); i++) {
            Map<String, String> assignment = raw.get(i);
            if (assignment == null) {
                throw new ValidationException("Assignment " + i + " is empty", Map.of("assignmentIndex", i));
            }
            Map<String, String> byName = new LinkedHashMap<>();
            assignment.forEach((name, value) -> byName.put(VariableTokens.normalizeName(name), value));
            List<String> unbound = new ArrayList<>();
            for (VariableDetail entry : detail) {
                if (byName.get(entry.getName()) == null) {
                    unbound.add(entry.getName());
                }
            }
            if (!unbound.isEmpty()) {
                throw new ValidationException(
                        "Assignment " + i + " does not bind: " + String.join(", ", unbound),
                        Map.of("assignmentIndex", i, "unboundVariables", unbound));
            }
            normalized.add(byName);
        }
        return normalized;
    }

    private int permitsInUse(Semaphore permits) {
        return Math.max(0, batchProperties.getConcurrency() - permits.availablePermits());
    }

    private static String messageOf(Throwable e) {
        return e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
    }

    private static boolean hasText(String value) {
        return value != null && !value.isBlank();
    }

    private static String defaultName(String jobId) {
        return "Batch Strategy " + jobId.substring(0, Math.min(8, jobId.length()));
    }

    static String viewRefOf(String jobId) {
        return "/api/batch-jobs/" + jobId + "/view";
    }

    static String csvRefOf(String jobId) {
        return "/api/batch-jobs/" + jobId + "/results.csv";
    }
}
