package com.strategylab.observability;

import com.strategylab.batch.BatchJobRegistry;
import com.strategylab.domain.enums.BatchJobStatus;
import com.strategylab.event.BatchJobCompletedEvent;
import com.strategylab.event.BatchJobCreatedEvent;
import com.strategylab.event.BatchJobProgressEvent;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import java.time.Duration;
import java.util.concurrent.TimeUnit;
import org.springframework.context.event.EventListener;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Service;

/**
 * Micrometer meters for batch backtesting:
 * <ul>
 *   <li><b>batch.jobs.created</b> (counter): jobs accepted</li>
 *   <li><b>batch.jobs.finished</b> (counter): jobs that ended finished</li>
 *   <li><b>batch.jobs.failed</b> (counter): jobs that ended failed, cancellations included</li>
 *   <li><b>batch.runs.completed</b> (counter): backtest runs done, successful or not</li>
 *   <li><b>batch.runs.failed</b> (counter): backtest runs that failed</li>
 *   <li><b>batch.jobs.active</b> (gauge): jobs queued or running in this instance</li>
 *   <li><b>batch.job.duration</b> (timer): wall time of terminal jobs</li>
 * </ul>
 *
 * <p>Counters and the timer are driven by the orchestrator's application events; the
 * gauge reads the registry when scraped.
 */
@Service
public class BatchMetricsService {

    private final Counter jobsCreatedCounter;
    private final Counter jobsFinishedCounter;
    private final Counter jobsFailedCounter;
    private final Counter runsCompletedCounter;
    private final Counter runsFailedCounter;
    private final Timer jobDurationTimer;

    public BatchMetricsService(MeterRegistry meterRegistry, BatchJobRegistry batchJobRegistry) {
        this.jobsCreatedCounter = Counter.builder("batch.jobs.created")
                .description("Batch jobs accepted")
                .register(meterRegistry);

        this.jobsFinishedCounter = Counter.builder("batch.jobs.finished")
                .description("Batch jobs that completed their sweep")
                .register(meterRegistry);

        this.jobsFailedCounter = Counter.builder("batch.jobs.failed")
                .description("Batch jobs that failed or were cancelled")
                .register(meterRegistry);

        this.runsCompletedCounter = Counter.builder("batch.runs.completed")
                .description("Backtest runs executed as part of a batch")
                .register(meterRegistry);

        this.runsFailedCounter = Counter.builder("batch.runs.failed")
                .description("Backtest runs whose evaluation failed")
                .register(meterRegistry);

        this.jobDurationTimer = Timer.builder("batch.job.duration")
                .description("Wall time from start to terminal status of a batch job")
                .publishPercentiles(0.5, 0.95)
                .maximumExpectedValue(Duration.ofHours(6))
                .register(meterRegistry);

        meterRegistry.gauge("batch.jobs.active", batchJobRegistry, BatchJobRegistry::activeCount);
    }

    @EventListener
    @Order(20)
    public void onJobCreated(BatchJobCreatedEvent event) {
        jobsCreatedCounter.increment();
    }

    @EventListener
    @Order(20)
    public void onRunCompleted(BatchJobProgressEvent event) {
        runsCompletedCounter.increment();
        if (event.isRunFailed()) {
            runsFailedCounter.increment();
        }
    }

    @EventListener
    @Order(20)
    public void onJobCompleted(BatchJobCompletedEvent event) {
        if (event.getJob().getStatus() == BatchJobStatus.FINISHED) {
            jobsFinishedCounter.increment();
        } else {
            jobsFailedCounter.increment();
        }
        Long durationMs = event.getJob().getDurationMs();
        if (durationMs != null && durationMs >= 0) {
            jobDurationTimer.record(durationMs, TimeUnit.MILLISECONDS);
        }
    }
}
