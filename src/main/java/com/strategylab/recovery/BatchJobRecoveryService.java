package com.strategylab.recovery;

import com.strategylab.batch.BatchJobOrchestrator;
import com.strategylab.batch.BatchJobStore;
import com.strategylab.config.BatchProperties;
import com.strategylab.domain.model.BatchJob;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Service;

/**
 * Deals with batch jobs that were queued or running when the service last stopped.
 *
 * <p>With {@code strategylab.batch.resume-on-startup} (the default) each such job is
 * resumed: stored runs are kept and only the missing assignments are executed. Otherwise
 * the jobs are failed with "Interrupted by server restart" so clients stop polling them.
 */
@Service
public class BatchJobRecoveryService {

    private static final Logger log = LoggerFactory.getLogger(BatchJobRecoveryService.class);

    static final String INTERRUPTED_ERROR = "Interrupted by server restart";

    private final BatchJobStore batchJobStore;
    private final BatchJobOrchestrator batchJobOrchestrator;
    private final BatchProperties batchProperties;

    public BatchJobRecoveryService(
            BatchJobStore batchJobStore, BatchJobOrchestrator batchJobOrchestrator, BatchProperties batchProperties) {
        this.batchJobStore = batchJobStore;
        this.batchJobOrchestrator = batchJobOrchestrator;
        this.batchProperties = batchProperties;
    }

    @EventListener(ApplicationReadyEvent.class)
    @Order(10)
    public void onApplicationReady() {
        List<BatchJob> unfinished = batchJobStore.findUnfinished();
        if (unfinished.isEmpty()) {
            log.info("No interrupted batch jobs to recover");
            return;
        }
        log.info(
                "Recovering {} interrupted batch jobs (resume={})",
                unfinished.size(),
                batchProperties.isResumeOnStartup());

        int resumed = 0;
        int failed = 0;
        for (BatchJob job : unfinished) {
            try {
                if (batchProperties.isResumeOnStartup()) {
                    batchJobOrchestrator.resume(job);
                    resumed++;
                } else {
                    batchJobOrchestrator.abandon(job, INTERRUPTED_ERROR);
                    failed++;
                }
            } catch (RuntimeException e) {
                log.error("Failed to recover batch job {}: {}", job.getId(), e.getMessage(), e);
            }
        }
        log.info("Batch recovery done: {} resumed, {} failed", resumed, failed);
    }
}
