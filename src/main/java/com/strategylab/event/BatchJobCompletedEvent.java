package com.strategylab.event;

import com.strategylab.domain.model.BatchJob;
import org.springframework.context.ApplicationEvent;

/**
 * Published once when a batch job reaches a terminal status (finished, failed or
 * cancelled). Carries the final snapshot.
 */
public class BatchJobCompletedEvent extends ApplicationEvent {

    private final BatchJob job;

    public BatchJobCompletedEvent(Object source, BatchJob job) {
        super(source);
        this.job = job;
    }

    public BatchJob getJob() {
        return job;
    }
}
