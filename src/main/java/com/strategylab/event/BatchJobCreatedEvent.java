package com.strategylab.event;

import com.strategylab.domain.model.BatchJob;
import org.springframework.context.ApplicationEvent;

/** Published when a batch job has been accepted and persisted. */
public class BatchJobCreatedEvent extends ApplicationEvent {

    private final BatchJob job;

    public BatchJobCreatedEvent(Object source, BatchJob job) {
        super(source);
        this.job = job;
    }

    public BatchJob getJob() {
        return job;
    }
}
