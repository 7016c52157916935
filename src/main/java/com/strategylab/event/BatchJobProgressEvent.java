package com.strategylab.event;

import org.springframework.context.ApplicationEvent;

/**
 * Published by the orchestrator after each run of a batch job completes, whether the
 * run succeeded or failed.
 */
public class BatchJobProgressEvent extends ApplicationEvent {

    private final String jobId;
    private final int completed;
    private final int total;
    private final boolean runFailed;

    public BatchJobProgressEvent(Object source, String jobId, int completed, int total, boolean runFailed) {
        super(source);
        this.jobId = jobId;
        this.completed = completed;
        this.total = total;
        this.runFailed = runFailed;
    }

    public String getJobId() {
        return jobId;
    }

    public int getCompleted() {
        return completed;
    }

    public int getTotal() {
        return total;
    }

    public boolean isRunFailed() {
        return runFailed;
    }

    /**
     * Progress as a percentage (0-100).
     */
    public int getProgressPercent() {
        return total > 0 ? (completed * 100) / total : 0;
    }
}
