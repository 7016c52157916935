package com.strategylab.batch;

import com.strategylab.domain.model.BatchJob;
import com.strategylab.domain.model.RunResult;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.UnaryOperator;

/**
 * In-memory state of one live batch job.
 *
 * <p>The current snapshot sits in an {@link AtomicReference}: readers take it without
 * locking, and {@link #update(UnaryOperator)} is the only way to replace it. Updates are
 * serialized on the handle, so concurrent run completions never lose a count.
 */
public class BatchJobHandle {

    private final String jobId;
    private final AtomicReference<BatchJob> snapshot;
    private final AtomicBoolean cancelRequested = new AtomicBoolean(false);

    /** Every run recorded so far, including runs restored after a restart. */
    private final List<RunResult> results = new ArrayList<>();

    public BatchJobHandle(BatchJob initial) {
        this.jobId = initial.getId();
        this.snapshot = new AtomicReference<>(initial);
    }

    public String getJobId() {
        return jobId;
    }

    public BatchJob current() {
        return snapshot.get();
    }

    /**
     * Replaces the snapshot with {@code change(current)}. Status may only move forward and
     * a terminal snapshot is never replaced.
     *
     * @throws IllegalStateException on a backward or post-terminal transition
     */
    public synchronized BatchJob update(UnaryOperator<BatchJob> change) {
        BatchJob before = snapshot.get();
        if (before.isTerminal()) {
            throw new IllegalStateException("Batch job " + jobId + " is already " + before.getStatus().getValue());
        }
        BatchJob after = change.apply(before);
        if (after.getStatus() != before.getStatus() && !before.getStatus().canTransitionTo(after.getStatus())) {
            throw new IllegalStateException("Illegal transition " + before.getStatus().getValue() + " -> "
                    + after.getStatus().getValue() + " for batch job " + jobId);
        }
        snapshot.set(after);
        return after;
    }

    /** Adds a run result under the same lock as {@link #update(UnaryOperator)}. */
    public synchronized void addResult(RunResult result) {
        results.add(result);
    }

    public synchronized void addResults(Collection<RunResult> restored) {
        results.addAll(restored);
    }

    public synchronized List<RunResult> results() {
        return List.copyOf(results);
    }

    /** Returns true if this call set the flag. */
    public boolean requestCancel() {
        return cancelRequested.compareAndSet(false, true);
    }

    public boolean isCancelRequested() {
        return cancelRequested.get();
    }
}
