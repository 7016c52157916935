package com.strategylab.client;

import com.fasterxml.jackson.databind.JsonNode;
import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Keeps mirrors of in-flight jobs in step with the server.
 *
 * <p>Each tracked job gets one ticker that fetches the snapshot, merges it into the
 * stored mirror and writes it back. Ticks of the same job never overlap and a job is
 * never tracked twice. A ticker cancels itself once the merged mirror is terminal.
 * Failed polls are logged and retried on the next tick; they never touch the mirror.
 *
 * <p>Every snapshot, polled or handed in through {@link #apply(String, JsonNode)}, is
 * merged and written under a per-job lock, so a cancel response and a concurrent tick
 * cannot overwrite each other's progress.
 */
public class BatchJobPoller {

    private static final Logger log = LoggerFactory.getLogger(BatchJobPoller.class);

    private final BatchJobApiClient apiClient;
    private final BatchJobMirrorStore mirrorStore;
    private final BatchJobReconciler reconciler;
    private final ScheduledExecutorService scheduler;
    private final Duration interval;
    private final Duration initialDelay;
    private final Clock clock;

    private final Map<String, ScheduledFuture<?>> tickers = new ConcurrentHashMap<>();
    private final List<BatchJobListener> listeners = new CopyOnWriteArrayList<>();
    private final Map<String, Object> mirrorLocks = new ConcurrentHashMap<>();

    public BatchJobPoller(
            BatchJobApiClient apiClient,
            BatchJobMirrorStore mirrorStore,
            BatchJobReconciler reconciler,
            ScheduledExecutorService scheduler,
            Duration interval,
            Duration initialDelay,
            Clock clock) {
        this.apiClient = apiClient;
        this.mirrorStore = mirrorStore;
        this.reconciler = reconciler;
        this.scheduler = scheduler;
        this.interval = interval;
        this.initialDelay = initialDelay;
        this.clock = clock;
    }

    public void addListener(BatchJobListener listener) {
        listeners.add(listener);
    }

    /**
     * Starts polling {@code jobId} unless it is already being polled.
     *
     * @return true if a new ticker was started
     */
    public boolean track(String jobId) {
        boolean[] started = {false};
        tickers.computeIfAbsent(jobId, id -> {
            started[0] = true;
            return scheduler.scheduleWithFixedDelay(
                    () -> poll(id), initialDelay.toMillis(), interval.toMillis(), TimeUnit.MILLISECONDS);
        });
        if (started[0]) {
            log.debug("Tracking batch job {} every {} ms", jobId, interval.toMillis());
        }
        return started[0];
    }

    /** Restarts tickers for every stored mirror that is still queued or running. */
    public int resumeAll() {
        int resumed = 0;
        for (BatchJobMirror mirror : mirrorStore.findAll()) {
            if (!mirror.isTerminal() && mirror.getId() != null && track(mirror.getId())) {
                resumed++;
            }
        }
        if (resumed > 0) {
            log.info("Resumed polling of {} unfinished batch jobs", resumed);
        }
        return resumed;
    }

    public void stop(String jobId) {
        ScheduledFuture<?> ticker = tickers.remove(jobId);
        if (ticker != null) {
            ticker.cancel(false);
        }
    }

    public boolean isTracking(String jobId) {
        return tickers.containsKey(jobId);
    }

    public Set<String> trackedJobIds() {
        return Set.copyOf(tickers.keySet());
    }

    /** Cancels all tickers and shuts the scheduler down. Mirrors stay as stored. */
    public void shutdown() {
        tickers.keySet().forEach(this::stop);
        scheduler.shutdownNow();
    }

    /**
     * One poll of {@code jobId}. Never throws: an exception escaping a scheduled task
     * would silently end its ticker.
     */
    public void poll(String jobId) {
        try {
            apply(jobId, apiClient.fetch(jobId));
        } catch (BatchClientException e) {
            log.warn("Poll of batch job {} failed (status {}): {}", jobId, e.getStatusCode(), e.getMessage());
        } catch (RuntimeException e) {
            log.warn("Poll of batch job {} failed: {}", jobId, e.getMessage(), e);
        }
    }

    /**
     * Merges a server snapshot of {@code jobId} into its stored mirror and writes the
     * result back. Stops the ticker and notifies listeners like a poll does.
     *
     * @return the merged mirror as stored
     */
    public BatchJobMirror apply(String jobId, JsonNode snapshot) {
        BatchJobMirror merged;
        boolean becameTerminal;
        synchronized (mirrorLocks.computeIfAbsent(jobId, id -> new Object())) {
            BatchJobMirror previous = mirrorStore.get(jobId).orElse(null);
            merged = reconciler.merge(previous, snapshot, clock.instant());
            if (merged.getId() == null) {
                merged.setId(jobId);
            }
            mirrorStore.put(merged);
            becameTerminal = merged.isTerminal() && (previous == null || !previous.isTerminal());
        }

        if (merged.isTerminal()) {
            stop(jobId);
        }
        notifyListeners(merged, becameTerminal);
        if (becameTerminal) {
            log.info(
                    "Batch job {} is {}: {}/{} runs{}",
                    jobId,
                    merged.getStatus().getValue(),
                    merged.getCompleted(),
                    merged.getTotal(),
                    merged.getError() != null ? ", error: " + merged.getError() : "");
        }
        return merged;
    }

    private void notifyListeners(BatchJobMirror mirror, boolean terminal) {
        for (BatchJobListener listener : listeners) {
            try {
                listener.onUpdate(mirror);
                if (terminal) {
                    listener.onTerminal(mirror);
                }
            } catch (RuntimeException e) {
                log.error("Batch job listener failed for {}: {}", mirror.getId(), e.getMessage(), e);
            }
        }
    }
}
