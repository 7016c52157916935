package com.strategylab.batch;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.strategylab.config.BatchProperties;
import com.strategylab.domain.model.BatchJob;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Owns the in-memory view of batch jobs: a handle per live job, and a bounded cache of
 * terminal snapshots. Evicted snapshots are reloaded from {@link BatchJobStore}.
 */
@Component
public class BatchJobRegistry {

    private static final Logger log = LoggerFactory.getLogger(BatchJobRegistry.class);

    private final ConcurrentHashMap<String, BatchJobHandle> live = new ConcurrentHashMap<>();
    private final Cache<String, BatchJob> terminal;

    public BatchJobRegistry(BatchProperties batchProperties) {
        this.terminal = Caffeine.newBuilder()
                .maximumSize(batchProperties.getTerminalCacheSize())
                .expireAfterWrite(batchProperties.getTerminalCacheTtl())
                .build();
    }

    /**
     * Registers a live job.
     *
     * @throws IllegalStateException if a handle with the same id is already registered
     */
    public BatchJobHandle register(BatchJob initial) {
        BatchJobHandle handle = new BatchJobHandle(initial);
        BatchJobHandle existing = live.putIfAbsent(initial.getId(), handle);
        if (existing != null) {
            throw new IllegalStateException("Batch job already registered: " + initial.getId());
        }
        return handle;
    }

    public Optional<BatchJobHandle> handle(String jobId) {
        return Optional.ofNullable(live.get(jobId));
    }

    public boolean contains(String jobId) {
        return live.containsKey(jobId) || terminal.getIfPresent(jobId) != null;
    }

    /** Live snapshot first, then the terminal cache. */
    public Optional<BatchJob> snapshot(String jobId) {
        BatchJobHandle handle = live.get(jobId);
        if (handle != null) {
            return Optional.of(handle.current());
        }
        return Optional.ofNullable(terminal.getIfPresent(jobId));
    }

    /** Moves a job that reached a terminal status out of the live map. */
    public void retire(BatchJob finalSnapshot) {
        terminal.put(finalSnapshot.getId(), finalSnapshot);
        live.remove(finalSnapshot.getId());
        log.debug("Batch job {} retired as {}", finalSnapshot.getId(), finalSnapshot.getStatus().getValue());
    }

    /** Caches a terminal snapshot read from the store. */
    public void cacheTerminal(BatchJob snapshot) {
        if (snapshot.isTerminal()) {
            terminal.put(snapshot.getId(), snapshot);
        }
    }

    public int activeCount() {
        return live.size();
    }

    public Collection<BatchJob> liveSnapshots() {
        return live.values().stream().map(BatchJobHandle::current).toList();
    }

    public List<String> liveJobIds() {
        return List.copyOf(live.keySet());
    }
}
