package com.strategylab.client;

import java.util.List;
import java.util.Optional;

/** Key-value store of job mirrors, keyed by job id, that outlives the client process. */
public interface BatchJobMirrorStore {

    Optional<BatchJobMirror> get(String jobId);

    /** Inserts or replaces the mirror stored under {@code mirror.getId()}. */
    void put(BatchJobMirror mirror);

    /** Every readable mirror; unreadable entries are skipped. */
    List<BatchJobMirror> findAll();

    void delete(String jobId);
}
