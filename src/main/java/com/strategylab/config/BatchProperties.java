package com.strategylab.config;

import java.time.Duration;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Configuration properties for batch backtesting.
 *
 * <p>Bounds how large a sweep may be, how hard one job may drive the evaluator, and how
 * long finished jobs stay in memory before reads fall back to the database.
 */
@Configuration
@ConfigurationProperties(prefix = "strategylab.batch")
@Getter
@Setter
public class BatchProperties {

    /** Hard cap on the number of assignments enumerated for one job. */
    private int maxAssignments = 10_000;

    /** Runs of a single job evaluated in parallel. */
    private int concurrency = 4;

    /** Jobs whose run loops execute at the same time; further jobs wait queued. */
    private int maxConcurrentJobs = 2;

    /** Jobs that may wait for a run-loop thread before submissions are rejected. */
    private int queueCapacity = 100;

    /** Maximum number of terminal job snapshots kept in memory. */
    private long terminalCacheSize = 500;

    /** How long a terminal snapshot stays cached after its last write. */
    private Duration terminalCacheTtl = Duration.ofMinutes(30);

    /** Upper bound for the page size of the result view. */
    private int viewPageLimit = 1000;

    /** Resume interrupted jobs after a restart instead of failing them. */
    private boolean resumeOnStartup = true;
}
