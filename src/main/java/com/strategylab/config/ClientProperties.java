package com.strategylab.config;

import java.time.Duration;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Configuration properties for the batch job client, which submits jobs to a remote
 * StrategyLab server and keeps a local mirror of their state.
 */
@Configuration
@ConfigurationProperties(prefix = "strategylab.client")
@Getter
@Setter
public class ClientProperties {

    /** Whether the client beans are created at all. */
    private boolean enabled = false;

    private String baseUrl = "http://localhost:8080";

    private Duration pollInterval = Duration.ofSeconds(2);

    private Duration initialPollDelay = Duration.ofSeconds(1);

    /** Directory holding one JSON file per mirrored job. */
    private String storeDirectory = "data/batch-jobs";

    /** Resume polling of unfinished mirrored jobs when the client starts. */
    private boolean resumeOnStartup = true;
}
