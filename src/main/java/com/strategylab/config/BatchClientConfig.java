package com.strategylab.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.strategylab.batch.AssignmentGenerator;
import com.strategylab.client.BatchJobApiClient;
import com.strategylab.client.BatchJobListener;
import com.strategylab.client.BatchJobMirrorStore;
import com.strategylab.client.BatchJobPoller;
import com.strategylab.client.BatchJobReconciler;
import com.strategylab.client.BatchSubmissionService;
import com.strategylab.client.FileBatchJobMirrorStore;
import com.strategylab.client.RestBatchJobApiClient;
import com.strategylab.variable.VariableResolver;
import java.nio.file.Path;
import java.time.Clock;
import java.util.concurrent.Executors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;

/**
 * Wires the batch job client when {@code strategylab.client.enabled=true}: REST access to
 * a StrategyLab server, a file-backed mirror store, the poller and the submission flow.
 */
@Configuration
@ConditionalOnProperty(prefix = "strategylab.client", name = "enabled", havingValue = "true")
public class BatchClientConfig {

    private static final Logger log = LoggerFactory.getLogger(BatchClientConfig.class);

    @Bean
    public BatchJobApiClient batchJobApiClient(
            RestTemplateBuilder builder, ClientProperties clientProperties, ObjectMapper objectMapper) {
        return new RestBatchJobApiClient(builder.rootUri(clientProperties.getBaseUrl()).build(), objectMapper);
    }

    @Bean
    public BatchJobMirrorStore batchJobMirrorStore(ClientProperties clientProperties, ObjectMapper objectMapper) {
        return new FileBatchJobMirrorStore(Path.of(clientProperties.getStoreDirectory()), objectMapper);
    }

    @Bean
    public BatchJobReconciler batchJobReconciler(ObjectMapper objectMapper) {
        return new BatchJobReconciler(objectMapper);
    }

    @Bean(destroyMethod = "shutdown")
    public BatchJobPoller batchJobPoller(
            BatchJobApiClient apiClient,
            BatchJobMirrorStore mirrorStore,
            BatchJobReconciler reconciler,
            ClientProperties clientProperties,
            ObjectProvider<BatchJobListener> listeners) {
        BatchJobPoller poller = new BatchJobPoller(
                apiClient,
                mirrorStore,
                reconciler,
                Executors.newSingleThreadScheduledExecutor(new CustomizableThreadFactory("batch-poll-")),
                clientProperties.getPollInterval(),
                clientProperties.getInitialPollDelay(),
                Clock.systemUTC());
        listeners.orderedStream().forEach(poller::addListener);
        return poller;
    }

    @Bean
    public BatchSubmissionService batchSubmissionService(
            VariableResolver variableResolver,
            AssignmentGenerator assignmentGenerator,
            BatchJobApiClient apiClient,
            BatchJobMirrorStore mirrorStore,
            BatchJobReconciler reconciler,
            BatchJobPoller poller,
            BatchProperties batchProperties) {
        return new BatchSubmissionService(
                variableResolver,
                assignmentGenerator,
                apiClient,
                mirrorStore,
                reconciler,
                poller,
                Clock.systemUTC(),
                batchProperties.getMaxAssignments());
    }

    @Bean
    public ApplicationRunner batchJobPollerResume(BatchJobPoller poller, ClientProperties clientProperties) {
        return args -> {
            if (!clientProperties.isResumeOnStartup()) {
                log.info("Batch client resume on startup disabled");
                return;
            }
            poller.resumeAll();
        };
    }
}
