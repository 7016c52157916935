package com.strategylab.config;

import java.util.concurrent.Executor;
import java.util.concurrent.ThreadPoolExecutor;
import org.slf4j.LoggerFactory;
import org.springframework.aop.interceptor.AsyncUncaughtExceptionHandler;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.AsyncConfigurer;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/**
 * Thread pools of the service.
 *
 * <ul>
 *   <li>{@code eventExecutor}: default for {@code @Async} methods and async listeners</li>
 *   <li>{@code batchJobExecutor}: one thread per running job loop, bounded by
 *       {@code strategylab.batch.max-concurrent-jobs}; further jobs queue</li>
 *   <li>{@code evaluatorExecutor}: evaluator calls of all jobs; each job limits its own
 *       share with a semaphore of {@code strategylab.batch.concurrency} permits</li>
 * </ul>
 */
@Configuration
public class AsyncConfig implements AsyncConfigurer {

    @Value("${strategylab.async.core-pool-size:2}")
    private int corePoolSize;

    @Value("${strategylab.async.max-pool-size:4}")
    private int maxPoolSize;

    @Value("${strategylab.async.queue-capacity:500}")
    private int queueCapacity;

    private final BatchProperties batchProperties;

    public AsyncConfig(BatchProperties batchProperties) {
        this.batchProperties = batchProperties;
    }

    @Bean("eventExecutor")
    public ThreadPoolTaskExecutor eventExecutor() {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(corePoolSize);
        executor.setMaxPoolSize(maxPoolSize);
        executor.setQueueCapacity(queueCapacity);
        executor.setThreadNamePrefix("event-");
        executor.setRejectedExecutionHandler(new ThreadPoolExecutor.CallerRunsPolicy());
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(30);
        return executor;
    }

    @Bean("batchJobExecutor")
    public ThreadPoolTaskExecutor batchJobExecutor() {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(batchProperties.getMaxConcurrentJobs());
        executor.setMaxPoolSize(batchProperties.getMaxConcurrentJobs());
        executor.setQueueCapacity(batchProperties.getQueueCapacity());
        executor.setThreadNamePrefix("batch-job-");
        executor.setWaitForTasksToCompleteOnShutdown(false);
        return executor;
    }

    @Bean("evaluatorExecutor")
    public ThreadPoolTaskExecutor evaluatorExecutor() {
        int threads = Math.max(1, batchProperties.getMaxConcurrentJobs() * batchProperties.getConcurrency());
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(threads);
        executor.setMaxPoolSize(threads);
        executor.setThreadNamePrefix("evaluator-");
        executor.setWaitForTasksToCompleteOnShutdown(false);
        return executor;
    }

    @Override
    public Executor getAsyncExecutor() {
        return eventExecutor();
    }

    @Override
    public AsyncUncaughtExceptionHandler getAsyncUncaughtExceptionHandler() {
        return (throwable, method, params) -> LoggerFactory.getLogger(method.getDeclaringClass())
                .error("Uncaught error in async {}.{}: {}", method.getDeclaringClass().getSimpleName(),
                        method.getName(), throwable.getMessage(), throwable);
    }
}
