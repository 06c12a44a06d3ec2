package com.positionalert.engine.application.config;

import java.util.concurrent.ThreadPoolExecutor;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/**
 * Bounded pools for provider fetches and alert evaluation. Both run saturated work on the
 * submitting thread, so fan-out never exceeds pool size plus queue.
 */
@Configuration
public class ExecutorConfig {

    @Bean
    public ThreadPoolTaskExecutor marketDataExecutor(AlertProperties properties) {
        int workers = properties.provider().maxConcurrentFetches();
        return boundedPool("market-data-", workers, workers * 4);
    }

    @Bean
    public ThreadPoolTaskExecutor alertEvaluationExecutor(AlertProperties properties) {
        int workers = properties.run().evaluationConcurrency();
        return boundedPool("alert-eval-", workers, workers * 4);
    }

    private static ThreadPoolTaskExecutor boundedPool(String prefix, int workers, int queueCapacity) {
        var executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(workers);
        executor.setMaxPoolSize(workers);
        executor.setQueueCapacity(queueCapacity);
        executor.setThreadNamePrefix(prefix);
        executor.setRejectedExecutionHandler(new ThreadPoolExecutor.CallerRunsPolicy());
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(30);
        executor.initialize();
        return executor;
    }
}
