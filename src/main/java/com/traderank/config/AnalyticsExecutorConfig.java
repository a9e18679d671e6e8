package com.traderank.config;

import java.util.concurrent.ThreadPoolExecutor;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/**
 * Worker pool for parallel daily summary computation. Idle unless
 * {@code traderank.analytics.parallel} is true.
 */
@Configuration
public class AnalyticsExecutorConfig {

    @Bean("analyticsExecutor")
    public ThreadPoolTaskExecutor analyticsExecutor(AnalyticsProperties analyticsProperties) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(analyticsProperties.getPoolSize());
        executor.setMaxPoolSize(analyticsProperties.getPoolSize());
        executor.setQueueCapacity(analyticsProperties.getQueueCapacity());
        executor.setThreadNamePrefix("analytics-");
        executor.setRejectedExecutionHandler(new ThreadPoolExecutor.CallerRunsPolicy());
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(30);
        return executor;
    }
}
