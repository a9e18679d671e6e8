package com.traderank.config;

import jakarta.validation.constraints.Min;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;
import org.springframework.validation.annotation.Validated;

/**
 * Tuning for the analysis engine, bound from {@code traderank.analytics}.
 *
 * <p>Parallelism only changes how fast daily summaries are produced. The fold into the
 * trading summary always runs on the calling thread over the date-sorted list.
 */
@Component
@Validated
@ConfigurationProperties(prefix = "traderank.analytics")
@Getter
@Setter
public class AnalyticsProperties {

    /** Compute one daily summary per worker task instead of sequentially. */
    private boolean parallel = false;

    /** Worker threads of the {@code analyticsExecutor} pool. */
    @Min(1)
    private int poolSize = Math.max(2, Runtime.getRuntime().availableProcessors());

    /** Pending daily tasks the pool queues before the caller runs them itself. */
    @Min(0)
    private int queueCapacity = 256;
}
