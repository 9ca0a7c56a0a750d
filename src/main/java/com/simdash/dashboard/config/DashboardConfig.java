package com.simdash.dashboard.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.simdash.dashboard.engine.DashboardPipeline;
import com.simdash.dashboard.metrics.Metrics;
import com.simdash.dashboard.render.RenderConsumer;
import com.simdash.dashboard.render.StepDownsampler;
import com.simdash.dashboard.source.EventSource;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.EnableScheduling;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

/**
 * Wiring for the dashboard pipeline.
 *
 * Key design decisions:
 * - Settings are read once at startup and never change afterwards
 * - Rendering gets its own single-thread scheduler, separate from event dispatch
 * - The pipeline is started and shut down through the bean lifecycle
 */
@Configuration
@EnableScheduling
public class DashboardConfig {

    @Value("${dashboard.monitored-keys:}")
    private String monitoredKeys;

    @Value("${dashboard.refresh-interval-ms:50}")
    private long refreshIntervalMs;

    @Value("${dashboard.max-points:1000}")
    private int maxPoints;

    @Value("${dashboard.downsample-target:500}")
    private int downsampleTarget;

    @Value("${dashboard.timestamp-policy:TRUST}")
    private TimestampPolicy timestampPolicy;

    @Bean
    public ObjectMapper objectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        return mapper;
    }

    @Bean
    public PipelineSettings pipelineSettings() {
        return PipelineSettings.of(
                PipelineSettings.parseKeys(monitoredKeys),
                refreshIntervalMs,
                maxPoints,
                downsampleTarget,
                timestampPolicy
        );
    }

    /**
     * Scheduler used by {@code @Scheduled} methods (event dispatch).
     */
    @Bean
    public ThreadPoolTaskScheduler taskScheduler() {
        return singleThreadScheduler("event-dispatch-");
    }

    /**
     * Dedicated render tick thread; ticks never overlap.
     */
    @Bean
    public ThreadPoolTaskScheduler renderTaskScheduler() {
        return singleThreadScheduler("render-tick-");
    }

    @Bean(initMethod = "start", destroyMethod = "shutdown")
    public DashboardPipeline dashboardPipeline(
            PipelineSettings settings,
            EventSource eventSource,
            StepDownsampler downsampler,
            RenderConsumer renderConsumer,
            @Qualifier("renderTaskScheduler") ThreadPoolTaskScheduler renderTaskScheduler,
            Metrics metrics
    ) {
        return new DashboardPipeline(
                settings,
                eventSource,
                downsampler,
                renderConsumer,
                renderTaskScheduler,
                metrics
        );
    }

    private static ThreadPoolTaskScheduler singleThreadScheduler(String threadNamePrefix) {
        ThreadPoolTaskScheduler scheduler = new ThreadPoolTaskScheduler();
        scheduler.setPoolSize(1);
        scheduler.setThreadNamePrefix(threadNamePrefix);
        scheduler.setWaitForTasksToCompleteOnShutdown(true);
        scheduler.setAwaitTerminationSeconds(5);
        return scheduler;
    }
}
