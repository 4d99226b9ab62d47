package com.phillippitts.glasscast.config;

import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.binder.MeterBinder;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.concurrent.ThreadPoolExecutor;

/**
 * Exposes the event executor through Micrometer.
 *
 * <p>Gauges:
 * <ul>
 *   <li>glasscast.event.pool.size - current number of threads</li>
 *   <li>glasscast.event.pool.active - threads running a listener</li>
 *   <li>glasscast.event.pool.queued - events waiting for a thread</li>
 *   <li>glasscast.event.pool.completed - cumulative completed listener calls</li>
 * </ul>
 *
 * <p>Also logs a pool summary every 5 minutes.
 */
@Configuration
public class ThreadPoolMetricsConfig {

    private static final Logger LOG = LogManager.getLogger(ThreadPoolMetricsConfig.class);

    private final ObjectProvider<ThreadPoolTaskExecutor> eventExecutorProvider;

    public ThreadPoolMetricsConfig(
            @Qualifier("eventExecutor") ObjectProvider<ThreadPoolTaskExecutor> eventExecutorProvider) {
        this.eventExecutorProvider = eventExecutorProvider;
    }

    @Bean
    public MeterBinder eventExecutorMetrics() {
        return registry -> {
            ThreadPoolExecutor executor = eventExecutorProvider.getObject().getThreadPoolExecutor();

            Gauge.builder("glasscast.event.pool.size", executor, ThreadPoolExecutor::getPoolSize)
                    .description("Current number of threads in the event pool")
                    .register(registry);

            Gauge.builder("glasscast.event.pool.active", executor, ThreadPoolExecutor::getActiveCount)
                    .description("Number of threads running event listeners")
                    .register(registry);

            Gauge.builder("glasscast.event.pool.queued", executor, e -> e.getQueue().size())
                    .description("Number of events waiting in the queue")
                    .register(registry);

            Gauge.builder("glasscast.event.pool.completed", executor, ThreadPoolExecutor::getCompletedTaskCount)
                    .description("Cumulative count of completed listener calls")
                    .register(registry);

            LOG.info("Event pool metrics registered: glasscast.event.pool.* available via /actuator/metrics");
        };
    }

    @Scheduled(fixedRate = 300_000) // 5 minutes
    public void logThreadPoolHealth() {
        ThreadPoolExecutor executor = eventExecutorProvider.getObject().getThreadPoolExecutor();
        LOG.info("Event Pool Health: size={}/{}, active={}, queued={}, completed={}",
                executor.getPoolSize(),
                executor.getMaximumPoolSize(),
                executor.getActiveCount(),
                executor.getQueue().size(),
                executor.getCompletedTaskCount());
    }
}
