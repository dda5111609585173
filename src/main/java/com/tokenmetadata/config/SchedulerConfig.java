package com.tokenmetadata.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.EnableScheduling;
import org.springframework.scheduling.annotation.SchedulingConfigurer;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;
import org.springframework.scheduling.config.ScheduledTaskRegistrar;

/**
 * Scheduler pool (2 threads) for @Scheduled jobs, plus the timer pool that re-queues retried events.
 */
@Configuration
@EnableScheduling
public class SchedulerConfig implements SchedulingConfigurer {

    public static final String SCHEDULER_POOL = "scheduler-pool";
    public static final String PIPELINE_RETRY_SCHEDULER = "pipeline-retry-scheduler";

    @Bean(name = SCHEDULER_POOL)
    public ThreadPoolTaskScheduler schedulerPool() {
        ThreadPoolTaskScheduler s = new ThreadPoolTaskScheduler();
        s.setPoolSize(2);
        s.setThreadNamePrefix("scheduler-");
        s.initialize();
        return s;
    }

    /** Only hands due retries back to the worker pool; never runs pipeline work itself. */
    @Bean(name = PIPELINE_RETRY_SCHEDULER)
    public ThreadPoolTaskScheduler pipelineRetryScheduler() {
        ThreadPoolTaskScheduler s = new ThreadPoolTaskScheduler();
        s.setPoolSize(2);
        s.setThreadNamePrefix("pipeline-retry-");
        s.setRemoveOnCancelPolicy(true);
        s.initialize();
        return s;
    }

    @Override
    public void configureTasks(ScheduledTaskRegistrar registrar) {
        registrar.setTaskScheduler(schedulerPool());
    }
}
