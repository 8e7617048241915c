package com.example.billingautomation.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.task.TaskExecutor;
import org.springframework.scheduling.annotation.EnableAsync;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

import java.time.Clock;

/**
 * Threading for the automation core.
 * <p>
 * Two pools:
 * - a small ticker pool that only evaluates whether a task is due
 * - an action pool that runs the task actions, so a slow action never delays another task's tick
 */
@Slf4j
@EnableAsync
@Configuration
public class AsyncConfig {

    /**
     * Drives one periodic ticker per active task.
     */
    @Bean(name = "automationTaskScheduler")
    public ThreadPoolTaskScheduler automationTaskScheduler(SchedulerProperties properties) {
        log.info("Creating automation ticker pool with {} threads", properties.getTickerPoolSize());

        var scheduler = new ThreadPoolTaskScheduler();
        scheduler.setPoolSize(properties.getTickerPoolSize());
        scheduler.setThreadNamePrefix("automation-tick-");
        scheduler.setRemoveOnCancelPolicy(true);
        scheduler.setWaitForTasksToCompleteOnShutdown(false);
        scheduler.initialize();

        return scheduler;
    }

    /**
     * Runs task actions fire-and-forget relative to the ticker.
     */
    @Bean(name = "automationActionExecutor")
    public TaskExecutor automationActionExecutor(SchedulerProperties properties) {
        log.info("Creating automation action executor with {} threads", properties.getActionPoolSize());

        var executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(properties.getActionPoolSize());
        executor.setMaxPoolSize(properties.getActionPoolSize());
        executor.setQueueCapacity(100);
        executor.setThreadNamePrefix("automation-action-");
        executor.setRejectedExecutionHandler((r, e) -> {
            log.warn("Action rejected from automation executor, running in caller thread");
            if (!e.isShutdown()) {
                r.run();
            }
        });
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(60);
        executor.initialize();

        return executor;
    }

    /**
     * Executor for Spring's @Async methods (Slack alerts).
     */
    @Bean(name = "taskExecutor")
    public TaskExecutor taskExecutor() {
        var executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(2);
        executor.setMaxPoolSize(4);
        executor.setQueueCapacity(200);
        executor.setThreadNamePrefix("async-alert-");
        executor.initialize();

        return executor;
    }

    /**
     * Calendar decisions (day of month, same month) are made in the configured zone.
     */
    @Bean
    public Clock automationClock(SchedulerProperties properties) {
        return Clock.system(properties.zoneId());
    }
}
