package com.example.billingautomation.config;

import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.RequiredArgsConstructor;
import org.springframework.context.annotation.Configuration;

import java.util.concurrent.atomic.AtomicInteger;

/**
 * Metrics for the automation core.
 * <p>
 * Exposes Prometheus metrics for:
 * - Task firings by task id and outcome
 * - Firing duration
 * - Ticks skipped because the previous firing was still running
 * - Active task count
 * - Notifications sent and failed
 */
@Configuration
@RequiredArgsConstructor
public class MetricsConfig {

    private final MeterRegistry meterRegistry;

    /**
     * Register a gauge tracking the number of active tasks
     */
    public AtomicInteger registerActiveTaskGauge() {
        var activeTasks = new AtomicInteger();
        meterRegistry.gauge("automation_tasks_active", activeTasks);
        return activeTasks;
    }

    public Timer.Sample startTaskTimer() {
        return Timer.start(meterRegistry);
    }

    /**
     * Record one firing of a task
     */
    public void recordTaskFiring(Timer.Sample sample, String taskId, boolean success) {
        sample.stop(Timer.builder("automation_task_execution_time")
                .tag("task", taskId)
                .tag("success", String.valueOf(success))
                .description("Task action execution time")
                .register(meterRegistry));
    }

    public void recordSkippedTick(String taskId) {
        meterRegistry.counter("automation_task_skipped_ticks", "task", taskId).increment();
    }

    /**
     * Record a notification attempt by kind
     */
    public void recordNotification(String kind, boolean success) {
        meterRegistry.counter("automation_notifications",
                "kind", kind,
                "success", String.valueOf(success)
        ).increment();
    }
}
