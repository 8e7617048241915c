package com.example.billingautomation.service.scheduler;

import com.example.billingautomation.config.MetricsConfig;
import com.example.billingautomation.config.SchedulerProperties;
import com.example.billingautomation.domain.model.ScheduledTask;
import io.micrometer.core.instrument.Timer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.util.*;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * In-process registry of named recurring tasks.
 * <p>
 * Each active task gets its own periodic ticker. On every tick the task is
 * evaluated and, when due, its action is handed to the action executor:
 * - non-monthly schedules fire on every tick (the tick interval is the nominal period)
 * - {@code @monthly} is ticked hourly and fires only on day 1, at most once per calendar month
 * <p>
 * Missed periods are not replayed. An action failure is logged, the last-run
 * time is still recorded, and the task stays active. A tick is skipped while the
 * previous firing of the same task is still running.
 * <p>
 * State lives in memory for the life of the process. Running two instances
 * fires every task twice.
 */
@Slf4j
@Service
public class RecurringTaskScheduler {

    private final TaskScheduler ticker;
    private final Executor actionExecutor;
    private final Clock clock;
    private final SchedulerProperties properties;
    private final MetricsConfig metricsConfig;

    private final Map<String, ScheduledTask> tasks = new LinkedHashMap<>();
    private final Map<String, ScheduledFuture<?>> tickers = new HashMap<>();
    private final Map<String, Duration> checkIntervals = new ConcurrentHashMap<>();
    private final Set<String> firing = ConcurrentHashMap.newKeySet();
    private final AtomicInteger activeTaskGauge;

    private boolean started;
    private boolean stopped;

    public RecurringTaskScheduler(@Qualifier("automationTaskScheduler") TaskScheduler ticker,
                                  @Qualifier("automationActionExecutor") Executor actionExecutor,
                                  Clock clock,
                                  SchedulerProperties properties,
                                  MetricsConfig metricsConfig) {
        this.ticker = ticker;
        this.actionExecutor = actionExecutor;
        this.clock = clock;
        this.properties = properties;
        this.metricsConfig = metricsConfig;
        this.activeTaskGauge = metricsConfig.registerActiveTaskGauge();
    }

    // === Registry ===

    /**
     * Insert or replace a task by id. An active task starts being evaluated right away.
     * A replacement keeps the previous last-run time unless the new definition carries one.
     */
    public synchronized void addTask(ScheduledTask task) {
        Objects.requireNonNull(task.getId(), "Task id is required");
        Objects.requireNonNull(task.getAction(), "Task action is required");

        var previous = tasks.get(task.getId());
        if (previous != null) {
            cancelTicker(task.getId());
            if (task.getLastRun() == null) {
                task.setLastRun(previous.getLastRun());
            }
        }

        tasks.put(task.getId(), task);
        if (task.isActive()) {
            arm(task);
        }
        refreshActiveGauge();

        log.info("Scheduled task \"{}\" {} ({}, {})", task.getName(), previous != null ? "replaced" : "added",
                task.getSchedule(), task.isActive() ? "active" : "inactive");
    }

    /**
     * Stop evaluating and forget a task. Unknown ids are ignored.
     */
    public synchronized void removeTask(String taskId) {
        cancelTicker(taskId);
        var removed = tasks.remove(taskId);
        refreshActiveGauge();

        if (removed != null) {
            log.info("Task \"{}\" removed", taskId);
        } else {
            log.debug("Remove requested for unknown task \"{}\"", taskId);
        }
    }

    /**
     * Flip the active flag of a task and start or stop its evaluation.
     *
     * @return false if no task is registered under this id
     */
    public synchronized boolean toggleTask(String taskId) {
        var task = tasks.get(taskId);
        if (task == null) {
            log.warn("Toggle requested for unknown task \"{}\"", taskId);
            return false;
        }

        task.setActive(!task.isActive());

        if (task.isActive()) {
            arm(task);
            log.info("Task \"{}\" activated", task.getName());
        } else {
            cancelTicker(taskId);
            task.setNextRun(null);
            log.info("Task \"{}\" deactivated", task.getName());
        }
        refreshActiveGauge();

        return true;
    }

    public synchronized Optional<ScheduledTask> getTask(String taskId) {
        return Optional.ofNullable(tasks.get(taskId)).map(ScheduledTask::snapshot);
    }

    public synchronized List<ScheduledTask> getTasks() {
        return tasks.values().stream().map(ScheduledTask::snapshot).toList();
    }

    // === Lifecycle ===

    /**
     * Start evaluation for every active task. Calling it again schedules nothing twice.
     */
    public synchronized void start() {
        log.info("Starting scheduler service...");
        stopped = false;
        started = true;

        tasks.values().stream()
                .filter(ScheduledTask::isActive)
                .forEach(this::arm);

        log.info("Scheduler started with {} tasks ({} active)", tasks.size(), tickers.size());
    }

    /**
     * Cancel every ticker. No action starts after this returns; an action
     * already running is left to complete.
     */
    public synchronized void stop() {
        log.info("Stopping scheduler service...");
        stopped = true;
        started = false;

        tickers.values().forEach(future -> future.cancel(false));
        tickers.clear();
        checkIntervals.clear();
        tasks.values().forEach(task -> task.setNextRun(null));

        log.info("All scheduled tasks stopped");
    }

    public synchronized boolean isRunning() {
        return started;
    }

    // === Evaluation ===

    /**
     * One ticker tick for the given task: decide whether it is due and, if so, fire it.
     * Never throws, so a failing tick cannot cancel its own ticker.
     */
    void evaluate(String taskId) {
        try {
            ScheduledTask task;
            synchronized (this) {
                task = tasks.get(taskId);
                if (task == null || !task.isActive() || !tickers.containsKey(taskId)) {
                    return;
                }
            }

            var now = clock.instant();
            var interval = checkIntervals.get(taskId);
            if (interval != null) {
                task.setNextRun(now.plus(interval));
            }

            if (!isDue(task, now)) {
                log.debug("Task \"{}\" not due at {}", task.getName(), now);
                return;
            }

            if (!firing.add(taskId)) {
                log.warn("Task \"{}\" is still running from a previous tick, skipping", task.getName());
                metricsConfig.recordSkippedTick(taskId);
                return;
            }

            log.info("Running scheduled task: {}", task.getName());
            var sample = metricsConfig.startTaskTimer();
            try {
                actionExecutor.execute(() -> fire(task, sample));
            } catch (RejectedExecutionException e) {
                firing.remove(taskId);
                log.error("Action executor rejected task \"{}\": {}", task.getName(), e.getMessage());
            }
        } catch (Exception e) {
            log.error("Error evaluating task \"{}\": {}", taskId, e.getMessage(), e);
        }
    }

    /**
     * Monthly tasks are due on day 1 when they have not yet run this calendar month.
     * Every other schedule is due on each tick.
     */
    boolean isDue(ScheduledTask task, Instant now) {
        if (!task.isMonthly()) {
            return true;
        }

        var zone = zone();
        if (now.atZone(zone).getDayOfMonth() != 1) {
            return false;
        }
        return !task.hasRunInMonthOf(now, zone);
    }

    private void fire(ScheduledTask task, Timer.Sample sample) {
        if (!isArmed(task.getId())) {
            firing.remove(task.getId());
            log.debug("Task \"{}\" was stopped before its action started, skipping", task.getName());
            return;
        }

        var success = false;
        try {
            task.getAction().run();
            success = true;
            log.info("Completed scheduled task: {}", task.getName());
        } catch (Exception e) {
            log.error("Error in scheduled task \"{}\": {}", task.getName(), e.getMessage(), e);
        } finally {
            recordLastRun(task, clock.instant());
            firing.remove(task.getId());
            metricsConfig.recordTaskFiring(sample, task.getId(), success);
        }
    }

    private synchronized boolean isArmed(String taskId) {
        return tickers.containsKey(taskId);
    }

    private synchronized void recordLastRun(ScheduledTask task, Instant when) {
        task.setLastRun(when);
        var current = tasks.get(task.getId());
        if (current != null && current != task) {
            current.setLastRun(when);
        }
    }

    // === Tickers ===

    private void arm(ScheduledTask task) {
        if (stopped) {
            log.debug("Scheduler stopped, task \"{}\" will be armed on next start", task.getName());
            return;
        }
        if (tickers.containsKey(task.getId())) {
            return;
        }

        var interval = task.parsedSchedule().checkInterval(properties.getMonthlyCheckInterval());
        var firstTick = clock.instant().plus(interval);
        var taskId = task.getId();

        var future = ticker.scheduleAtFixedRate(() -> evaluate(taskId), firstTick, interval);
        tickers.put(taskId, future);
        checkIntervals.put(taskId, interval);
        task.setNextRun(firstTick);

        log.debug("Task \"{}\" evaluated every {}", task.getName(), interval);
    }

    private void cancelTicker(String taskId) {
        var future = tickers.remove(taskId);
        if (future != null) {
            future.cancel(false);
        }
        checkIntervals.remove(taskId);
    }

    private ZoneId zone() {
        return clock.getZone();
    }

    private void refreshActiveGauge() {
        activeTaskGauge.set((int) tasks.values().stream().filter(ScheduledTask::isActive).count());
    }
}
