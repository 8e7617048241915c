package com.example.billingautomation.domain.model;

import lombok.*;

import java.time.Instant;
import java.time.YearMonth;
import java.time.ZoneId;

/**
 * A named recurring job held in the in-memory scheduler registry.
 * <p>
 * Supports:
 * - A schedule from the small fixed vocabulary of {@link ScheduleExpression}
 * - An active flag toggled by operators or by the automation config
 * - Last-run tracking used for once-per-month idempotence
 * <p>
 * The id is the registry key and never changes once the task is registered.
 */
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder(toBuilder = true)
public class ScheduledTask {

    private String id;

    private String name;

    /**
     * Raw schedule expression, e.g. {@code @daily} or {@code *}{@code /15}
     */
    private String schedule;

    private volatile boolean active;

    /**
     * When the action last completed (successfully or not)
     */
    private volatile Instant lastRun;

    /**
     * Next expected evaluation. Advisory only, firing is decided on each tick.
     */
    private volatile Instant nextRun;

    private TaskAction action;

    public ScheduleExpression parsedSchedule() {
        return ScheduleExpression.parse(schedule);
    }

    public boolean isMonthly() {
        return ScheduleExpression.MONTHLY.equals(schedule);
    }

    /**
     * Whether the last run fell in the same calendar month as {@code now}, in the given zone.
     */
    public boolean hasRunInMonthOf(Instant now, ZoneId zone) {
        if (lastRun == null) {
            return false;
        }
        return YearMonth.from(lastRun.atZone(zone)).equals(YearMonth.from(now.atZone(zone)));
    }

    /**
     * Detached copy for read-only callers
     */
    public ScheduledTask snapshot() {
        return toBuilder().build();
    }
}
