package com.example.billingautomation.domain.model;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Parsed form of a task schedule.
 * <p>
 * Supported vocabulary:
 * - {@code @monthly} (30 day nominal period, evaluated hourly)
 * - {@code @weekly}
 * - {@code @daily}
 * - {@code @hourly}
 * - {@code *}{@code /N} for every N minutes
 * <p>
 * Anything else is accepted and treated as daily, with a warning.
 */
@Slf4j
@Getter
@EqualsAndHashCode
public final class ScheduleExpression {

    public static final String MONTHLY = "@monthly";
    public static final String WEEKLY = "@weekly";
    public static final String DAILY = "@daily";
    public static final String HOURLY = "@hourly";

    private static final Map<String, Duration> NAMED_PERIODS = Map.of(
            MONTHLY, Duration.ofDays(30),
            WEEKLY, Duration.ofDays(7),
            DAILY, Duration.ofDays(1),
            HOURLY, Duration.ofHours(1)
    );

    private static final Pattern EVERY_N_MINUTES = Pattern.compile("^\\*/(\\d+)$");

    private final String expression;
    private final Duration period;
    private final boolean monthly;
    private final boolean recognized;

    private ScheduleExpression(String expression, Duration period, boolean monthly, boolean recognized) {
        this.expression = expression;
        this.period = period;
        this.monthly = monthly;
        this.recognized = recognized;
    }

    /**
     * Parse a schedule string. Never throws: unknown formats fall back to daily.
     */
    public static ScheduleExpression parse(String expression) {
        if (expression != null) {
            var named = NAMED_PERIODS.get(expression);
            if (named != null) {
                return new ScheduleExpression(expression, named, MONTHLY.equals(expression), true);
            }

            var matcher = EVERY_N_MINUTES.matcher(expression);
            if (matcher.matches()) {
                try {
                    var minutes = Long.parseLong(matcher.group(1));
                    if (minutes > 0) {
                        return new ScheduleExpression(expression, Duration.ofMinutes(minutes), false, true);
                    }
                } catch (NumberFormatException e) {
                    log.warn("Minute interval out of range in schedule \"{}\"", expression);
                }
            }
        }

        log.warn("Unknown schedule format \"{}\", defaulting to daily", expression);
        return new ScheduleExpression(expression, NAMED_PERIODS.get(DAILY), false, false);
    }

    /**
     * How often the scheduler should evaluate a task with this schedule.
     * Monthly schedules are checked on the given short interval; every other
     * schedule is checked once per nominal period.
     */
    public Duration checkInterval(Duration monthlyCheckInterval) {
        return monthly ? monthlyCheckInterval : period;
    }

    @Override
    public String toString() {
        return expression;
    }
}
