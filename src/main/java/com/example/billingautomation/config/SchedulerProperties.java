package com.example.billingautomation.config;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;
import java.time.ZoneId;

/**
 * Configuration properties for the in-process recurring task scheduler.
 * Loaded from application.yml.
 */
@Data
@Validated
@Configuration
@ConfigurationProperties(prefix = "scheduler")
public class SchedulerProperties {

    /**
     * Zone used for calendar decisions (day of month, same-month checks)
     */
    @NotBlank
    private String zone = ZoneId.systemDefault().getId();

    /**
     * How often monthly tasks are evaluated
     */
    @NotNull
    private Duration monthlyCheckInterval = Duration.ofHours(1);

    /**
     * Threads driving the per-task tickers
     */
    @Min(1)
    private int tickerPoolSize = 2;

    /**
     * Threads running task actions
     */
    @Min(1)
    private int actionPoolSize = 4;

    public ZoneId zoneId() {
        return ZoneId.of(zone);
    }
}
