package com.example.billingautomation.domain.model;

/**
 * Side-effecting unit of work attached to a {@link ScheduledTask}.
 * <p>
 * Implementations should be idempotent within a period. Anything thrown is
 * caught and logged by the scheduler.
 */
@FunctionalInterface
public interface TaskAction {

    void run() throws Exception;
}
