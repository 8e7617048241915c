package com.example.billingautomation.service.billing;

import com.example.billingautomation.service.scheduler.RecurringTaskScheduler;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.SmartLifecycle;
import org.springframework.stereotype.Component;

/**
 * Registers the billing tasks and starts the scheduler once the context is up,
 * and stops all tickers first on shutdown (SIGINT/SIGTERM via the Spring shutdown hook).
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class AutomationLifecycle implements SmartLifecycle {

    private final BillingAutomationService billingAutomationService;
    private final RecurringTaskScheduler scheduler;

    @Override
    public void start() {
        log.info("Initializing automated invoice system...");
        billingAutomationService.initialize();
        scheduler.start();
        log.info("Automated invoice system started");
    }

    @Override
    public void stop() {
        log.info("Shutting down automated invoice system...");
        scheduler.stop();
    }

    @Override
    public boolean isRunning() {
        return scheduler.isRunning();
    }
}
