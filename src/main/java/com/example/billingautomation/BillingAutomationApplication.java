package com.example.billingautomation;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Billing Automation Service Application
 * <p>
 * Runs the recurring billing jobs of a property management platform:
 * monthly rent invoice generation, a daily overdue sweep with manager
 * escalation, and daily payment reminders.
 * <p>
 * Features:
 * - In-process recurring task scheduler with per-task activation
 * - Live automation config, adjustable over HTTP
 * - Manual triggering of each billing action
 * - Slack alerting for escalations and generation failures
 */
@SpringBootApplication
public class BillingAutomationApplication {

    public static void main(String[] args) {
        SpringApplication.run(BillingAutomationApplication.class, args);
    }
}
