package com.example.billingautomation.domain.enums;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * The three billing automations registered with the scheduler.
 * Each maps to a fixed task id and a manual trigger code.
 */
@Getter
@RequiredArgsConstructor
public enum AutomationTaskType {

    /**
     * Generate this month's invoices for every active lease
     */
    INVOICES("invoices", "monthly-invoice-generation", "Monthly Invoice Generation"),

    /**
     * Mark overdue invoices, alert tenants and escalate stale accounts
     */
    OVERDUE("overdue", "daily-overdue-check", "Daily Overdue Payment Check"),

    /**
     * Remind tenants ahead of their due date
     */
    REMINDERS("reminders", "daily-reminder-check", "Daily Payment Reminder Check");

    private final String code;
    private final String taskId;
    private final String displayName;

    /**
     * Find the automation by its manual trigger code
     */
    public static AutomationTaskType fromCode(String code) {
        for (var type : values()) {
            if (type.getCode().equals(code)) {
                return type;
            }
        }
        throw new IllegalArgumentException("Invalid task type. Must be: invoices, overdue, or reminders");
    }
}
