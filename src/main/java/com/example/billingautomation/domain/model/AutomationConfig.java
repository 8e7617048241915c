package com.example.billingautomation.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Live billing automation policy.
 * <p>
 * Held in memory for the life of the process and reset to the configured
 * defaults on restart.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class AutomationConfig {

    /**
     * Master switch for the three billing tasks
     */
    private boolean enabled;

    /**
     * Day of month (1-31) on which monthly invoices are generated
     */
    private int generateDay;

    /**
     * Days before the due date on which a reminder is sent
     */
    @Builder.Default
    private Set<Integer> reminderDaysBefore = new LinkedHashSet<>();

    /**
     * Days past due at which overdue alerts are grouped. Not scheduled separately.
     */
    @Builder.Default
    private Set<Integer> overdueCheckDays = new LinkedHashSet<>();

    /**
     * Days past due from which an overdue account is escalated to managers
     */
    private int managerEscalationDays;

    public AutomationConfig copy() {
        return toBuilder()
                .reminderDaysBefore(new LinkedHashSet<>(reminderDaysBefore))
                .overdueCheckDays(new LinkedHashSet<>(overdueCheckDays))
                .build();
    }
}
