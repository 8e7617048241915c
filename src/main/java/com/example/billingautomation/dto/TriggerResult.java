package com.example.billingautomation.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Outcome of a manually triggered billing action
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TriggerResult {

    private String type;
    private String taskId;

    /**
     * Invoices created, overdue invoices processed, or reminders sent, depending on the type
     */
    private int processed;
}
