package com.example.billingautomation.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.List;

/**
 * Master switch plus a snapshot of each billing task, for the operations dashboard
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AutomationStatus {

    private boolean enabled;
    private List<TaskSummary> tasks;

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class TaskSummary {
        private String id;
        private String name;
        private boolean active;
        private Instant lastRun;
    }
}
