package com.example.billingautomation.controller;

import com.example.billingautomation.domain.enums.AutomationTaskType;
import com.example.billingautomation.domain.model.AutomationConfig;
import com.example.billingautomation.dto.ApiResponse;
import com.example.billingautomation.dto.AutomationOverview;
import com.example.billingautomation.dto.TaskResponse;
import com.example.billingautomation.dto.TriggerResult;
import com.example.billingautomation.dto.UpdateAutomationConfigRequest;
import com.example.billingautomation.exception.TaskNotFoundException;
import com.example.billingautomation.mapper.TaskMapper;
import com.example.billingautomation.service.billing.BillingAutomationService;
import com.example.billingautomation.service.scheduler.RecurringTaskScheduler;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

/**
 * REST API controller for the billing automation.
 * <p>
 * Provides endpoints for:
 * - Reading automation status and config
 * - Updating the live config
 * - Triggering a billing action on demand
 * - Inspecting and toggling scheduled tasks
 */
@Slf4j
@RestController
@RequiredArgsConstructor
@RequestMapping("/api/v1/automation")
@Tag(name = "Billing Automation", description = "APIs for managing automated invoicing, overdue checks and reminders")
public class AutomationController {

    private final BillingAutomationService billingAutomationService;
    private final RecurringTaskScheduler scheduler;
    private final TaskMapper taskMapper;

    // === Status & Config ===

    @GetMapping("/status")
    @Operation(summary = "Get automation status", description = "Master switch, billing task snapshots and live config")
    public ResponseEntity<ApiResponse<AutomationOverview>> getStatus() {
        var overview = AutomationOverview.builder()
                .status(billingAutomationService.getStatus())
                .config(billingAutomationService.getConfig())
                .build();

        return ResponseEntity.ok(ApiResponse.success(overview));
    }

    @RequestMapping(value = "/config", method = {RequestMethod.PUT, RequestMethod.PATCH})
    @Operation(summary = "Update automation config", description = "Merge the provided fields into the live config")
    public ResponseEntity<ApiResponse<AutomationConfig>> updateConfig(@Valid @RequestBody UpdateAutomationConfigRequest request) {
        log.info("API: Update automation config {}", request);

        var config = billingAutomationService.updateConfig(request);
        return ResponseEntity.ok(ApiResponse.success(config, "Automation configuration updated successfully"));
    }

    // === Manual Trigger ===

    @PostMapping("/trigger")
    @Operation(summary = "Trigger a billing action", description = "Run invoices, overdue or reminders immediately")
    public ResponseEntity<ApiResponse<TriggerResult>> trigger(
            @Parameter(description = "invoices, overdue or reminders") @RequestParam String type) {
        var taskType = AutomationTaskType.fromCode(type);
        log.info("API: Manual trigger {}", taskType.getCode());

        var result = billingAutomationService.manualTrigger(taskType);
        return ResponseEntity.ok(ApiResponse.success(result, taskType.getCode() + " task triggered successfully"));
    }

    // === Tasks ===

    @GetMapping("/tasks")
    @Operation(summary = "List scheduled tasks", description = "Every task registered with the scheduler")
    public ResponseEntity<ApiResponse<List<TaskResponse>>> getTasks() {
        return ResponseEntity.ok(ApiResponse.success(taskMapper.toResponseList(scheduler.getTasks())));
    }

    @GetMapping("/tasks/{taskId}")
    @Operation(summary = "Get scheduled task", description = "A single task by id")
    public ResponseEntity<ApiResponse<TaskResponse>> getTask(@Parameter(description = "Task id") @PathVariable String taskId) {
        var task = scheduler.getTask(taskId).orElseThrow(() -> new TaskNotFoundException(taskId));
        return ResponseEntity.ok(ApiResponse.success(taskMapper.toResponse(task)));
    }

    @PostMapping("/tasks/{taskId}/toggle")
    @Operation(summary = "Toggle a scheduled task", description = "Flip the active flag of a task")
    public ResponseEntity<ApiResponse<TaskResponse>> toggleTask(@Parameter(description = "Task id") @PathVariable String taskId) {
        log.info("API: Toggle task {}", taskId);

        if (!scheduler.toggleTask(taskId)) {
            throw new TaskNotFoundException(taskId);
        }

        var task = scheduler.getTask(taskId).orElseThrow(() -> new TaskNotFoundException(taskId));
        var state = task.isActive() ? "activated" : "deactivated";
        return ResponseEntity.ok(ApiResponse.success(taskMapper.toResponse(task), "Task " + taskId + " " + state));
    }
}
