package com.example.billingautomation.exception;

import lombok.Getter;

/**
 * Raised at the API edge when a scheduled task id is not registered
 */
@Getter
public class TaskNotFoundException extends RuntimeException {

    private final String taskId;

    public TaskNotFoundException(String taskId) {
        super("Task not found: " + taskId);
        this.taskId = taskId;
    }
}
