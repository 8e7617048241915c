package com.example.billingautomation.dto;

import com.example.billingautomation.domain.model.AutomationConfig;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Status and live config returned together by the status endpoint
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AutomationOverview {

    private AutomationStatus status;
    private AutomationConfig config;
}
