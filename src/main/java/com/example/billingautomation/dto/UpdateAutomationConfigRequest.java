package com.example.billingautomation.dto;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.PositiveOrZero;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Set;

/**
 * Partial update of the automation config. Null fields are left unchanged.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class UpdateAutomationConfigRequest {

    private Boolean enabled;

    @Min(value = 1, message = "generateDay must be between 1 and 31")
    @Max(value = 31, message = "generateDay must be between 1 and 31")
    private Integer generateDay;

    private Set<@PositiveOrZero Integer> reminderDaysBefore;

    private Set<@PositiveOrZero Integer> overdueCheckDays;

    @PositiveOrZero
    private Integer managerEscalationDays;
}
