package com.example.billingautomation.config;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

import java.util.ArrayList;
import java.util.List;

/**
 * Startup defaults for the billing automation config.
 * The live config starts from these values and is never written back.
 */
@Data
@Validated
@Configuration
@ConfigurationProperties(prefix = "billing-automation")
public class BillingAutomationProperties {

    private boolean enabled = true;

    @Min(1)
    @Max(31)
    private int generateDay = 1;

    private List<Integer> reminderDaysBefore = new ArrayList<>(List.of(7, 3, 1));

    private List<Integer> overdueCheckDays = new ArrayList<>(List.of(1, 3, 7, 14));

    @Min(0)
    private int managerEscalationDays = 14;

    /**
     * Currency code used in tenant-facing messages
     */
    private String currency = "ZAR";

    /**
     * Locale tag used to format amounts in tenant-facing messages
     */
    private String locale = "en-ZA";

    private Export export = new Export();

    @Data
    public static class Export {

        /**
         * Write a JSON copy of each monthly invoice batch
         */
        private boolean enabled = true;

        private String directory = "exports";
    }
}
