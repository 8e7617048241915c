package com.example.billingautomation.config;

import jakarta.validation.constraints.NotBlank;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

/**
 * Property management API connection settings
 */
@Data
@Validated
@Configuration
@ConfigurationProperties(prefix = "external-services.property-service")
public class PropertyServiceProperties {
    @NotBlank
    private String baseUrl;
    private int timeoutSeconds = 30;
}
