package com.example.billingautomation.client;

import com.example.billingautomation.domain.enums.InvoiceStatus;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.LocalDate;

/**
 * Request/Response DTOs for the property management API
 */
public class ClientModels {
    private ClientModels() {
    }

    // === Leases ===

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Lease {
        @JsonProperty("_id")
        private String id;
        private String tenantId;
        private String tenantName;
        private String propertyId;
        private String propertyAddress;
        private BigDecimal monthlyRent;
        private String status;
    }

    // === Invoices ===

    @Data
    @Builder(toBuilder = true)
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Invoice {
        @JsonProperty("_id")
        private String id;
        private String invoiceNumber;
        private String tenantId;
        private String tenantName;
        private String propertyId;
        private String propertyAddress;
        private BigDecimal amount;
        private LocalDate dueDate;
        private LocalDate issueDate;
        private InvoiceStatus status;
        private String description;
        private String month;
        private Integer year;
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class InvoiceStatusUpdate {
        private InvoiceStatus status;
    }

    // === Users ===

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class UserAccount {
        @JsonProperty("_id")
        private String id;
        private String name;
        private String email;
        private String role;
    }

    // === Notifications ===

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class NotificationRequest {
        private String userId;
        private String title;
        private String message;
        private String type;
        private boolean read;
    }
}
