package com.example.billingautomation.domain.enums;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * Invoice lifecycle as stored by the property management API
 */
@Getter
@RequiredArgsConstructor
public enum InvoiceStatus {

    PENDING("pending"),
    PAID("paid"),
    OVERDUE("overdue");

    @JsonValue
    private final String code;

    @JsonCreator
    public static InvoiceStatus fromCode(String code) {
        for (var status : values()) {
            if (status.getCode().equalsIgnoreCase(code)) {
                return status;
            }
        }
        throw new IllegalArgumentException("Unknown invoice status: " + code);
    }
}
