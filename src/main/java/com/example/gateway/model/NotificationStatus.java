package com.example.gateway.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum NotificationStatus {
    PENDING("pending"),
    DELIVERED("delivered"),
    FAILED("failed");

    private final String value;

    NotificationStatus(String value) {
        this.value = value;
    }

    @JsonValue
    public String value() {
        return value;
    }

    @JsonCreator
    public static NotificationStatus fromValue(String raw) {
        if (raw != null) {
            String normalized = raw.trim().toLowerCase(Locale.ROOT);
            for (NotificationStatus status : values()) {
                if (status.value.equals(normalized)) {
                    return status;
                }
            }
        }
        throw new IllegalArgumentException("status must be one of pending, delivered, failed");
    }
}
