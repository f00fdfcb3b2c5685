package com.example.gateway.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;
import java.util.Optional;

public enum NotificationType {
    EMAIL("email"),
    PUSH("push");

    private final String value;

    NotificationType(String value) {
        this.value = value;
    }

    @JsonValue
    public String value() {
        return value;
    }

    /** Routing key on the direct exchange, e.g. {@code notification.email}. */
    public String routingKey() {
        return "notification." + value;
    }

    public static Optional<NotificationType> find(String raw) {
        if (raw == null) {
            return Optional.empty();
        }
        String normalized = raw.trim().toLowerCase(Locale.ROOT);
        for (NotificationType type : values()) {
            if (type.value.equals(normalized)) {
                return Optional.of(type);
            }
        }
        return Optional.empty();
    }

    @JsonCreator
    public static NotificationType fromValue(String raw) {
        return find(raw).orElseThrow(() ->
                new IllegalArgumentException("notification_type must be one of email, push"));
    }
}
