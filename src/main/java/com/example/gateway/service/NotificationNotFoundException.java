package com.example.gateway.service;

public class NotificationNotFoundException extends RuntimeException {

    public NotificationNotFoundException(String notificationId) {
        super("Notification " + notificationId + " not found");
    }
}
