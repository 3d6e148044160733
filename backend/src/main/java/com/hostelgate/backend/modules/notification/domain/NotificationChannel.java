package com.hostelgate.backend.modules.notification.domain;

public enum NotificationChannel {
    IN_APP,
    SMS
}
