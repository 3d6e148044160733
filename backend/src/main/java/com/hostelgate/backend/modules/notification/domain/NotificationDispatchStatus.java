package com.hostelgate.backend.modules.notification.domain;

public enum NotificationDispatchStatus {
    SUCCESS,
    FAILED
}
