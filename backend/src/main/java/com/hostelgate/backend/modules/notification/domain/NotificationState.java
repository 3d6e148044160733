package com.hostelgate.backend.modules.notification.domain;

public enum NotificationState {
    UNREAD,
    READ,
    EXPIRED
}
