package com.hostelgate.backend.modules.notification.presentation.dto;

public record MarkAllReadResponse(int updatedCount) {
}
