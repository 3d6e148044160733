package com.hostelgate.backend.modules.leave.presentation.dto;

import com.hostelgate.backend.modules.leave.domain.VerificationStatus;

import jakarta.validation.constraints.NotNull;

public record VerificationStatusRequest(@NotNull VerificationStatus status) {
}
