package com.hostelgate.backend.modules.leave.presentation.dto;

import jakarta.validation.constraints.NotBlank;

public record VerifyOtpRequest(@NotBlank String otp) {
}
