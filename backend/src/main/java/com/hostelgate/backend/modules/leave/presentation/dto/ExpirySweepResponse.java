package com.hostelgate.backend.modules.leave.presentation.dto;

public record ExpirySweepResponse(int deletedCount) {
}
