package com.hostelgate.backend.modules.leave.presentation.dto;

import jakarta.validation.constraints.Size;

public record ApproveLeaveRequest(@Size(max = 500) String comment) {
}
