package com.hostelgate.backend.modules.leave.presentation.dto;

import jakarta.validation.constraints.Size;

public record ScanRequest(@Size(max = 100) String location) {
}
