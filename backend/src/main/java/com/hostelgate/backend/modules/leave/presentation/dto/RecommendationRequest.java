package com.hostelgate.backend.modules.leave.presentation.dto;

import com.hostelgate.backend.modules.leave.domain.Recommendation;

import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;

public record RecommendationRequest(@NotNull Recommendation recommendation, @Size(max = 500) String comment) {
}
