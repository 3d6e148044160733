package com.hostelgate.backend.modules.leave.presentation.dto;

import com.hostelgate.backend.modules.leave.domain.DecisionOutcome;

import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;

public record PrincipalDecisionRequest(@NotNull DecisionOutcome decision, @Size(max = 500) String comment) {
}
