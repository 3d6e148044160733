package com.hostelgate.backend.modules.leave.domain;

public enum DecisionOutcome {
    APPROVED,
    REJECTED
}
