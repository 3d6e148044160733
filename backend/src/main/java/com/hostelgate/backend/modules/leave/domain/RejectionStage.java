package com.hostelgate.backend.modules.leave.domain;

public enum RejectionStage {
    WARDEN,
    PRINCIPAL,
    ADMIN
}
