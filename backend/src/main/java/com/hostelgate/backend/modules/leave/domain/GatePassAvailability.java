package com.hostelgate.backend.modules.leave.domain;

public enum GatePassAvailability {
    AVAILABLE,
    NOT_APPROVED,
    LOCKED,
    NOT_YET_AVAILABLE,
    EXPIRED;

    public boolean isAvailable() {
        return this == AVAILABLE;
    }
}
