package com.hostelgate.backend.modules.leave.domain;

import java.util.EnumSet;
import java.util.Set;

public enum LeaveStatus {
    PENDING,
    PENDING_OTP_VERIFICATION,
    WARDEN_VERIFIED,
    PENDING_PRINCIPAL_APPROVAL,
    APPROVED,
    REJECTED,
    WARDEN_RECOMMENDED,
    PRINCIPAL_APPROVED,
    PRINCIPAL_REJECTED;

    private static final Set<LeaveStatus> TERMINAL = EnumSet.of(
            APPROVED, REJECTED, PRINCIPAL_APPROVED, PRINCIPAL_REJECTED);

    private static final Set<LeaveStatus> REAPABLE = EnumSet.of(
            PENDING, PENDING_OTP_VERIFICATION, WARDEN_VERIFIED);

    public boolean isTerminal() {
        return TERMINAL.contains(this);
    }

    /** Statuses the expiry sweep may delete once the requested dates have passed. */
    public boolean isReapable() {
        return REAPABLE.contains(this);
    }

    public boolean isDeletableByOwner() {
        return !isTerminal();
    }

    public static Set<LeaveStatus> reapable() {
        return EnumSet.copyOf(REAPABLE);
    }
}
