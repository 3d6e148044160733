package com.hostelgate.backend.modules.leave.domain;

/**
 * Gate-side verification marker. Moves independently of {@link LeaveStatus}.
 */
public enum VerificationStatus {
    NOT_VERIFIED,
    VERIFIED,
    EXPIRED,
    COMPLETED
}
