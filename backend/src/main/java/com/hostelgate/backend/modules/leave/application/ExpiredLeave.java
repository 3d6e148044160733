package com.hostelgate.backend.modules.leave.application;

import java.time.LocalDate;
import java.util.UUID;

import com.hostelgate.backend.modules.leave.domain.ApplicationType;
import com.hostelgate.backend.modules.leave.domain.LeaveRequest;
import com.hostelgate.backend.modules.leave.domain.LeaveStatus;

/**
 * Detached copy of an expired request, taken before the expiry notice is sent.
 */
public record ExpiredLeave(
        UUID requestId,
        UUID studentId,
        ApplicationType applicationType,
        LeaveStatus status,
        LocalDate lastDate
) {

    public static ExpiredLeave of(LeaveRequest request) {
        return new ExpiredLeave(
                request.getId(),
                request.getStudentId(),
                request.getApplicationType(),
                request.getStatus(),
                request.getSchedule().lastDate()
        );
    }
}
