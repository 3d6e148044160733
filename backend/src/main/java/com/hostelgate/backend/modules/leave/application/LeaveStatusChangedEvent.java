package com.hostelgate.backend.modules.leave.application;

import java.util.UUID;

import com.hostelgate.backend.modules.leave.domain.ApplicationType;
import com.hostelgate.backend.modules.leave.domain.LeaveStatus;

/**
 * Published whenever a request is created or changes status. {@code previous} is null on submission.
 */
public record LeaveStatusChangedEvent(
        UUID requestId,
        UUID studentId,
        ApplicationType applicationType,
        LeaveStatus previous,
        LeaveStatus current,
        UUID actorId,
        String comment
) {

    public boolean isSubmission() {
        return previous == null;
    }
}
