package com.hostelgate.backend.modules.leave.application;

import java.time.OffsetDateTime;
import java.util.UUID;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * Read-only snapshot of a gate pass as shown on the student's device.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record QrAvailability(
        UUID requestId,
        String qrType,
        boolean available,
        String reason,
        Integer visitCount,
        Integer maxVisits,
        Integer remainingVisits,
        Boolean visitLocked,
        Long minutesUntilAvailable,
        OffsetDateTime qrAvailableFrom,
        OffsetDateTime validUntil,
        Boolean incomingQrGenerated,
        OffsetDateTime incomingQrExpiresAt
) {
}
