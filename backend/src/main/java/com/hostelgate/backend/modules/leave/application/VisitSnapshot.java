package com.hostelgate.backend.modules.leave.application;

import java.time.OffsetDateTime;
import java.util.UUID;

import com.hostelgate.backend.modules.leave.domain.VerificationStatus;
import com.hostelgate.backend.modules.leave.domain.VisitType;

/**
 * Gate pass counters right after a scan was recorded.
 */
public record VisitSnapshot(
        UUID requestId,
        UUID studentId,
        VisitType visitType,
        OffsetDateTime scannedAt,
        String location,
        int visitCount,
        int maxVisits,
        int remainingVisits,
        boolean visitLocked,
        int outgoingVisitCount,
        int incomingVisitCount,
        boolean incomingQrGenerated,
        OffsetDateTime incomingQrExpiresAt,
        VerificationStatus verificationStatus
) {
}
