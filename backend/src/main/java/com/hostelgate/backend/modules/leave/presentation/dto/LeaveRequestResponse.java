package com.hostelgate.backend.modules.leave.presentation.dto;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.time.OffsetDateTime;
import java.util.List;
import java.util.UUID;

import com.fasterxml.jackson.annotation.JsonInclude;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record LeaveRequestResponse(
        UUID id,
        StudentSummary student,
        String applicationType,
        String status,
        String reason,
        LocalDate startDate,
        LocalDate endDate,
        LocalDateTime gatePassDateTime,
        LocalDate permissionDate,
        LocalTime outTime,
        LocalTime inTime,
        LocalDate stayDate,
        Integer otpResendCount,
        OffsetDateTime otpIssuedAt,
        Approval wardenVerification,
        Approval wardenRecommendation,
        Approval principalDecision,
        Approval rejection,
        GatePassResponse gatePass,
        String verificationStatus,
        OffsetDateTime completedAt,
        OffsetDateTime createdAt,
        OffsetDateTime updatedAt
) {

    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record StudentSummary(
            UUID id,
            String fullName,
            String rollNumber,
            String courseName,
            String branchName
    ) {
    }

    /** One step of the approval trail; {@code value} carries the recommendation, outcome or rejection stage. */
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record Approval(
            String value,
            String comment,
            UUID actorId,
            OffsetDateTime at
    ) {
    }

    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record GatePassResponse(
            OffsetDateTime qrAvailableFrom,
            OffsetDateTime validUntil,
            int visitCount,
            int maxVisits,
            boolean visitLocked,
            int outgoingVisitCount,
            int incomingVisitCount,
            boolean incomingQrGenerated,
            OffsetDateTime incomingQrGeneratedAt,
            OffsetDateTime incomingQrExpiresAt,
            List<VisitResponse> visits
    ) {
    }

    public record VisitResponse(
            UUID id,
            String type,
            OffsetDateTime scannedAt,
            UUID scannedBy,
            String location
    ) {
    }
}
