package com.hostelgate.backend.modules.leave.presentation.dto;

import java.util.List;

import com.hostelgate.backend.modules.auth.application.StudentProfile;
import com.hostelgate.backend.modules.leave.domain.GatePass;
import com.hostelgate.backend.modules.leave.domain.LeaveRequest;
import com.hostelgate.backend.modules.leave.domain.LeaveSchedule;
import com.hostelgate.backend.modules.leave.domain.OtpChallenge;
import com.hostelgate.backend.modules.leave.domain.PrincipalDecision;
import com.hostelgate.backend.modules.leave.domain.Rejection;
import com.hostelgate.backend.modules.leave.domain.WardenRecommendation;
import com.hostelgate.backend.modules.leave.domain.WardenVerification;

public final class LeaveDtoMapper {

    private LeaveDtoMapper() {
    }

    /**
     * @param student may be null when the directory no longer knows the student
     */
    public static LeaveRequestResponse toResponse(LeaveRequest request, StudentProfile student) {
        LeaveSchedule schedule = request.getSchedule();
        LeaveSchedule.LeaveWindow leave = schedule instanceof LeaveSchedule.LeaveWindow window ? window : null;
        LeaveSchedule.PermissionWindow permission = schedule instanceof LeaveSchedule.PermissionWindow window ? window : null;
        LeaveSchedule.StayWindow stay = schedule instanceof LeaveSchedule.StayWindow window ? window : null;
        OtpChallenge otp = request.getOtp();

        return new LeaveRequestResponse(
                request.getId(),
                toStudentSummary(request, student),
                request.getApplicationType().name(),
                request.getStatus().name(),
                request.getReason(),
                leave != null ? leave.startDate() : null,
                leave != null ? leave.endDate() : null,
                leave != null ? leave.gatePassDateTime() : null,
                permission != null ? permission.permissionDate() : null,
                permission != null ? permission.outTime() : null,
                permission != null ? permission.inTime() : null,
                stay != null ? stay.stayDate() : null,
                otp != null ? otp.getResendCount() : null,
                otp != null ? otp.getIssuedAt() : null,
                toApproval(request.getWardenVerification()),
                toApproval(request.getWardenRecommendation()),
                toApproval(request.getPrincipalDecision()),
                toApproval(request.getRejection()),
                toGatePassResponse(request),
                request.getVerificationStatus().name(),
                request.getCompletedAt(),
                request.getCreatedAt(),
                request.getUpdatedAt()
        );
    }

    private static LeaveRequestResponse.StudentSummary toStudentSummary(LeaveRequest request, StudentProfile student) {
        if (student == null) {
            return new LeaveRequestResponse.StudentSummary(request.getStudentId(), null, null, null, null);
        }
        return new LeaveRequestResponse.StudentSummary(
                student.id(),
                student.fullName(),
                student.rollNumber(),
                student.courseName(),
                student.branchName()
        );
    }

    private static LeaveRequestResponse.Approval toApproval(WardenVerification verification) {
        if (verification == null) {
            return null;
        }
        return new LeaveRequestResponse.Approval("VERIFIED", null, verification.getVerifiedBy(), verification.getVerifiedAt());
    }

    private static LeaveRequestResponse.Approval toApproval(WardenRecommendation recommendation) {
        if (recommendation == null || recommendation.getValue() == null) {
            return null;
        }
        return new LeaveRequestResponse.Approval(
                recommendation.getValue().name(),
                recommendation.getComment(),
                recommendation.getRecommendedBy(),
                recommendation.getRecommendedAt()
        );
    }

    private static LeaveRequestResponse.Approval toApproval(PrincipalDecision decision) {
        if (decision == null || decision.getOutcome() == null) {
            return null;
        }
        return new LeaveRequestResponse.Approval(
                decision.getOutcome().name(),
                decision.getComment(),
                decision.getDecidedBy(),
                decision.getDecidedAt()
        );
    }

    private static LeaveRequestResponse.Approval toApproval(Rejection rejection) {
        if (rejection == null || rejection.getStage() == null) {
            return null;
        }
        return new LeaveRequestResponse.Approval(
                rejection.getStage().name(),
                rejection.getReason(),
                rejection.getRejectedBy(),
                rejection.getRejectedAt()
        );
    }

    private static LeaveRequestResponse.GatePassResponse toGatePassResponse(LeaveRequest request) {
        GatePass pass = request.getGatePass();
        if (pass == null || pass.getQrAvailableFrom() == null) {
            return null;
        }
        List<LeaveRequestResponse.VisitResponse> visits = request.getVisits().stream()
                .map(visit -> new LeaveRequestResponse.VisitResponse(
                        visit.getId(),
                        visit.getType().name(),
                        visit.getScannedAt(),
                        visit.getScannedBy(),
                        visit.getLocation()
                ))
                .toList();
        return new LeaveRequestResponse.GatePassResponse(
                pass.getQrAvailableFrom(),
                pass.getValidUntil(),
                pass.getVisitCount(),
                pass.getMaxVisits(),
                pass.isVisitLocked(),
                pass.getOutgoingVisitCount(),
                pass.getIncomingVisitCount(),
                pass.isIncomingQrGenerated(),
                pass.getIncomingQrGeneratedAt(),
                pass.getIncomingQrExpiresAt(),
                visits
        );
    }
}
