package com.hostelgate.backend.modules.leave.presentation;

import java.util.List;
import java.util.UUID;

import com.hostelgate.backend.global.security.SecurityUtils;
import com.hostelgate.backend.modules.leave.application.LeaveApprovalService;
import com.hostelgate.backend.modules.leave.application.LeaveQueryService;
import com.hostelgate.backend.modules.leave.domain.ApplicationType;
import com.hostelgate.backend.modules.leave.domain.LeaveStatus;
import com.hostelgate.backend.modules.leave.presentation.dto.LeaveRequestResponse;
import com.hostelgate.backend.modules.leave.presentation.dto.RecommendationRequest;
import com.hostelgate.backend.modules.leave.presentation.dto.RejectLeaveRequest;
import com.hostelgate.backend.modules.leave.presentation.dto.VerifyOtpRequest;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;

import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@Tag(name = "Leaves (warden)")
@RestController
@RequestMapping("/warden/leaves")
public class WardenLeaveController {

    private final LeaveQueryService leaveQueryService;
    private final LeaveApprovalService leaveApprovalService;

    public WardenLeaveController(LeaveQueryService leaveQueryService, LeaveApprovalService leaveApprovalService) {
        this.leaveQueryService = leaveQueryService;
        this.leaveApprovalService = leaveApprovalService;
    }

    @GetMapping
    public ResponseEntity<List<LeaveRequestResponse>> listRequests(
            @RequestParam(name = "status", required = false) LeaveStatus status,
            @RequestParam(name = "type", required = false) ApplicationType type
    ) {
        return ResponseEntity.ok(leaveQueryService.listForWarden(SecurityUtils.getCurrentUserId(), status, type));
    }

    @GetMapping("/stay-in-hostel")
    public ResponseEntity<List<LeaveRequestResponse>> listStayRequests() {
        return ResponseEntity.ok(leaveQueryService.listStayRequestsForWarden(SecurityUtils.getCurrentUserId()));
    }

    @Operation(summary = "Verify the parent OTP", description = "A wrong code counts towards the attempt limit.")
    @PostMapping("/{requestId}/otp/verify")
    public ResponseEntity<LeaveRequestResponse> verifyOtp(
            @PathVariable("requestId") UUID requestId,
            @Valid @RequestBody VerifyOtpRequest request
    ) {
        return ResponseEntity.ok(leaveApprovalService.verifyOtp(requestId, SecurityUtils.getCurrentUserId(), request.otp()));
    }

    @PostMapping("/{requestId}/reject")
    public ResponseEntity<LeaveRequestResponse> reject(
            @PathVariable("requestId") UUID requestId,
            @Valid @RequestBody RejectLeaveRequest request
    ) {
        return ResponseEntity.ok(leaveApprovalService.wardenReject(requestId, SecurityUtils.getCurrentUserId(), request.reason()));
    }

    @Operation(summary = "Recommend or decline a stay-in-hostel request")
    @PostMapping("/{requestId}/recommendation")
    public ResponseEntity<LeaveRequestResponse> recommend(
            @PathVariable("requestId") UUID requestId,
            @Valid @RequestBody RecommendationRequest request
    ) {
        return ResponseEntity.ok(leaveApprovalService.wardenRecommend(
                requestId,
                SecurityUtils.getCurrentUserId(),
                request.recommendation(),
                request.comment()
        ));
    }
}
