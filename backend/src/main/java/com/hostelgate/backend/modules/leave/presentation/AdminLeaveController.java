package com.hostelgate.backend.modules.leave.presentation;

import java.util.UUID;

import com.hostelgate.backend.global.security.SecurityUtils;
import com.hostelgate.backend.modules.leave.application.LeaveApprovalService;
import com.hostelgate.backend.modules.leave.application.LeaveExpiryReaper;
import com.hostelgate.backend.modules.leave.presentation.dto.ExpirySweepResponse;
import com.hostelgate.backend.modules.leave.presentation.dto.LeaveRequestResponse;
import com.hostelgate.backend.modules.leave.presentation.dto.RejectLeaveRequest;
import com.hostelgate.backend.modules.leave.presentation.dto.VerifyOtpRequest;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;

import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@Tag(name = "Leaves (admin)")
@RestController
@RequestMapping("/admin/leaves")
public class AdminLeaveController {

    private final LeaveApprovalService leaveApprovalService;
    private final LeaveExpiryReaper leaveExpiryReaper;

    public AdminLeaveController(LeaveApprovalService leaveApprovalService, LeaveExpiryReaper leaveExpiryReaper) {
        this.leaveApprovalService = leaveApprovalService;
        this.leaveExpiryReaper = leaveExpiryReaper;
    }

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
        return ResponseEntity.ok(leaveApprovalService.adminReject(requestId, SecurityUtils.getCurrentUserId(), request.reason()));
    }

    @Operation(summary = "Run the expiry sweep now", description = "Same job as the nightly schedule.")
    @PostMapping("/expiry-sweeps")
    public ResponseEntity<ExpirySweepResponse> runExpirySweep() {
        return ResponseEntity.ok(new ExpirySweepResponse(leaveExpiryReaper.runExpirySweep()));
    }
}
