package com.hostelgate.backend.modules.leave.presentation;

import java.util.List;
import java.util.UUID;

import com.hostelgate.backend.global.security.SecurityUtils;
import com.hostelgate.backend.modules.leave.application.LeaveApprovalService;
import com.hostelgate.backend.modules.leave.application.LeaveQueryService;
import com.hostelgate.backend.modules.leave.domain.ApplicationType;
import com.hostelgate.backend.modules.leave.domain.LeaveStatus;
import com.hostelgate.backend.modules.leave.presentation.dto.ApproveLeaveRequest;
import com.hostelgate.backend.modules.leave.presentation.dto.LeaveRequestResponse;
import com.hostelgate.backend.modules.leave.presentation.dto.PrincipalDecisionRequest;
import com.hostelgate.backend.modules.leave.presentation.dto.RejectLeaveRequest;

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

@Tag(name = "Leaves (principal)")
@RestController
@RequestMapping("/principal")
public class PrincipalLeaveController {

    private final LeaveQueryService leaveQueryService;
    private final LeaveApprovalService leaveApprovalService;

    public PrincipalLeaveController(LeaveQueryService leaveQueryService, LeaveApprovalService leaveApprovalService) {
        this.leaveQueryService = leaveQueryService;
        this.leaveApprovalService = leaveApprovalService;
    }

    @Operation(summary = "Requests awaiting principal approval", description = "Only students of the caller's course and branch.")
    @GetMapping("/leaves")
    public ResponseEntity<List<LeaveRequestResponse>> listRequests(
            @RequestParam(name = "status", required = false) LeaveStatus status,
            @RequestParam(name = "type", required = false) ApplicationType type
    ) {
        return ResponseEntity.ok(leaveQueryService.listForPrincipal(SecurityUtils.getCurrentUserId(), status, type));
    }

    @GetMapping("/leaves/stay-in-hostel")
    public ResponseEntity<List<LeaveRequestResponse>> listStayRequests(
            @RequestParam(name = "status", required = false) LeaveStatus status
    ) {
        return ResponseEntity.ok(leaveQueryService.listStayRequestsForPrincipal(SecurityUtils.getCurrentUserId(), status));
    }

    @PostMapping("/leaves/{requestId}/approve")
    public ResponseEntity<LeaveRequestResponse> approve(
            @PathVariable("requestId") UUID requestId,
            @Valid @RequestBody(required = false) ApproveLeaveRequest request
    ) {
        String comment = request != null ? request.comment() : null;
        return ResponseEntity.ok(leaveApprovalService.principalApprove(requestId, SecurityUtils.getCurrentUserId(), comment));
    }

    @PostMapping("/leaves/{requestId}/reject")
    public ResponseEntity<LeaveRequestResponse> reject(
            @PathVariable("requestId") UUID requestId,
            @Valid @RequestBody RejectLeaveRequest request
    ) {
        return ResponseEntity.ok(leaveApprovalService.principalReject(requestId, SecurityUtils.getCurrentUserId(), request.reason()));
    }

    @Operation(summary = "Final decision on a recommended stay-in-hostel request")
    @PostMapping("/leaves/{requestId}/decision")
    public ResponseEntity<LeaveRequestResponse> decide(
            @PathVariable("requestId") UUID requestId,
            @Valid @RequestBody PrincipalDecisionRequest request
    ) {
        return ResponseEntity.ok(leaveApprovalService.principalDecide(
                requestId,
                SecurityUtils.getCurrentUserId(),
                request.decision(),
                request.comment()
        ));
    }

    @GetMapping("/students/{studentId}/leaves")
    public ResponseEntity<List<LeaveRequestResponse>> getStudentHistory(@PathVariable("studentId") UUID studentId) {
        return ResponseEntity.ok(leaveQueryService.getStudentHistory(SecurityUtils.getCurrentUserId(), studentId));
    }
}
