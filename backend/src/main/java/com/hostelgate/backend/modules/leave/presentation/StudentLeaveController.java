package com.hostelgate.backend.modules.leave.presentation;

import java.util.List;
import java.util.UUID;

import com.hostelgate.backend.global.security.SecurityUtils;
import com.hostelgate.backend.modules.leave.application.GatePassService;
import com.hostelgate.backend.modules.leave.application.LeaveRequestService;
import com.hostelgate.backend.modules.leave.application.OtpGateway;
import com.hostelgate.backend.modules.leave.application.OtpResendResult;
import com.hostelgate.backend.modules.leave.application.QrAvailability;
import com.hostelgate.backend.modules.leave.presentation.dto.CreateLeaveRequest;
import com.hostelgate.backend.modules.leave.presentation.dto.LeaveRequestResponse;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;

import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@Tag(name = "Leaves (student)")
@RestController
@RequestMapping("/leaves")
public class StudentLeaveController {

    private final LeaveRequestService leaveRequestService;
    private final OtpGateway otpGateway;
    private final GatePassService gatePassService;

    public StudentLeaveController(
            LeaveRequestService leaveRequestService,
            OtpGateway otpGateway,
            GatePassService gatePassService
    ) {
        this.leaveRequestService = leaveRequestService;
        this.otpGateway = otpGateway;
        this.gatePassService = gatePassService;
    }

    @Operation(summary = "Submit a leave, permission or stay-in-hostel request")
    @ApiResponses({
            @ApiResponse(responseCode = "201", description = "Request created"),
            @ApiResponse(responseCode = "422", description = "Invalid fields or daily limit reached")
    })
    @PostMapping
    public ResponseEntity<LeaveRequestResponse> createRequest(@Valid @RequestBody CreateLeaveRequest request) {
        LeaveRequestResponse response = leaveRequestService.createRequest(SecurityUtils.getCurrentUserId(), request.toCommand());
        return ResponseEntity.status(HttpStatus.CREATED).body(response);
    }

    @GetMapping("/me")
    public ResponseEntity<List<LeaveRequestResponse>> getMyRequests() {
        return ResponseEntity.ok(leaveRequestService.getStudentRequests(SecurityUtils.getCurrentUserId()));
    }

    @GetMapping("/{requestId}")
    public ResponseEntity<LeaveRequestResponse> getRequest(@PathVariable("requestId") UUID requestId) {
        return ResponseEntity.ok(leaveRequestService.getRequest(requestId, SecurityUtils.getCurrentUserId()));
    }

    @DeleteMapping("/{requestId}")
    public ResponseEntity<Void> deleteRequest(@PathVariable("requestId") UUID requestId) {
        leaveRequestService.deleteRequest(requestId, SecurityUtils.getCurrentUserId());
        return ResponseEntity.noContent().build();
    }

    @Operation(summary = "Resend the parent OTP", description = "Allowed once every cooldown period; the same code is sent again.")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "OTP resent"),
            @ApiResponse(responseCode = "429", description = "Cooldown still running; see Retry-After")
    })
    @PostMapping("/{requestId}/otp/resend")
    public ResponseEntity<OtpResendResult> resendOtp(@PathVariable("requestId") UUID requestId) {
        return ResponseEntity.ok(otpGateway.resend(requestId, SecurityUtils.getCurrentUserId()));
    }

    @GetMapping("/{requestId}/qr")
    public ResponseEntity<QrAvailability> getQr(@PathVariable("requestId") UUID requestId) {
        return ResponseEntity.ok(gatePassService.requestQrView(requestId, SecurityUtils.getCurrentUserId()));
    }

    @GetMapping("/{requestId}/qr/incoming")
    public ResponseEntity<QrAvailability> getIncomingQr(@PathVariable("requestId") UUID requestId) {
        return ResponseEntity.ok(gatePassService.requestIncomingQrView(requestId, SecurityUtils.getCurrentUserId()));
    }
}
