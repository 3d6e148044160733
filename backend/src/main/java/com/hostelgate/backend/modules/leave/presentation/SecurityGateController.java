package com.hostelgate.backend.modules.leave.presentation;

import java.util.List;
import java.util.UUID;

import com.hostelgate.backend.global.security.SecurityUtils;
import com.hostelgate.backend.modules.leave.application.GatePassService;
import com.hostelgate.backend.modules.leave.application.LeaveQueryService;
import com.hostelgate.backend.modules.leave.application.VisitSnapshot;
import com.hostelgate.backend.modules.leave.presentation.dto.LeaveRequestResponse;
import com.hostelgate.backend.modules.leave.presentation.dto.ScanRequest;
import com.hostelgate.backend.modules.leave.presentation.dto.VerificationStatusRequest;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;

import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PatchMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@Tag(name = "Gate security")
@RestController
@RequestMapping("/security/leaves")
public class SecurityGateController {

    private final LeaveQueryService leaveQueryService;
    private final GatePassService gatePassService;

    public SecurityGateController(LeaveQueryService leaveQueryService, GatePassService gatePassService) {
        this.leaveQueryService = leaveQueryService;
        this.gatePassService = gatePassService;
    }

    @GetMapping("/approved")
    public ResponseEntity<List<LeaveRequestResponse>> listApproved() {
        return ResponseEntity.ok(leaveQueryService.listApproved());
    }

    @Operation(summary = "Record an outgoing scan", description = "The first outgoing scan also generates the incoming QR.")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Scan recorded"),
            @ApiResponse(responseCode = "403", description = "QR not available now"),
            @ApiResponse(responseCode = "409", description = "Same terminal scanned moments ago")
    })
    @PostMapping("/{requestId}/visits/outgoing")
    public ResponseEntity<VisitSnapshot> recordOutgoing(
            @PathVariable("requestId") UUID requestId,
            @Valid @RequestBody(required = false) ScanRequest request
    ) {
        String location = request != null ? request.location() : null;
        return ResponseEntity.ok(gatePassService.recordOutgoingVisit(requestId, SecurityUtils.getCurrentUserId(), location));
    }

    @PostMapping("/{requestId}/visits/incoming")
    public ResponseEntity<VisitSnapshot> recordIncoming(
            @PathVariable("requestId") UUID requestId,
            @Valid @RequestBody(required = false) ScanRequest request
    ) {
        String location = request != null ? request.location() : null;
        return ResponseEntity.ok(gatePassService.recordIncomingVisit(requestId, SecurityUtils.getCurrentUserId(), location));
    }

    @PatchMapping("/{requestId}/verification")
    public ResponseEntity<LeaveRequestResponse> updateVerification(
            @PathVariable("requestId") UUID requestId,
            @Valid @RequestBody VerificationStatusRequest request
    ) {
        return ResponseEntity.ok(gatePassService.updateVerificationStatus(
                requestId,
                SecurityUtils.getCurrentUserId(),
                request.status()
        ));
    }
}
