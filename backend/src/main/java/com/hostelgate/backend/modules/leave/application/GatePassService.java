package com.hostelgate.backend.modules.leave.application;

import java.time.Duration;
import java.time.OffsetDateTime;
import java.util.Map;
import java.util.UUID;

import com.hostelgate.backend.global.common.time.IstTimeWindow;
import com.hostelgate.backend.global.error.RequestValidationException;
import com.hostelgate.backend.modules.audit.application.AuditLogService;
import com.hostelgate.backend.modules.audit.application.AuditLogService.AuditLogCommand;
import com.hostelgate.backend.modules.auth.application.StudentDirectory;
import com.hostelgate.backend.modules.leave.domain.GatePass;
import com.hostelgate.backend.modules.leave.domain.GatePassAvailability;
import com.hostelgate.backend.modules.leave.domain.LeaveRequest;
import com.hostelgate.backend.modules.leave.domain.LeaveSchedule;
import com.hostelgate.backend.modules.leave.domain.LeaveStatus;
import com.hostelgate.backend.modules.leave.domain.VerificationStatus;
import com.hostelgate.backend.modules.leave.domain.VisitType;
import com.hostelgate.backend.modules.leave.infrastructure.persistence.LeaveRequestRepository;
import com.hostelgate.backend.modules.leave.presentation.dto.LeaveDtoMapper;
import com.hostelgate.backend.modules.leave.presentation.dto.LeaveRequestResponse;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Gate pass windows, QR views and scan recording. Scans hold the request row lock from the availability
 * check through the counter update, so two terminals scanning the same pass are serialised.
 */
@Service
@Transactional
public class GatePassService {

    private static final Logger log = LoggerFactory.getLogger(GatePassService.class);

    static final String DEFAULT_LOCATION = "Main Gate";
    static final String INCOMING_NOT_GENERATED = "Incoming QR not yet generated. Please scan outgoing QR first.";
    static final String INCOMING_EXPIRED = "Incoming QR has expired";

    private final LeaveRequestRepository leaveRequestRepository;
    private final StudentDirectory studentDirectory;
    private final AuditLogService auditLogService;
    private final IstTimeWindow timeWindow;
    private final LeaveProperties properties;

    public GatePassService(
            LeaveRequestRepository leaveRequestRepository,
            StudentDirectory studentDirectory,
            AuditLogService auditLogService,
            IstTimeWindow timeWindow,
            LeaveProperties properties
    ) {
        this.leaveRequestRepository = leaveRequestRepository;
        this.studentDirectory = studentDirectory;
        this.auditLogService = auditLogService;
        this.timeWindow = timeWindow;
        this.properties = properties;
    }

    /**
     * Leaves open a little before midnight of the start date; permissions open at midnight of the permission date.
     * Both close at the last instant of their final IST day.
     */
    public void openFor(LeaveRequest request) {
        LeaveSchedule schedule = request.getSchedule();
        OffsetDateTime availableFrom;
        OffsetDateTime validUntil;
        if (schedule instanceof LeaveSchedule.LeaveWindow leave) {
            availableFrom = timeWindow.startOfDay(leave.startDate()).minus(properties.gatePass().leaveLeadTime());
            validUntil = timeWindow.endOfDay(leave.endDate());
        } else if (schedule instanceof LeaveSchedule.PermissionWindow permission) {
            availableFrom = timeWindow.startOfDay(permission.permissionDate());
            validUntil = timeWindow.endOfDay(permission.permissionDate());
        } else {
            throw new IllegalStateException("Request " + request.getId() + " has no gate pass");
        }
        request.openGatePass(new GatePass(availableFrom, validUntil, properties.gatePass().maxVisits()));
    }

    @Transactional(readOnly = true)
    public QrAvailability requestQrView(UUID requestId, UUID studentId) {
        LeaveRequest request = loadOwned(requestId, studentId);
        OffsetDateTime now = timeWindow.now();
        GatePassAvailability availability = request.gatePassAvailabilityAt(now);
        GatePass pass = request.getGatePass();
        if (pass == null || availability == GatePassAvailability.NOT_APPROVED) {
            return new QrAvailability(requestId, VisitType.OUTGOING.name(), false,
                    LeaveProblems.describe(GatePassAvailability.NOT_APPROVED, null),
                    null, null, null, null, null, null, null, null, null);
        }
        Duration untilAvailable = Duration.between(now, pass.getQrAvailableFrom());
        Long minutes = availability == GatePassAvailability.NOT_YET_AVAILABLE ? LeaveProblems.ceilMinutes(untilAvailable) : null;
        return new QrAvailability(
                requestId,
                VisitType.OUTGOING.name(),
                availability.isAvailable(),
                LeaveProblems.describe(availability, untilAvailable),
                pass.getVisitCount(),
                pass.getMaxVisits(),
                pass.getRemainingVisits(),
                pass.isVisitLocked(),
                minutes,
                pass.getQrAvailableFrom(),
                pass.getValidUntil(),
                pass.isIncomingQrGenerated(),
                pass.getIncomingQrExpiresAt()
        );
    }

    @Transactional(readOnly = true)
    public QrAvailability requestIncomingQrView(UUID requestId, UUID studentId) {
        LeaveRequest request = loadOwned(requestId, studentId);
        OffsetDateTime now = timeWindow.now();
        GatePass pass = request.getGatePass();
        if (request.getStatus() != LeaveStatus.APPROVED || pass == null) {
            return new QrAvailability(requestId, VisitType.INCOMING.name(), false,
                    LeaveProblems.describe(GatePassAvailability.NOT_APPROVED, null),
                    null, null, null, null, null, null, null, false, null);
        }
        String reason;
        if (!pass.isIncomingQrGenerated()) {
            reason = INCOMING_NOT_GENERATED;
        } else if (!pass.isIncomingQrValidAt(now)) {
            reason = INCOMING_EXPIRED;
        } else {
            reason = "Incoming QR is available";
        }
        return new QrAvailability(
                requestId,
                VisitType.INCOMING.name(),
                pass.isIncomingQrValidAt(now),
                reason,
                pass.getVisitCount(),
                pass.getMaxVisits(),
                pass.getRemainingVisits(),
                pass.isVisitLocked(),
                null,
                pass.getIncomingQrGeneratedAt(),
                pass.getIncomingQrExpiresAt(),
                pass.isIncomingQrGenerated(),
                pass.getIncomingQrExpiresAt()
        );
    }

    public VisitSnapshot recordOutgoingVisit(UUID requestId, UUID scannerId, String location) {
        LeaveRequest request = lock(requestId);
        OffsetDateTime now = timeWindow.now();

        GatePassAvailability availability = request.gatePassAvailabilityAt(now);
        if (!availability.isAvailable()) {
            Duration untilAvailable = request.getGatePass() != null
                    ? Duration.between(now, request.getGatePass().getQrAvailableFrom())
                    : Duration.ZERO;
            throw LeaveProblems.notAvailable(availability, untilAvailable);
        }
        if (request.hasRecentVisit(scannerId, now.minus(properties.gatePass().duplicateWindow()), null)) {
            throw LeaveProblems.duplicateScan();
        }

        String resolvedLocation = resolveLocation(location);
        request.appendVisit(VisitType.OUTGOING, scannerId, resolvedLocation, now,
                now.plus(properties.gatePass().incomingValidity()));
        return recorded(request, VisitType.OUTGOING, scannerId, resolvedLocation, now);
    }

    public VisitSnapshot recordIncomingVisit(UUID requestId, UUID scannerId, String location) {
        LeaveRequest request = lock(requestId);
        OffsetDateTime now = timeWindow.now();

        GatePass pass = request.getGatePass();
        if (request.getStatus() != LeaveStatus.APPROVED || pass == null) {
            throw LeaveProblems.notAvailable(GatePassAvailability.NOT_APPROVED, Duration.ZERO);
        }
        if (!pass.isIncomingQrGenerated()) {
            throw LeaveProblems.notAvailable(INCOMING_NOT_GENERATED);
        }
        if (!pass.isIncomingQrValidAt(now)) {
            throw LeaveProblems.notAvailable(INCOMING_EXPIRED);
        }
        if (request.hasRecentVisit(scannerId, now.minus(properties.gatePass().duplicateWindow()), VisitType.INCOMING)) {
            throw LeaveProblems.duplicateScan();
        }

        String resolvedLocation = resolveLocation(location);
        request.appendVisit(VisitType.INCOMING, scannerId, resolvedLocation, now, null);
        return recorded(request, VisitType.INCOMING, scannerId, resolvedLocation, now);
    }

    /**
     * Manual guard marker on an approved request. Only {@code VERIFIED} and {@code EXPIRED} may be set by hand.
     */
    public LeaveRequestResponse updateVerificationStatus(UUID requestId, UUID guardId, VerificationStatus status) {
        if (status != VerificationStatus.VERIFIED && status != VerificationStatus.EXPIRED) {
            throw new RequestValidationException(Map.of("status", "Status must be VERIFIED or EXPIRED"));
        }
        LeaveRequest request = lock(requestId);
        if (request.getStatus() != LeaveStatus.APPROVED) {
            throw LeaveProblems.stateConflict("Only approved requests can be verified at the gate.");
        }
        VerificationStatus previous = request.getVerificationStatus();
        request.updateVerificationStatus(status);
        auditLogService.record(new AuditLogCommand(
                "GATE_PASS_VERIFICATION_UPDATED",
                "LEAVE_REQUEST",
                requestId.toString(),
                guardId,
                null,
                Map.of("from", previous.name(), "to", status.name())
        ));
        return LeaveDtoMapper.toResponse(request, studentDirectory.findStudent(request.getStudentId()).orElse(null));
    }

    private VisitSnapshot recorded(LeaveRequest request, VisitType type, UUID scannerId, String location, OffsetDateTime now) {
        GatePass pass = request.getGatePass();
        auditLogService.record(new AuditLogCommand(
                "GATE_PASS_" + type.name() + "_SCAN",
                "LEAVE_REQUEST",
                request.getId().toString(),
                scannerId,
                null,
                Map.of("location", location, "visitCount", pass.getVisitCount(), "visitLocked", pass.isVisitLocked())
        ));
        log.info("{} scan recorded for leave request {} at {} (visitCount={}/{}, locked={})",
                type, request.getId(), location, pass.getVisitCount(), pass.getMaxVisits(), pass.isVisitLocked());
        return new VisitSnapshot(
                request.getId(),
                request.getStudentId(),
                type,
                now,
                location,
                pass.getVisitCount(),
                pass.getMaxVisits(),
                pass.getRemainingVisits(),
                pass.isVisitLocked(),
                pass.getOutgoingVisitCount(),
                pass.getIncomingVisitCount(),
                pass.isIncomingQrGenerated(),
                pass.getIncomingQrExpiresAt(),
                request.getVerificationStatus()
        );
    }

    private LeaveRequest lock(UUID requestId) {
        return leaveRequestRepository.findByIdForUpdate(requestId)
                .orElseThrow(() -> LeaveProblems.requestNotFound(requestId));
    }

    private LeaveRequest loadOwned(UUID requestId, UUID studentId) {
        LeaveRequest request = leaveRequestRepository.findById(requestId)
                .orElseThrow(() -> LeaveProblems.requestNotFound(requestId));
        if (!request.isOwnedBy(studentId)) {
            throw LeaveProblems.authorizationDenied("You can only view the QR code of your own request.");
        }
        return request;
    }

    private static String resolveLocation(String location) {
        return location == null || location.isBlank() ? DEFAULT_LOCATION : location.trim();
    }
}
