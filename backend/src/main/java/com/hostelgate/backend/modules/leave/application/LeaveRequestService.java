package com.hostelgate.backend.modules.leave.application;

import java.util.List;
import java.util.Map;
import java.util.UUID;

import com.hostelgate.backend.modules.audit.application.AuditLogService;
import com.hostelgate.backend.modules.audit.application.AuditLogService.AuditLogCommand;
import com.hostelgate.backend.modules.auth.application.StaffProfile;
import com.hostelgate.backend.modules.auth.application.StudentDirectory;
import com.hostelgate.backend.modules.auth.application.StudentProfile;
import com.hostelgate.backend.modules.auth.domain.HostelRole;
import com.hostelgate.backend.modules.leave.domain.ApprovalStateMachine;
import com.hostelgate.backend.modules.leave.domain.LeaveRequest;
import com.hostelgate.backend.modules.leave.domain.LeaveSchedule;
import com.hostelgate.backend.modules.leave.domain.LeaveStatus;
import com.hostelgate.backend.modules.leave.infrastructure.persistence.LeaveRequestRepository;
import com.hostelgate.backend.modules.leave.presentation.dto.LeaveDtoMapper;
import com.hostelgate.backend.modules.leave.presentation.dto.LeaveRequestResponse;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Student-facing lifecycle of a leave request: submission, own history and withdrawal.
 */
@Service
@Transactional
public class LeaveRequestService {

    private static final Logger log = LoggerFactory.getLogger(LeaveRequestService.class);
    private static final String RESOURCE_TYPE = "LEAVE_REQUEST";

    private final LeaveRequestRepository leaveRequestRepository;
    private final LeaveRequestValidator validator;
    private final OtpGateway otpGateway;
    private final StudentDirectory studentDirectory;
    private final CourseScopeResolver courseScopeResolver;
    private final AuditLogService auditLogService;
    private final ApplicationEventPublisher eventPublisher;

    public LeaveRequestService(
            LeaveRequestRepository leaveRequestRepository,
            LeaveRequestValidator validator,
            OtpGateway otpGateway,
            StudentDirectory studentDirectory,
            CourseScopeResolver courseScopeResolver,
            AuditLogService auditLogService,
            ApplicationEventPublisher eventPublisher
    ) {
        this.leaveRequestRepository = leaveRequestRepository;
        this.validator = validator;
        this.otpGateway = otpGateway;
        this.studentDirectory = studentDirectory;
        this.courseScopeResolver = courseScopeResolver;
        this.auditLogService = auditLogService;
        this.eventPublisher = eventPublisher;
    }

    public LeaveRequestResponse createRequest(UUID studentId, CreateLeaveCommand command) {
        StudentProfile student = studentDirectory.findStudent(studentId)
                .orElseThrow(() -> LeaveProblems.studentNotFound(studentId));
        LeaveSchedule schedule = validator.validate(studentId, command);

        LeaveStatus initialStatus = ApprovalStateMachine.initialStatus(
                command.applicationType(),
                student.parentPermissionForOuting()
        );
        LeaveRequest request = new LeaveRequest(studentId, schedule, command.reason().trim(), initialStatus);
        leaveRequestRepository.save(request);

        if (initialStatus == LeaveStatus.PENDING_OTP_VERIFICATION) {
            otpGateway.issue(request);
        }

        auditLogService.record(new AuditLogCommand(
                "LEAVE_SUBMITTED",
                RESOURCE_TYPE,
                request.getId().toString(),
                studentId,
                null,
                Map.of("applicationType", request.getApplicationType().name(), "status", initialStatus.name())
        ));
        eventPublisher.publishEvent(new LeaveStatusChangedEvent(
                request.getId(),
                studentId,
                request.getApplicationType(),
                null,
                initialStatus,
                studentId,
                null
        ));
        log.info("Leave request {} submitted by student {} ({}, {})",
                request.getId(), studentId, request.getApplicationType(), initialStatus);
        return LeaveDtoMapper.toResponse(request, student);
    }

    @Transactional(readOnly = true)
    public List<LeaveRequestResponse> getStudentRequests(UUID studentId) {
        StudentProfile student = studentDirectory.findStudent(studentId).orElse(null);
        return leaveRequestRepository.findByStudentIdOrderByCreatedAtDesc(studentId).stream()
                .map(request -> LeaveDtoMapper.toResponse(request, student))
                .toList();
    }

    /**
     * Visible to the owner, to admins and security staff, and to wardens or principals whose scope covers
     * the student.
     */
    @Transactional(readOnly = true)
    public LeaveRequestResponse getRequest(UUID requestId, UUID viewerId) {
        LeaveRequest request = leaveRequestRepository.findById(requestId)
                .orElseThrow(() -> LeaveProblems.requestNotFound(requestId));
        StudentProfile student = studentDirectory.findStudent(request.getStudentId()).orElse(null);
        if (!request.isOwnedBy(viewerId)) {
            StaffProfile staff = studentDirectory.findStaff(viewerId)
                    .orElseThrow(() -> LeaveProblems.authorizationDenied("You can only view your own requests."));
            boolean unrestricted = staff.hasRole(HostelRole.ADMIN) || staff.hasRole(HostelRole.SECURITY);
            if (!unrestricted) {
                if (student == null) {
                    throw LeaveProblems.studentNotFound(request.getStudentId());
                }
                courseScopeResolver.ensureCanAct(staff, student);
            }
        }
        return LeaveDtoMapper.toResponse(request, student);
    }

    public void deleteRequest(UUID requestId, UUID studentId) {
        LeaveRequest request = leaveRequestRepository.findByIdForUpdate(requestId)
                .orElseThrow(() -> LeaveProblems.requestNotFound(requestId));
        if (!request.isOwnedBy(studentId)) {
            throw LeaveProblems.authorizationDenied("You can only delete your own requests.");
        }
        if (!request.getStatus().isDeletableByOwner()) {
            throw LeaveProblems.stateConflict("A request that is "
                    + request.getStatus().name().toLowerCase().replace('_', ' ') + " can no longer be deleted.");
        }
        leaveRequestRepository.delete(request);
        auditLogService.record(new AuditLogCommand(
                "LEAVE_DELETED",
                RESOURCE_TYPE,
                requestId.toString(),
                studentId,
                null,
                Map.of("status", request.getStatus().name())
        ));
        log.info("Leave request {} deleted by student {}", requestId, studentId);
    }
}
