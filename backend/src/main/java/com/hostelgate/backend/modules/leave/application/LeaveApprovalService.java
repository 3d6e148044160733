package com.hostelgate.backend.modules.leave.application;

import java.time.OffsetDateTime;
import java.util.HashMap;
import java.util.Map;
import java.util.UUID;

import com.hostelgate.backend.global.common.time.IstTimeWindow;
import com.hostelgate.backend.modules.audit.application.AuditLogService;
import com.hostelgate.backend.modules.audit.application.AuditLogService.AuditLogCommand;
import com.hostelgate.backend.modules.auth.application.StaffProfile;
import com.hostelgate.backend.modules.auth.application.StudentDirectory;
import com.hostelgate.backend.modules.auth.application.StudentProfile;
import com.hostelgate.backend.modules.leave.domain.ApprovalAction;
import com.hostelgate.backend.modules.leave.domain.ApprovalStateMachine;
import com.hostelgate.backend.modules.leave.domain.DecisionOutcome;
import com.hostelgate.backend.modules.leave.domain.LeaveRequest;
import com.hostelgate.backend.modules.leave.domain.LeaveStatus;
import com.hostelgate.backend.modules.leave.domain.Recommendation;
import com.hostelgate.backend.modules.leave.domain.RejectionStage;
import com.hostelgate.backend.modules.leave.infrastructure.persistence.LeaveRequestRepository;
import com.hostelgate.backend.modules.leave.presentation.dto.LeaveDtoMapper;
import com.hostelgate.backend.modules.leave.presentation.dto.LeaveRequestResponse;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Staff decisions on leave requests. Each call locks the request row, re-checks the source status against
 * {@link ApprovalStateMachine}, then checks the actor's role and course scope before mutating.
 */
@Service
@Transactional
public class LeaveApprovalService {

    private static final Logger log = LoggerFactory.getLogger(LeaveApprovalService.class);
    private static final String RESOURCE_TYPE = "LEAVE_REQUEST";

    private final LeaveRequestRepository leaveRequestRepository;
    private final StudentDirectory studentDirectory;
    private final CourseScopeResolver courseScopeResolver;
    private final OtpGateway otpGateway;
    private final GatePassService gatePassService;
    private final AuditLogService auditLogService;
    private final ApplicationEventPublisher eventPublisher;
    private final IstTimeWindow timeWindow;

    public LeaveApprovalService(
            LeaveRequestRepository leaveRequestRepository,
            StudentDirectory studentDirectory,
            CourseScopeResolver courseScopeResolver,
            OtpGateway otpGateway,
            GatePassService gatePassService,
            AuditLogService auditLogService,
            ApplicationEventPublisher eventPublisher,
            IstTimeWindow timeWindow
    ) {
        this.leaveRequestRepository = leaveRequestRepository;
        this.studentDirectory = studentDirectory;
        this.courseScopeResolver = courseScopeResolver;
        this.otpGateway = otpGateway;
        this.gatePassService = gatePassService;
        this.auditLogService = auditLogService;
        this.eventPublisher = eventPublisher;
        this.timeWindow = timeWindow;
    }

    /**
     * A wrong code leaves the request unchanged apart from the failed-attempt counter, which must survive the
     * {@link InvalidOtpException}.
     */
    @Transactional(noRollbackFor = InvalidOtpException.class)
    public LeaveRequestResponse verifyOtp(UUID requestId, UUID actorId, String code) {
        Transition transition = begin(requestId, actorId, ApprovalAction.VERIFY_OTP);
        otpGateway.verify(transition.request(), code);
        transition.request().recordWardenVerification(actorId, timeWindow.now());
        return complete(transition, null);
    }

    public LeaveRequestResponse wardenReject(UUID requestId, UUID actorId, String reason) {
        return reject(requestId, actorId, reason, ApprovalAction.WARDEN_REJECT, RejectionStage.WARDEN);
    }

    public LeaveRequestResponse adminReject(UUID requestId, UUID actorId, String reason) {
        return reject(requestId, actorId, reason, ApprovalAction.ADMIN_REJECT, RejectionStage.ADMIN);
    }

    public LeaveRequestResponse principalApprove(UUID requestId, UUID actorId, String comment) {
        Transition transition = begin(requestId, actorId, ApprovalAction.PRINCIPAL_APPROVE);
        transition.request().recordPrincipalDecision(DecisionOutcome.APPROVED, trimToNull(comment), actorId, timeWindow.now());
        return complete(transition, comment);
    }

    public LeaveRequestResponse principalReject(UUID requestId, UUID actorId, String reason) {
        Transition transition = begin(requestId, actorId, ApprovalAction.PRINCIPAL_REJECT);
        OffsetDateTime now = timeWindow.now();
        transition.request().recordPrincipalDecision(DecisionOutcome.REJECTED, trimToNull(reason), actorId, now);
        transition.request().recordRejection(trimToNull(reason), RejectionStage.PRINCIPAL, actorId, now);
        return complete(transition, reason);
    }

    public LeaveRequestResponse wardenRecommend(UUID requestId, UUID actorId, Recommendation recommendation, String comment) {
        ApprovalAction action = recommendation == Recommendation.RECOMMENDED
                ? ApprovalAction.RECOMMEND
                : ApprovalAction.NOT_RECOMMEND;
        Transition transition = begin(requestId, actorId, action);
        OffsetDateTime now = timeWindow.now();
        transition.request().recordWardenRecommendation(recommendation, trimToNull(comment), actorId, now);
        if (action == ApprovalAction.NOT_RECOMMEND) {
            transition.request().recordRejection(trimToNull(comment), RejectionStage.WARDEN, actorId, now);
        }
        return complete(transition, comment);
    }

    public LeaveRequestResponse principalDecide(UUID requestId, UUID actorId, DecisionOutcome decision, String comment) {
        ApprovalAction action = decision == DecisionOutcome.APPROVED
                ? ApprovalAction.DECIDE_APPROVE
                : ApprovalAction.DECIDE_REJECT;
        Transition transition = begin(requestId, actorId, action);
        transition.request().recordPrincipalDecision(decision, trimToNull(comment), actorId, timeWindow.now());
        return complete(transition, comment);
    }

    private LeaveRequestResponse reject(
            UUID requestId,
            UUID actorId,
            String reason,
            ApprovalAction action,
            RejectionStage stage
    ) {
        Transition transition = begin(requestId, actorId, action);
        transition.request().recordRejection(trimToNull(reason), stage, actorId, timeWindow.now());
        return complete(transition, reason);
    }

    private Transition begin(UUID requestId, UUID actorId, ApprovalAction action) {
        LeaveRequest request = leaveRequestRepository.findByIdForUpdate(requestId)
                .orElseThrow(() -> LeaveProblems.requestNotFound(requestId));
        LeaveStatus next = ApprovalStateMachine.next(request.getApplicationType(), request.getStatus(), action)
                .orElseThrow(() -> LeaveProblems.stateConflict(request.getStatus(), action));

        StaffProfile actor = studentDirectory.findStaff(actorId)
                .orElseThrow(() -> LeaveProblems.staffNotFound(actorId));
        if (!action.isAllowedFor(actor.role())) {
            throw LeaveProblems.authorizationDenied("Your role is not allowed to "
                    + action.name().toLowerCase().replace('_', ' ') + " requests.");
        }
        StudentProfile student = studentDirectory.findStudent(request.getStudentId())
                .orElseThrow(() -> LeaveProblems.studentNotFound(request.getStudentId()));
        courseScopeResolver.ensureCanAct(actor, student);
        return new Transition(request, actor, student, action, next);
    }

    private LeaveRequestResponse complete(Transition transition, String comment) {
        LeaveRequest request = transition.request();
        LeaveStatus previous = request.getStatus();
        request.moveTo(transition.next());
        if (transition.next() == LeaveStatus.APPROVED) {
            gatePassService.openFor(request);
        }

        Map<String, Object> detail = new HashMap<>();
        detail.put("action", transition.action().name());
        detail.put("from", previous.name());
        detail.put("to", transition.next().name());
        detail.put("actorRole", transition.actor().role().name());
        if (comment != null && !comment.isBlank()) {
            detail.put("comment", comment.trim());
        }
        auditLogService.record(new AuditLogCommand(
                "LEAVE_" + transition.action().name(),
                RESOURCE_TYPE,
                request.getId().toString(),
                transition.actor().id(),
                null,
                detail
        ));
        eventPublisher.publishEvent(new LeaveStatusChangedEvent(
                request.getId(),
                request.getStudentId(),
                request.getApplicationType(),
                previous,
                transition.next(),
                transition.actor().id(),
                trimToNull(comment)
        ));
        log.info("Leave request {} moved {} -> {} by {} {}",
                request.getId(), previous, transition.next(), transition.actor().role(), transition.actor().id());
        return LeaveDtoMapper.toResponse(request, transition.student());
    }

    private static String trimToNull(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        return value.trim();
    }

    private record Transition(
            LeaveRequest request,
            StaffProfile actor,
            StudentProfile student,
            ApprovalAction action,
            LeaveStatus next
    ) {
    }
}
