package com.hostelgate.backend.modules.leave.application;

import java.time.Duration;
import java.time.OffsetDateTime;
import java.util.UUID;

import com.hostelgate.backend.global.common.time.IstTimeWindow;
import com.hostelgate.backend.modules.leave.domain.LeaveRequest;
import com.hostelgate.backend.modules.leave.domain.LeaveStatus;
import com.hostelgate.backend.modules.leave.domain.OtpChallenge;
import com.hostelgate.backend.modules.leave.infrastructure.persistence.LeaveRequestRepository;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Issues, resends and checks the parent-consent passcode. SMS delivery is queued as an {@link OtpIssuedEvent}
 * and happens after the surrounding transaction commits.
 */
@Service
public class OtpGateway {

    private static final Logger log = LoggerFactory.getLogger(OtpGateway.class);

    private final LeaveRequestRepository leaveRequestRepository;
    private final OtpCodeGenerator codeGenerator;
    private final ApplicationEventPublisher eventPublisher;
    private final IstTimeWindow timeWindow;
    private final LeaveProperties properties;

    public OtpGateway(
            LeaveRequestRepository leaveRequestRepository,
            OtpCodeGenerator codeGenerator,
            ApplicationEventPublisher eventPublisher,
            IstTimeWindow timeWindow,
            LeaveProperties properties
    ) {
        this.leaveRequestRepository = leaveRequestRepository;
        this.codeGenerator = codeGenerator;
        this.eventPublisher = eventPublisher;
        this.timeWindow = timeWindow;
        this.properties = properties;
    }

    public String generate() {
        return codeGenerator.generate();
    }

    /** Attaches a fresh challenge to a request that has already been saved. */
    public void issue(LeaveRequest request) {
        String code = generate();
        request.attachOtp(new OtpChallenge(code, timeWindow.now()));
        eventPublisher.publishEvent(new OtpIssuedEvent(request.getId(), request.getStudentId(), code, false));
    }

    @Transactional
    public OtpResendResult resend(UUID requestId, UUID studentId) {
        LeaveRequest request = leaveRequestRepository.findByIdForUpdate(requestId)
                .orElseThrow(() -> LeaveProblems.requestNotFound(requestId));
        if (!request.isOwnedBy(studentId)) {
            throw LeaveProblems.authorizationDenied("You can only resend the OTP for your own request.");
        }
        if (request.getStatus() != LeaveStatus.PENDING_OTP_VERIFICATION || request.getOtp() == null) {
            throw LeaveProblems.stateConflict("OTP can only be resent while the request awaits OTP verification.");
        }

        OtpChallenge otp = request.getOtp();
        OffsetDateTime now = timeWindow.now();
        Duration remaining = otp.resendWaitRemaining(now, properties.otp().resendCooldown());
        if (remaining.compareTo(Duration.ZERO) > 0) {
            throw LeaveProblems.resendCooldown(remaining);
        }

        otp.markResent(now);
        log.info("OTP resend requested for leave request {} (count={})", requestId, otp.getResendCount());
        eventPublisher.publishEvent(new OtpIssuedEvent(request.getId(), request.getStudentId(), otp.getCode(), true));
        return new OtpResendResult(otp.getResendCount());
    }

    /**
     * Checks the code against the stored challenge. A wrong code bumps the failure counter before
     * {@link InvalidOtpException} is thrown, so the caller must not roll back on that exception.
     */
    public void verify(LeaveRequest request, String code) {
        OtpChallenge otp = request.getOtp();
        if (otp == null) {
            throw LeaveProblems.stateConflict("This request has no OTP to verify.");
        }
        OffsetDateTime now = timeWindow.now();
        LeaveProperties.Otp settings = properties.otp();
        if (otp.isLockedOut(now, settings.maxFailedAttempts(), settings.lockout())) {
            throw LeaveProblems.attemptsExceeded(otp.lockoutRemaining(now, settings.lockout()));
        }
        otp.clearElapsedLockout(now, settings.maxFailedAttempts(), settings.lockout());
        String candidate = code == null ? null : code.trim();
        if (!otp.matches(candidate)) {
            otp.recordFailure(now);
            log.warn("Wrong OTP for leave request {} (failedAttempts={})", request.getId(), otp.getFailedAttempts());
            throw LeaveProblems.invalidOtp();
        }
    }
}
