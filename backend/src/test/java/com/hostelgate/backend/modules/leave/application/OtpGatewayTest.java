package com.hostelgate.backend.modules.leave.application;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;

import java.time.Clock;
import java.time.LocalDate;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.Optional;
import java.util.UUID;

import com.hostelgate.backend.global.common.time.IstTimeWindow;
import com.hostelgate.backend.global.error.ProblemException;
import com.hostelgate.backend.global.error.RetryableProblemException;
import com.hostelgate.backend.modules.leave.domain.LeaveRequest;
import com.hostelgate.backend.modules.leave.domain.LeaveSchedule;
import com.hostelgate.backend.modules.leave.domain.LeaveStatus;
import com.hostelgate.backend.modules.leave.domain.OtpChallenge;
import com.hostelgate.backend.modules.leave.infrastructure.persistence.LeaveRequestRepository;
import com.hostelgate.backend.support.TestEntityIds;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.http.HttpStatus;

@ExtendWith(MockitoExtension.class)
class OtpGatewayTest {

    private static final OffsetDateTime NOW = OffsetDateTime.parse("2025-03-11T06:00:00Z");
    private static final UUID STUDENT_ID = UUID.fromString("00000000-0000-0000-0000-000000000101");
    private static final UUID REQUEST_ID = UUID.fromString("00000000-0000-0000-0000-000000000501");

    @Mock
    private LeaveRequestRepository leaveRequestRepository;

    @Mock
    private OtpCodeGenerator codeGenerator;

    @Mock
    private ApplicationEventPublisher eventPublisher;

    private OtpGateway otpGateway;
    private LeaveRequest request;

    @BeforeEach
    void setUp() {
        otpGateway = gatewayAt(NOW);
        request = TestEntityIds.assign(new LeaveRequest(
                STUDENT_ID,
                new LeaveSchedule.LeaveWindow(LocalDate.of(2025, 3, 12), LocalDate.of(2025, 3, 14),
                        LocalDate.of(2025, 3, 12).atTime(17, 0)),
                "Going home",
                LeaveStatus.PENDING_OTP_VERIFICATION
        ), REQUEST_ID);
        lenient().when(codeGenerator.generate()).thenReturn("4821");
        lenient().when(leaveRequestRepository.findByIdForUpdate(REQUEST_ID)).thenReturn(Optional.of(request));
    }

    @Test
    @DisplayName("issuing attaches a four digit code and queues the SMS")
    void issueAttachesChallengeAndPublishes() {
        otpGateway.issue(request);

        assertThat(request.getOtp().getCode()).isEqualTo("4821");
        assertThat(request.getOtp().getIssuedAt()).isEqualTo(NOW);

        ArgumentCaptor<OtpIssuedEvent> captor = ArgumentCaptor.forClass(OtpIssuedEvent.class);
        verify(eventPublisher).publishEvent(captor.capture());
        assertThat(captor.getValue()).isEqualTo(new OtpIssuedEvent(REQUEST_ID, STUDENT_ID, "4821", false));
    }

    @Test
    @DisplayName("resend inside the five minute cooldown is refused with the remaining wait")
    void resendWithinCooldownIsRefused() {
        request.attachOtp(new OtpChallenge("4821", NOW.minusMinutes(2)));

        assertThatThrownBy(() -> otpGateway.resend(REQUEST_ID, STUDENT_ID))
                .isInstanceOfSatisfying(RetryableProblemException.class, ex -> {
                    assertThat(ex.getStatusCode()).isEqualTo(HttpStatus.TOO_MANY_REQUESTS);
                    assertThat(ex.getCode()).isEqualTo(LeaveProblems.OTP_RESEND_COOLDOWN);
                    assertThat(ex.getDetailMessage()).contains("3 more minutes");
                    assertThat(ex.getRetryAfterSeconds()).isEqualTo(180);
                });
        verify(eventPublisher, never()).publishEvent(any(Object.class));
    }

    @Test
    @DisplayName("resend after the cooldown reuses the code and counts the resend")
    void resendAfterCooldownReusesCode() {
        request.attachOtp(new OtpChallenge("4821", NOW.minusMinutes(6)));

        OtpResendResult result = otpGateway.resend(REQUEST_ID, STUDENT_ID);

        assertThat(result.resendCount()).isEqualTo(1);
        assertThat(request.getOtp().getLastResendAt()).isEqualTo(NOW);
        verify(eventPublisher).publishEvent(new OtpIssuedEvent(REQUEST_ID, STUDENT_ID, "4821", true));

        // the next resend waits on the last resend, not on the original issue
        assertThatThrownBy(() -> gatewayAt(NOW.plusMinutes(4)).resend(REQUEST_ID, STUDENT_ID))
                .isInstanceOf(RetryableProblemException.class);
    }

    @Test
    @DisplayName("only the owner can resend and only while OTP verification is pending")
    void resendGuards() {
        request.attachOtp(new OtpChallenge("4821", NOW.minusMinutes(10)));

        assertThatThrownBy(() -> otpGateway.resend(REQUEST_ID, UUID.randomUUID()))
                .isInstanceOfSatisfying(ProblemException.class, ex ->
                        assertThat(ex.getCode()).isEqualTo(LeaveProblems.AUTHORIZATION_DENIED));

        request.moveTo(LeaveStatus.WARDEN_VERIFIED);
        assertThatThrownBy(() -> otpGateway.resend(REQUEST_ID, STUDENT_ID))
                .isInstanceOfSatisfying(ProblemException.class, ex ->
                        assertThat(ex.getCode()).isEqualTo(LeaveProblems.STATE_CONFLICT));
    }

    @Test
    @DisplayName("a wrong code counts a failure and a correct code passes")
    void verifyCountsFailures() {
        request.attachOtp(new OtpChallenge("4821", NOW.minusMinutes(1)));

        assertThatThrownBy(() -> otpGateway.verify(request, "1111")).isInstanceOf(InvalidOtpException.class);
        assertThat(request.getOtp().getFailedAttempts()).isEqualTo(1);

        assertThatCode(() -> otpGateway.verify(request, " 4821 ")).doesNotThrowAnyException();
    }

    @Test
    @DisplayName("five wrong codes lock verification for fifteen minutes")
    void verifyLocksAfterTooManyFailures() {
        request.attachOtp(new OtpChallenge("4821", NOW.minusMinutes(1)));
        for (int i = 0; i < 5; i++) {
            assertThatThrownBy(() -> otpGateway.verify(request, "0000")).isInstanceOf(InvalidOtpException.class);
        }

        assertThatThrownBy(() -> otpGateway.verify(request, "4821"))
                .isInstanceOfSatisfying(RetryableProblemException.class, ex ->
                        assertThat(ex.getCode()).isEqualTo(LeaveProblems.OTP_ATTEMPTS_EXCEEDED));

        assertThatCode(() -> gatewayAt(NOW.plusMinutes(15)).verify(request, "4821")).doesNotThrowAnyException();
        assertThat(request.getOtp().getFailedAttempts()).isZero();
    }

    @Test
    @DisplayName("after a lockout ends a wrong code starts a fresh count instead of locking again")
    void failureCountRestartsAfterLockout() {
        request.attachOtp(new OtpChallenge("4821", NOW.minusMinutes(1)));
        for (int i = 0; i < 5; i++) {
            assertThatThrownBy(() -> otpGateway.verify(request, "0000")).isInstanceOf(InvalidOtpException.class);
        }

        OtpGateway later = gatewayAt(NOW.plusMinutes(16));
        assertThatThrownBy(() -> later.verify(request, "0000")).isInstanceOf(InvalidOtpException.class);
        assertThat(request.getOtp().getFailedAttempts()).isEqualTo(1);
        assertThatCode(() -> later.verify(request, "4821")).doesNotThrowAnyException();
    }

    private OtpGateway gatewayAt(OffsetDateTime instant) {
        IstTimeWindow timeWindow = new IstTimeWindow(Clock.fixed(instant.toInstant(), ZoneOffset.UTC));
        return new OtpGateway(leaveRequestRepository, codeGenerator, eventPublisher, timeWindow, LeaveProperties.defaults());
    }
}
