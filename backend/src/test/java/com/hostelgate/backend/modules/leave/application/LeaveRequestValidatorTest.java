package com.hostelgate.backend.modules.leave.application;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.time.Clock;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.UUID;

import com.hostelgate.backend.global.common.time.IstTimeWindow;
import com.hostelgate.backend.global.error.ProblemException;
import com.hostelgate.backend.global.error.RequestValidationException;
import com.hostelgate.backend.modules.leave.domain.ApplicationType;
import com.hostelgate.backend.modules.leave.domain.LeaveSchedule;
import com.hostelgate.backend.modules.leave.infrastructure.persistence.LeaveRequestRepository;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class LeaveRequestValidatorTest {

    // 11:30 IST on 2025-03-11
    private static final OffsetDateTime NOW = OffsetDateTime.parse("2025-03-11T06:00:00Z");
    private static final LocalDate TODAY = LocalDate.of(2025, 3, 11);
    private static final UUID STUDENT_ID = UUID.fromString("00000000-0000-0000-0000-000000000101");

    @Mock
    private LeaveRequestRepository leaveRequestRepository;

    private LeaveRequestValidator validator;

    @BeforeEach
    void setUp() {
        IstTimeWindow timeWindow = new IstTimeWindow(Clock.fixed(NOW.toInstant(), ZoneOffset.UTC));
        validator = new LeaveRequestValidator(timeWindow, leaveRequestRepository, LeaveProperties.defaults());
        lenient().when(leaveRequestRepository.existsCreatedBetween(any(), any(), any(), any())).thenReturn(false);
    }

    @Test
    @DisplayName("a leave starting tomorrow with a gate pass after the cutoff is accepted")
    void validLeaveIsAccepted() {
        LeaveSchedule schedule = validator.validate(STUDENT_ID, leave(
                TODAY.plusDays(1), TODAY.plusDays(3), TODAY.plusDays(1).atTime(17, 0)));

        assertThat(schedule).isInstanceOf(LeaveSchedule.LeaveWindow.class);
        assertThat(schedule.lastDate()).isEqualTo(TODAY.plusDays(3));
        verify(leaveRequestRepository).existsCreatedBetween(
                eq(STUDENT_ID),
                eq(ApplicationType.LEAVE),
                eq(OffsetDateTime.parse("2025-03-10T18:30:00Z")),
                eq(OffsetDateTime.parse("2025-03-11T18:30:00Z")));
    }

    @Test
    @DisplayName("a later-day leave with a gate pass before 16:30 is rejected")
    void gatePassBeforeCutoffIsRejected() {
        CreateLeaveCommand command = leave(TODAY.plusDays(1), TODAY.plusDays(2), TODAY.plusDays(1).atTime(16, 29));

        assertThatThrownBy(() -> validator.validate(STUDENT_ID, command))
                .isInstanceOfSatisfying(RequestValidationException.class, ex ->
                        assertThat(ex.getFieldErrors()).containsKey("gatePassDateTime"));
    }

    @Test
    @DisplayName("a leave starting today only needs a gate pass time that is not in the past")
    void sameDayLeaveAllowsEarlyGatePass() {
        LeaveSchedule schedule = validator.validate(STUDENT_ID, leave(TODAY, TODAY.plusDays(1), TODAY.atTime(12, 0)));
        assertThat(schedule).isInstanceOf(LeaveSchedule.LeaveWindow.class);

        CreateLeaveCommand past = leave(TODAY, TODAY.plusDays(1), TODAY.atTime(11, 0));
        assertThatThrownBy(() -> validator.validate(STUDENT_ID, past))
                .isInstanceOfSatisfying(RequestValidationException.class, ex ->
                        assertThat(ex.getFieldErrors()).containsEntry("gatePassDateTime", "Gate pass time cannot be in the past"));
    }

    @Test
    @DisplayName("every broken field of a leave is reported at once")
    void collectsAllLeaveErrors() {
        CreateLeaveCommand command = new CreateLeaveCommand(
                ApplicationType.LEAVE,
                TODAY.minusDays(1),
                TODAY.minusDays(1),
                null,
                null,
                null,
                null,
                null,
                "  "
        );

        assertThatThrownBy(() -> validator.validate(STUDENT_ID, command))
                .isInstanceOfSatisfying(RequestValidationException.class, ex ->
                        assertThat(ex.getFieldErrors()).containsOnlyKeys("startDate", "endDate", "gatePassDateTime", "reason"));
        verify(leaveRequestRepository, never()).existsCreatedBetween(any(), any(), any(), any());
    }

    @Test
    @DisplayName("permission times must be HH:mm and the return must follow the departure")
    void permissionTimesAreChecked() {
        LeaveSchedule schedule = validator.validate(STUDENT_ID, permission(TODAY, "9:15", "18:00"));
        assertThat(schedule).isEqualTo(new LeaveSchedule.PermissionWindow(TODAY, LocalTime.of(9, 15), LocalTime.of(18, 0)));

        assertThatThrownBy(() -> validator.validate(STUDENT_ID, permission(TODAY, "25:00", "18:00")))
                .isInstanceOfSatisfying(RequestValidationException.class, ex ->
                        assertThat(ex.getFieldErrors()).containsEntry("outTime", "Out time must be in HH:mm format"));

        assertThatThrownBy(() -> validator.validate(STUDENT_ID, permission(TODAY, "18:00", "18:00")))
                .isInstanceOfSatisfying(RequestValidationException.class, ex ->
                        assertThat(ex.getFieldErrors()).containsEntry("inTime", "In time must be after out time"));
    }

    @Test
    @DisplayName("stay-in-hostel dates are limited to today and tomorrow")
    void stayDateWindow() {
        assertThat(validator.validate(STUDENT_ID, stay(TODAY))).isEqualTo(new LeaveSchedule.StayWindow(TODAY));
        assertThat(validator.validate(STUDENT_ID, stay(TODAY.plusDays(1)))).isEqualTo(new LeaveSchedule.StayWindow(TODAY.plusDays(1)));

        assertThatThrownBy(() -> validator.validate(STUDENT_ID, stay(TODAY.plusDays(2))))
                .isInstanceOfSatisfying(RequestValidationException.class, ex ->
                        assertThat(ex.getFieldErrors()).containsEntry("stayDate", "Stay date must be today or tomorrow"));
    }

    @Test
    @DisplayName("reasons longer than 500 characters are rejected")
    void longReasonIsRejected() {
        CreateLeaveCommand command = new CreateLeaveCommand(
                ApplicationType.STAY_IN_HOSTEL, null, null, null, null, null, null, TODAY, "x".repeat(501));

        assertThatThrownBy(() -> validator.validate(STUDENT_ID, command))
                .isInstanceOfSatisfying(RequestValidationException.class, ex ->
                        assertThat(ex.getFieldErrors()).containsOnlyKeys("reason"));
    }

    @Test
    @DisplayName("a second request of the same type on the same IST day hits the daily limit")
    void dailyLimitIsEnforced() {
        when(leaveRequestRepository.existsCreatedBetween(eq(STUDENT_ID), eq(ApplicationType.PERMISSION), any(), any()))
                .thenReturn(true);

        assertThatThrownBy(() -> validator.validate(STUDENT_ID, permission(TODAY, "10:00", "12:00")))
                .isInstanceOfSatisfying(ProblemException.class, ex -> {
                    assertThat(ex.getCode()).isEqualTo(LeaveProblems.DAILY_LIMIT_EXCEEDED);
                    assertThat(ex.getDetailMessage()).contains("permission");
                });
    }

    private static CreateLeaveCommand leave(LocalDate start, LocalDate end, LocalDateTime gatePass) {
        return new CreateLeaveCommand(ApplicationType.LEAVE, start, end, gatePass, null, null, null, null, "Going home");
    }

    private static CreateLeaveCommand permission(LocalDate date, String out, String in) {
        return new CreateLeaveCommand(ApplicationType.PERMISSION, null, null, null, date, out, in, null, "Hospital visit");
    }

    private static CreateLeaveCommand stay(LocalDate date) {
        return new CreateLeaveCommand(ApplicationType.STAY_IN_HOSTEL, null, null, null, null, null, null, date, "Exams");
    }
}
