package com.hostelgate.backend.modules.leave.application;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.time.LocalDate;
import java.time.LocalTime;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;

import com.hostelgate.backend.global.error.ProblemException;
import com.hostelgate.backend.modules.audit.application.AuditLogService;
import com.hostelgate.backend.modules.audit.application.AuditLogService.AuditLogCommand;
import com.hostelgate.backend.modules.auth.application.StaffProfile;
import com.hostelgate.backend.modules.auth.application.StudentDirectory;
import com.hostelgate.backend.modules.auth.application.StudentProfile;
import com.hostelgate.backend.modules.auth.domain.Gender;
import com.hostelgate.backend.modules.auth.domain.HostelRole;
import com.hostelgate.backend.modules.leave.domain.ApplicationType;
import com.hostelgate.backend.modules.leave.domain.LeaveRequest;
import com.hostelgate.backend.modules.leave.domain.LeaveSchedule;
import com.hostelgate.backend.modules.leave.domain.LeaveStatus;
import com.hostelgate.backend.modules.leave.infrastructure.persistence.LeaveRequestRepository;
import com.hostelgate.backend.modules.leave.presentation.dto.LeaveRequestResponse;
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
class LeaveRequestServiceTest {

    private static final UUID STUDENT_ID = UUID.fromString("00000000-0000-0000-0000-000000000101");
    private static final UUID OTHER_STUDENT_ID = UUID.fromString("00000000-0000-0000-0000-000000000102");
    private static final UUID REQUEST_ID = UUID.fromString("00000000-0000-0000-0000-000000000501");
    private static final LocalDate TODAY = LocalDate.of(2025, 3, 11);

    @Mock
    private LeaveRequestRepository leaveRequestRepository;

    @Mock
    private LeaveRequestValidator validator;

    @Mock
    private OtpGateway otpGateway;

    @Mock
    private StudentDirectory studentDirectory;

    @Mock
    private AuditLogService auditLogService;

    @Mock
    private ApplicationEventPublisher eventPublisher;

    private LeaveRequestService service;

    @BeforeEach
    void setUp() {
        service = new LeaveRequestService(
                leaveRequestRepository,
                validator,
                otpGateway,
                studentDirectory,
                new CourseScopeResolver(studentDirectory, LeaveProperties.defaults()),
                auditLogService,
                eventPublisher
        );
        lenient().when(leaveRequestRepository.save(any(LeaveRequest.class)))
                .thenAnswer(invocation -> TestEntityIds.assign(invocation.getArgument(0), REQUEST_ID));
    }

    @Test
    @DisplayName("a leave starts at OTP verification and the passcode is issued")
    void leaveIssuesOtp() {
        CreateLeaveCommand command = leaveCommand();
        when(studentDirectory.findStudent(STUDENT_ID)).thenReturn(Optional.of(student(STUDENT_ID, true)));
        when(validator.validate(STUDENT_ID, command)).thenReturn(new LeaveSchedule.LeaveWindow(
                TODAY.plusDays(1), TODAY.plusDays(3), TODAY.plusDays(1).atTime(17, 0)));

        LeaveRequestResponse response = service.createRequest(STUDENT_ID, command);

        assertThat(response.id()).isEqualTo(REQUEST_ID);
        assertThat(response.status()).isEqualTo("PENDING_OTP_VERIFICATION");
        assertThat(response.reason()).isEqualTo("Going home");
        assertThat(response.student().fullName()).isEqualTo("Ravi Kumar");
        verify(otpGateway).issue(any(LeaveRequest.class));

        ArgumentCaptor<LeaveStatusChangedEvent> eventCaptor = ArgumentCaptor.forClass(LeaveStatusChangedEvent.class);
        verify(eventPublisher).publishEvent(eventCaptor.capture());
        assertThat(eventCaptor.getValue().previous()).isNull();
        assertThat(eventCaptor.getValue().current()).isEqualTo(LeaveStatus.PENDING_OTP_VERIFICATION);

        ArgumentCaptor<AuditLogCommand> auditCaptor = ArgumentCaptor.forClass(AuditLogCommand.class);
        verify(auditLogService).record(auditCaptor.capture());
        assertThat(auditCaptor.getValue().actionType()).isEqualTo("LEAVE_SUBMITTED");
        assertThat(auditCaptor.getValue().resourceKey()).isEqualTo(REQUEST_ID.toString());
    }

    @Test
    @DisplayName("a permission without standing parent consent skips the OTP and goes to the principal")
    void permissionWithoutParentConsent() {
        CreateLeaveCommand command = new CreateLeaveCommand(
                ApplicationType.PERMISSION, null, null, null, TODAY, "14:00", "18:00", null, "Bank work");
        when(studentDirectory.findStudent(STUDENT_ID)).thenReturn(Optional.of(student(STUDENT_ID, false)));
        when(validator.validate(STUDENT_ID, command)).thenReturn(
                new LeaveSchedule.PermissionWindow(TODAY, LocalTime.of(14, 0), LocalTime.of(18, 0)));

        LeaveRequestResponse response = service.createRequest(STUDENT_ID, command);

        assertThat(response.status()).isEqualTo("PENDING_PRINCIPAL_APPROVAL");
        verify(otpGateway, never()).issue(any());
    }

    @Test
    @DisplayName("validation errors are raised before anything is stored")
    void validationFailureStoresNothing() {
        CreateLeaveCommand command = leaveCommand();
        when(studentDirectory.findStudent(STUDENT_ID)).thenReturn(Optional.of(student(STUDENT_ID, true)));
        when(validator.validate(STUDENT_ID, command)).thenThrow(LeaveProblems.dailyLimitExceeded(ApplicationType.LEAVE));

        assertThatThrownBy(() -> service.createRequest(STUDENT_ID, command))
                .isInstanceOfSatisfying(ProblemException.class,
                        ex -> assertThat(ex.getCode()).isEqualTo(LeaveProblems.DAILY_LIMIT_EXCEEDED));
        verify(leaveRequestRepository, never()).save(any());
        verify(eventPublisher, never()).publishEvent(any(Object.class));
    }

    @Test
    @DisplayName("only the owner can delete, and only before a final decision")
    void deleteGuards() {
        LeaveRequest pending = stayRequest(LeaveStatus.PENDING);
        when(leaveRequestRepository.findByIdForUpdate(REQUEST_ID)).thenReturn(Optional.of(pending));

        assertThatThrownBy(() -> service.deleteRequest(REQUEST_ID, OTHER_STUDENT_ID))
                .isInstanceOfSatisfying(ProblemException.class,
                        ex -> assertThat(ex.getStatusCode()).isEqualTo(HttpStatus.FORBIDDEN));

        service.deleteRequest(REQUEST_ID, STUDENT_ID);
        verify(leaveRequestRepository).delete(pending);

        LeaveRequest approved = stayRequest(LeaveStatus.PRINCIPAL_APPROVED);
        when(leaveRequestRepository.findByIdForUpdate(REQUEST_ID)).thenReturn(Optional.of(approved));
        assertThatThrownBy(() -> service.deleteRequest(REQUEST_ID, STUDENT_ID))
                .isInstanceOfSatisfying(ProblemException.class, ex -> {
                    assertThat(ex.getCode()).isEqualTo(LeaveProblems.STATE_CONFLICT);
                    assertThat(ex.getDetailMessage()).contains("principal approved");
                });
        verify(leaveRequestRepository, never()).delete(approved);
    }

    @Test
    @DisplayName("security and admins see any request, wardens only their own courses, other students nothing")
    void requestVisibility() {
        LeaveRequest request = stayRequest(LeaveStatus.PENDING);
        when(leaveRequestRepository.findById(REQUEST_ID)).thenReturn(Optional.of(request));
        when(studentDirectory.findStudent(STUDENT_ID)).thenReturn(Optional.of(student(STUDENT_ID, true)));

        UUID guardId = UUID.randomUUID();
        UUID btechWardenId = UUID.randomUUID();
        UUID pharmacyWardenId = UUID.randomUUID();
        when(studentDirectory.findStaff(guardId)).thenReturn(Optional.of(
                new StaffProfile(guardId, "Gate", HostelRole.SECURITY, Set.of(), null)));
        when(studentDirectory.findStaff(btechWardenId)).thenReturn(Optional.of(
                new StaffProfile(btechWardenId, "Warden", HostelRole.WARDEN, Set.of("B TECH"), null)));
        when(studentDirectory.findStaff(pharmacyWardenId)).thenReturn(Optional.of(
                new StaffProfile(pharmacyWardenId, "Warden 2", HostelRole.WARDEN, Set.of("Pharmacy"), null)));
        when(studentDirectory.findStaff(OTHER_STUDENT_ID)).thenReturn(Optional.empty());

        assertThat(service.getRequest(REQUEST_ID, STUDENT_ID).id()).isEqualTo(REQUEST_ID);
        assertThat(service.getRequest(REQUEST_ID, guardId).id()).isEqualTo(REQUEST_ID);
        assertThat(service.getRequest(REQUEST_ID, btechWardenId).id()).isEqualTo(REQUEST_ID);
        assertThatThrownBy(() -> service.getRequest(REQUEST_ID, pharmacyWardenId))
                .isInstanceOfSatisfying(ProblemException.class,
                        ex -> assertThat(ex.getStatusCode()).isEqualTo(HttpStatus.FORBIDDEN));
        assertThatThrownBy(() -> service.getRequest(REQUEST_ID, OTHER_STUDENT_ID))
                .isInstanceOfSatisfying(ProblemException.class,
                        ex -> assertThat(ex.getCode()).isEqualTo(LeaveProblems.AUTHORIZATION_DENIED));
    }

    @Test
    @DisplayName("an unknown request id is a 404")
    void unknownRequest() {
        when(leaveRequestRepository.findById(eq(REQUEST_ID))).thenReturn(Optional.empty());

        assertThatThrownBy(() -> service.getRequest(REQUEST_ID, STUDENT_ID))
                .isInstanceOfSatisfying(ProblemException.class,
                        ex -> assertThat(ex.getCode()).isEqualTo(LeaveProblems.LEAVE_REQUEST_NOT_FOUND));
    }

    private static CreateLeaveCommand leaveCommand() {
        return new CreateLeaveCommand(
                ApplicationType.LEAVE,
                TODAY.plusDays(1),
                TODAY.plusDays(3),
                TODAY.plusDays(1).atTime(17, 0),
                null, null, null, null,
                "  Going home  ");
    }

    private static LeaveRequest stayRequest(LeaveStatus status) {
        return TestEntityIds.assign(
                new LeaveRequest(STUDENT_ID, new LeaveSchedule.StayWindow(TODAY), "Exams", status),
                REQUEST_ID);
    }

    private static StudentProfile student(UUID id, boolean parentPermission) {
        return new StudentProfile(id, "Ravi Kumar", "22A91A0501", Gender.MALE, "B.Tech", "CSE", "9876543210", parentPermission);
    }
}
