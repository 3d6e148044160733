package com.hostelgate.backend.modules.leave.application;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import com.hostelgate.backend.modules.auth.application.StaffProfile;
import com.hostelgate.backend.modules.auth.application.StudentDirectory;
import com.hostelgate.backend.modules.auth.application.StudentProfile;
import com.hostelgate.backend.modules.auth.domain.HostelRole;
import com.hostelgate.backend.modules.leave.domain.ApplicationType;
import com.hostelgate.backend.modules.leave.domain.LeaveStatus;
import com.hostelgate.backend.modules.notification.application.NotificationService;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

/**
 * Turns leave status changes into in-app notifications: the next approver queue when a request moves forward,
 * the student when the visible outcome changes.
 */
@Component
public class LeaveNotifier {

    private static final Logger log = LoggerFactory.getLogger(LeaveNotifier.class);

    private final StudentDirectory studentDirectory;
    private final CourseScopeResolver courseScopeResolver;
    private final NotificationService notificationService;

    public LeaveNotifier(
            StudentDirectory studentDirectory,
            CourseScopeResolver courseScopeResolver,
            NotificationService notificationService
    ) {
        this.studentDirectory = studentDirectory;
        this.courseScopeResolver = courseScopeResolver;
        this.notificationService = notificationService;
    }

    public void notifyStatusChanged(LeaveStatusChangedEvent event) {
        Optional<StudentProfile> student = studentDirectory.findStudent(event.studentId());
        if (student.isEmpty()) {
            log.warn("Skipping notifications for leave request {}: student {} not found", event.requestId(), event.studentId());
            return;
        }

        HostelRole nextApprover = nextApprover(event.current());
        if (nextApprover != null) {
            notifyApprovers(event, student.get(), nextApprover);
        }
        if (!event.isSubmission()) {
            notifyStudent(event);
        }
    }

    /**
     * Called by the expiry sweep with no row lock held. Runs in its own transaction.
     */
    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public void notifyExpired(ExpiredLeave expired) {
        String body = expired.status() == LeaveStatus.WARDEN_VERIFIED
                ? "Your " + label(expired.applicationType()) + " request expired without principal approval and was removed."
                : "Your " + label(expired.applicationType()) + " request expired without OTP verification and was removed.";
        Map<String, Object> metadata = new HashMap<>();
        metadata.put("requestId", expired.requestId().toString());
        metadata.put("status", expired.status().name());
        metadata.put("applicationType", expired.applicationType().name());
        notificationService.sendNotification(
                expired.studentId(),
                NotificationService.KIND_LEAVE_EXPIRED,
                "Request expired",
                body,
                NotificationService.KIND_LEAVE_EXPIRED + ":" + expired.requestId(),
                metadata,
                NotificationService.DEFAULT_TTL_HOURS,
                expired.requestId()
        );
    }

    private void notifyApprovers(LeaveStatusChangedEvent event, StudentProfile student, HostelRole role) {
        List<StaffProfile> recipients = courseScopeResolver.findScopedStaff(role, student);
        if (recipients.isEmpty()) {
            log.warn("No {} in scope for leave request {} (course={})", role, event.requestId(), student.courseName());
            return;
        }
        String title = role == HostelRole.WARDEN ? "New request to review" : "Request awaiting your approval";
        String body = student.fullName() + " (" + student.rollNumber() + ") submitted a "
                + label(event.applicationType()) + " request";
        Map<String, Object> metadata = baseMetadata(event);
        metadata.put("studentName", student.fullName());
        for (StaffProfile staff : recipients) {
            notificationService.sendNotification(
                    staff.id(),
                    NotificationService.KIND_LEAVE_APPROVAL_QUEUE,
                    title,
                    body + queueSuffix(event.current()),
                    NotificationService.KIND_LEAVE_APPROVAL_QUEUE + ":" + event.requestId() + ":" + event.current(),
                    metadata,
                    NotificationService.DEFAULT_TTL_HOURS,
                    event.requestId()
            );
        }
    }

    private void notifyStudent(LeaveStatusChangedEvent event) {
        String body = studentMessage(event);
        notificationService.sendNotification(
                event.studentId(),
                NotificationService.KIND_LEAVE_STATUS,
                "Request " + event.current().name().toLowerCase().replace('_', ' '),
                body,
                NotificationService.KIND_LEAVE_STATUS + ":" + event.requestId() + ":" + event.current(),
                baseMetadata(event),
                NotificationService.DEFAULT_TTL_HOURS,
                event.requestId()
        );
    }

    static HostelRole nextApprover(LeaveStatus status) {
        return switch (status) {
            case PENDING, PENDING_OTP_VERIFICATION -> HostelRole.WARDEN;
            case PENDING_PRINCIPAL_APPROVAL, WARDEN_VERIFIED, WARDEN_RECOMMENDED -> HostelRole.PRINCIPAL;
            default -> null;
        };
    }

    private static String studentMessage(LeaveStatusChangedEvent event) {
        String label = label(event.applicationType());
        String message = switch (event.current()) {
            case WARDEN_VERIFIED -> "Your " + label + " request was verified and sent to the principal.";
            case WARDEN_RECOMMENDED -> "Your " + label + " request was recommended and sent to the principal.";
            case APPROVED, PRINCIPAL_APPROVED -> "Your " + label + " request was approved.";
            case REJECTED, PRINCIPAL_REJECTED -> "Your " + label + " request was rejected.";
            default -> "Your " + label + " request is now " + event.current().name().toLowerCase().replace('_', ' ') + ".";
        };
        if (event.comment() != null && !event.comment().isBlank()) {
            message += " Comment: " + event.comment();
        }
        return message;
    }

    private static String queueSuffix(LeaveStatus status) {
        return switch (status) {
            case PENDING_OTP_VERIFICATION -> " and is waiting for OTP verification.";
            case WARDEN_VERIFIED -> ". OTP verified by the warden.";
            case WARDEN_RECOMMENDED -> ". Recommended by the warden.";
            default -> ".";
        };
    }

    private static Map<String, Object> baseMetadata(LeaveStatusChangedEvent event) {
        Map<String, Object> metadata = new HashMap<>();
        metadata.put("requestId", event.requestId().toString());
        metadata.put("applicationType", event.applicationType().name());
        metadata.put("status", event.current().name());
        return metadata;
    }

    private static String label(ApplicationType type) {
        return switch (type) {
            case LEAVE -> "leave";
            case PERMISSION -> "permission";
            case STAY_IN_HOSTEL -> "stay in hostel";
        };
    }
}
