package com.hostelgate.backend.modules.leave.application;

import com.hostelgate.backend.modules.auth.application.StudentDirectory;
import com.hostelgate.backend.modules.auth.application.StudentProfile;
import com.hostelgate.backend.modules.leave.infrastructure.sms.OtpMessage;
import com.hostelgate.backend.modules.leave.infrastructure.sms.SmsDeliveryResult;
import com.hostelgate.backend.modules.leave.infrastructure.sms.SmsGateway;
import com.hostelgate.backend.modules.notification.application.NotificationService;
import com.hostelgate.backend.modules.notification.application.NotificationService.DispatchRecord;
import com.hostelgate.backend.modules.notification.domain.NotificationChannel;
import com.hostelgate.backend.modules.notification.domain.NotificationDispatchStatus;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Sends the OTP to the parent's phone and records the attempt in the dispatch log.
 */
@Component
public class OtpSmsDispatcher {

    private static final Logger log = LoggerFactory.getLogger(OtpSmsDispatcher.class);

    private final StudentDirectory studentDirectory;
    private final SmsGateway smsGateway;
    private final NotificationService notificationService;

    public OtpSmsDispatcher(
            StudentDirectory studentDirectory,
            SmsGateway smsGateway,
            NotificationService notificationService
    ) {
        this.studentDirectory = studentDirectory;
        this.smsGateway = smsGateway;
        this.notificationService = notificationService;
    }

    public SmsDeliveryResult dispatch(OtpIssuedEvent event) {
        SmsDeliveryResult result = studentDirectory.findStudent(event.studentId())
                .map(student -> send(student, event))
                .orElseGet(() -> SmsDeliveryResult.failed("STUDENT_NOT_FOUND", "Student " + event.studentId() + " not found"));

        if (!result.delivered()) {
            log.warn("OTP SMS for leave request {} failed: {} {}", event.requestId(), result.errorCode(), result.errorMessage());
        }
        notificationService.recordDispatch(new DispatchRecord(
                null,
                event.studentId(),
                NotificationChannel.SMS,
                "OTP:" + event.requestId(),
                result.delivered() ? NotificationDispatchStatus.SUCCESS : NotificationDispatchStatus.FAILED,
                result.providerMessageId(),
                result.errorCode(),
                result.errorMessage()
        ));
        return result;
    }

    private SmsDeliveryResult send(StudentProfile student, OtpIssuedEvent event) {
        if (student.parentPhone() == null || student.parentPhone().isBlank()) {
            return SmsDeliveryResult.failed("MISSING_PARENT_PHONE", "No parent phone on record");
        }
        try {
            return smsGateway.sendOtp(student.parentPhone(), new OtpMessage(event.code(), student.fullName(), student.gender()));
        } catch (RuntimeException e) {
            return SmsDeliveryResult.failed("SMS_ERROR", e.getMessage());
        }
    }
}
