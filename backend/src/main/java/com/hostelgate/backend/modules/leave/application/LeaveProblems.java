package com.hostelgate.backend.modules.leave.application;

import java.time.Duration;
import java.util.UUID;

import com.hostelgate.backend.global.error.ProblemException;
import com.hostelgate.backend.global.error.RetryableProblemException;
import com.hostelgate.backend.modules.leave.domain.ApplicationType;
import com.hostelgate.backend.modules.leave.domain.ApprovalAction;
import com.hostelgate.backend.modules.leave.domain.GatePassAvailability;
import com.hostelgate.backend.modules.leave.domain.LeaveStatus;

import org.springframework.http.HttpStatus;

/**
 * Problem codes raised by the leave workflow.
 */
public final class LeaveProblems {

    public static final String DAILY_LIMIT_EXCEEDED = "DAILY_LIMIT_EXCEEDED";
    public static final String STATE_CONFLICT = "STATE_CONFLICT";
    public static final String AUTHORIZATION_DENIED = "AUTHORIZATION_DENIED";
    public static final String OTP_RESEND_COOLDOWN = "OTP_RESEND_COOLDOWN";
    public static final String OTP_ATTEMPTS_EXCEEDED = "OTP_ATTEMPTS_EXCEEDED";
    public static final String INVALID_OTP = "INVALID_OTP";
    public static final String NOT_AVAILABLE = "NOT_AVAILABLE";
    public static final String DUPLICATE_SCAN = "DUPLICATE_SCAN";
    public static final String LEAVE_REQUEST_NOT_FOUND = "LEAVE_REQUEST_NOT_FOUND";
    public static final String STUDENT_NOT_FOUND = "STUDENT_NOT_FOUND";
    public static final String STAFF_NOT_FOUND = "STAFF_NOT_FOUND";

    private LeaveProblems() {
    }

    public static ProblemException dailyLimitExceeded(ApplicationType type) {
        return new ProblemException(HttpStatus.UNPROCESSABLE_ENTITY, DAILY_LIMIT_EXCEEDED,
                "You have already submitted a " + label(type) + " request today. Only one request per day is allowed.");
    }

    public static ProblemException stateConflict(LeaveStatus current, ApprovalAction action) {
        return new ProblemException(HttpStatus.CONFLICT, STATE_CONFLICT,
                "Cannot " + action.name().toLowerCase().replace('_', ' ') + " a request that is " + describe(current) + ".");
    }

    public static ProblemException stateConflict(String detail) {
        return new ProblemException(HttpStatus.CONFLICT, STATE_CONFLICT, detail);
    }

    public static ProblemException authorizationDenied(String detail) {
        return new ProblemException(HttpStatus.FORBIDDEN, AUTHORIZATION_DENIED, detail);
    }

    public static RetryableProblemException resendCooldown(Duration remaining) {
        long minutes = ceilMinutes(remaining);
        return new RetryableProblemException(HttpStatus.TOO_MANY_REQUESTS, OTP_RESEND_COOLDOWN,
                "Please wait " + minutes + " more minute" + (minutes == 1 ? "" : "s") + " before resending OTP.",
                (int) Math.max(1, remaining.toSeconds()));
    }

    public static RetryableProblemException attemptsExceeded(Duration remaining) {
        long minutes = ceilMinutes(remaining);
        return new RetryableProblemException(HttpStatus.TOO_MANY_REQUESTS, OTP_ATTEMPTS_EXCEEDED,
                "Too many wrong OTP attempts. Try again in " + minutes + " minute" + (minutes == 1 ? "" : "s") + ".",
                (int) Math.max(1, remaining.toSeconds()));
    }

    public static InvalidOtpException invalidOtp() {
        return new InvalidOtpException();
    }

    public static ProblemException notAvailable(GatePassAvailability availability, Duration untilAvailable) {
        return new ProblemException(HttpStatus.FORBIDDEN, NOT_AVAILABLE, describe(availability, untilAvailable));
    }

    public static ProblemException notAvailable(String detail) {
        return new ProblemException(HttpStatus.FORBIDDEN, NOT_AVAILABLE, detail);
    }

    public static ProblemException duplicateScan() {
        return new ProblemException(HttpStatus.CONFLICT, DUPLICATE_SCAN,
                "This QR code was scanned by this terminal moments ago.");
    }

    public static ProblemException requestNotFound(UUID requestId) {
        return new ProblemException(HttpStatus.NOT_FOUND, LEAVE_REQUEST_NOT_FOUND,
                "Leave request " + requestId + " was not found.");
    }

    public static ProblemException studentNotFound(UUID studentId) {
        return new ProblemException(HttpStatus.NOT_FOUND, STUDENT_NOT_FOUND, "Student " + studentId + " was not found.");
    }

    public static ProblemException staffNotFound(UUID staffId) {
        return new ProblemException(HttpStatus.NOT_FOUND, STAFF_NOT_FOUND, "Staff member " + staffId + " was not found.");
    }

    /** Human-readable reason shown on the student's device and to the guard. */
    public static String describe(GatePassAvailability availability, Duration untilAvailable) {
        return switch (availability) {
            case AVAILABLE -> "QR code is available";
            case NOT_APPROVED -> "Only approved requests can be scanned";
            case LOCKED -> "Maximum visits reached. QR code already fully scanned";
            case NOT_YET_AVAILABLE -> "QR code will be available in " + ceilMinutes(untilAvailable) + " minutes";
            case EXPIRED -> "The pass validity period has expired";
        };
    }

    public static long ceilMinutes(Duration duration) {
        if (duration == null || duration.isNegative() || duration.isZero()) {
            return 0;
        }
        long seconds = duration.toSeconds() + (duration.toNanosPart() > 0 ? 1 : 0);
        return (seconds + 59) / 60;
    }

    private static String label(ApplicationType type) {
        return switch (type) {
            case LEAVE -> "leave";
            case PERMISSION -> "permission";
            case STAY_IN_HOSTEL -> "stay in hostel";
        };
    }

    private static String describe(LeaveStatus status) {
        return status.name().toLowerCase().replace('_', ' ');
    }
}
