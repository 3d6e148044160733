package com.hostelgate.backend.modules.leave.application;

import com.hostelgate.backend.global.error.ProblemException;

import org.springframework.http.HttpStatus;

/**
 * Wrong passcode. Verification marks this exception as no-rollback so the failed-attempt counter is kept.
 */
public class InvalidOtpException extends ProblemException {

    public InvalidOtpException() {
        super(HttpStatus.BAD_REQUEST, LeaveProblems.INVALID_OTP, "The OTP entered is incorrect.");
    }
}
