package com.hostelgate.backend.modules.leave.application;

public record OtpResendResult(int resendCount) {
}
