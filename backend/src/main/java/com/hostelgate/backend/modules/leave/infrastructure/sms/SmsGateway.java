package com.hostelgate.backend.modules.leave.infrastructure.sms;

/**
 * Outbound SMS channel for parent OTP messages.
 */
public interface SmsGateway {

    SmsDeliveryResult sendOtp(String phoneNumber, OtpMessage message);
}
