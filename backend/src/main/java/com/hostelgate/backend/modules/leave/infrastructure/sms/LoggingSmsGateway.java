package com.hostelgate.backend.modules.leave.infrastructure.sms;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Used when {@code app.sms.enabled=false}. Logs the recipient only, never the code.
 */
public class LoggingSmsGateway implements SmsGateway {

    private static final Logger log = LoggerFactory.getLogger(LoggingSmsGateway.class);

    @Override
    public SmsDeliveryResult sendOtp(String phoneNumber, OtpMessage message) {
        log.info("SMS disabled; skipping OTP message to {}", mask(phoneNumber));
        return SmsDeliveryResult.delivered("disabled");
    }

    static String mask(String phoneNumber) {
        if (phoneNumber == null || phoneNumber.length() <= 4) {
            return "****";
        }
        return "*".repeat(phoneNumber.length() - 4) + phoneNumber.substring(phoneNumber.length() - 4);
    }
}
