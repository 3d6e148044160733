package com.hostelgate.backend.modules.leave.infrastructure.sms;

public record SmsDeliveryResult(boolean delivered, String providerMessageId, String errorCode, String errorMessage) {

    public static SmsDeliveryResult delivered(String providerMessageId) {
        return new SmsDeliveryResult(true, providerMessageId, null, null);
    }

    public static SmsDeliveryResult failed(String errorCode, String errorMessage) {
        return new SmsDeliveryResult(false, null, errorCode, errorMessage);
    }
}
