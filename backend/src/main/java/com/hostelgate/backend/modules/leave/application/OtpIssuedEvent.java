package com.hostelgate.backend.modules.leave.application;

import java.util.UUID;

public record OtpIssuedEvent(UUID requestId, UUID studentId, String code, boolean resend) {
}
