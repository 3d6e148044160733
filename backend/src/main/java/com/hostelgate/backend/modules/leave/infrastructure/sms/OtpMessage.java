package com.hostelgate.backend.modules.leave.infrastructure.sms;

import com.hostelgate.backend.modules.auth.domain.Gender;

public record OtpMessage(String code, String studentName, Gender gender) {
}
