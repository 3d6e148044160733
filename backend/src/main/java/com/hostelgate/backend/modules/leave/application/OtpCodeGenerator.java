package com.hostelgate.backend.modules.leave.application;

import java.security.SecureRandom;

import org.springframework.stereotype.Component;

@Component
public class OtpCodeGenerator {

    private static final int LOWER_BOUND = 1000;
    private static final int UPPER_BOUND_EXCLUSIVE = 10000;

    private final SecureRandom random = new SecureRandom();

    /** Four-digit code drawn uniformly from 1000..9999. */
    public String generate() {
        return Integer.toString(LOWER_BOUND + random.nextInt(UPPER_BOUND_EXCLUSIVE - LOWER_BOUND));
    }
}
