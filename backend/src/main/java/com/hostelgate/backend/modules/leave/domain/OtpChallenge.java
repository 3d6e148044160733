package com.hostelgate.backend.modules.leave.domain;

import java.time.Duration;
import java.time.OffsetDateTime;

import jakarta.persistence.Column;
import jakarta.persistence.Embeddable;

/**
 * Parent-consent passcode attached to a leave request. The code is reused on resend.
 */
@Embeddable
public class OtpChallenge {

    @Column(name = "otp_code", length = 8)
    private String code;

    @Column(name = "otp_issued_at")
    private OffsetDateTime issuedAt;

    @Column(name = "otp_resend_count")
    private int resendCount;

    @Column(name = "otp_last_resend_at")
    private OffsetDateTime lastResendAt;

    @Column(name = "otp_failed_attempts")
    private int failedAttempts;

    @Column(name = "otp_last_failed_at")
    private OffsetDateTime lastFailedAt;

    protected OtpChallenge() {
    }

    public OtpChallenge(String code, OffsetDateTime issuedAt) {
        this.code = code;
        this.issuedAt = issuedAt;
    }

    public boolean matches(String candidate) {
        return code != null && code.equals(candidate);
    }

    /** Time left before another resend is allowed; zero or negative means allowed now. */
    public Duration resendWaitRemaining(OffsetDateTime now, Duration cooldown) {
        OffsetDateTime reference = lastResendAt != null ? lastResendAt : issuedAt;
        return Duration.between(now, reference.plus(cooldown));
    }

    public void markResent(OffsetDateTime now) {
        resendCount++;
        lastResendAt = now;
    }

    public void recordFailure(OffsetDateTime now) {
        failedAttempts++;
        lastFailedAt = now;
    }

    /**
     * Once {@code maxFailedAttempts} wrong codes have been entered, verification stays closed until
     * {@code lockout} has passed since the last failure.
     */
    public boolean isLockedOut(OffsetDateTime now, int maxFailedAttempts, Duration lockout) {
        return failedAttempts >= maxFailedAttempts
                && lastFailedAt != null
                && now.isBefore(lastFailedAt.plus(lockout));
    }

    /** Restarts the failure counter once a lockout has run its course. */
    public void clearElapsedLockout(OffsetDateTime now, int maxFailedAttempts, Duration lockout) {
        if (failedAttempts >= maxFailedAttempts && !isLockedOut(now, maxFailedAttempts, lockout)) {
            failedAttempts = 0;
        }
    }

    public Duration lockoutRemaining(OffsetDateTime now, Duration lockout) {
        if (lastFailedAt == null) {
            return Duration.ZERO;
        }
        return Duration.between(now, lastFailedAt.plus(lockout));
    }

    public String getCode() {
        return code;
    }

    public OffsetDateTime getIssuedAt() {
        return issuedAt;
    }

    public int getResendCount() {
        return resendCount;
    }

    public OffsetDateTime getLastResendAt() {
        return lastResendAt;
    }

    public int getFailedAttempts() {
        return failedAttempts;
    }

    public OffsetDateTime getLastFailedAt() {
        return lastFailedAt;
    }
}
