package com.hostelgate.backend.modules.leave.domain;

import java.time.OffsetDateTime;
import java.util.UUID;

import jakarta.persistence.Column;
import jakarta.persistence.Embeddable;

@Embeddable
public class WardenVerification {

    @Column(name = "warden_verified_by", columnDefinition = "uuid")
    private UUID verifiedBy;

    @Column(name = "warden_verified_at")
    private OffsetDateTime verifiedAt;

    protected WardenVerification() {
    }

    public WardenVerification(UUID verifiedBy, OffsetDateTime verifiedAt) {
        this.verifiedBy = verifiedBy;
        this.verifiedAt = verifiedAt;
    }

    public UUID getVerifiedBy() {
        return verifiedBy;
    }

    public OffsetDateTime getVerifiedAt() {
        return verifiedAt;
    }
}
