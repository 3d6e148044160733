package com.hostelgate.backend.modules.leave.domain;

import java.time.OffsetDateTime;
import java.util.UUID;

import jakarta.persistence.Column;
import jakarta.persistence.Embeddable;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;

@Embeddable
public class Rejection {

    @Column(name = "rejection_reason", length = 500)
    private String reason;

    @Enumerated(EnumType.STRING)
    @Column(name = "rejection_stage", length = 16)
    private RejectionStage stage;

    @Column(name = "rejected_by", columnDefinition = "uuid")
    private UUID rejectedBy;

    @Column(name = "rejected_at")
    private OffsetDateTime rejectedAt;

    protected Rejection() {
    }

    public Rejection(String reason, RejectionStage stage, UUID rejectedBy, OffsetDateTime rejectedAt) {
        this.reason = reason;
        this.stage = stage;
        this.rejectedBy = rejectedBy;
        this.rejectedAt = rejectedAt;
    }

    public String getReason() {
        return reason;
    }

    public RejectionStage getStage() {
        return stage;
    }

    public UUID getRejectedBy() {
        return rejectedBy;
    }

    public OffsetDateTime getRejectedAt() {
        return rejectedAt;
    }
}
