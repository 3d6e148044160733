package com.hostelgate.backend.modules.leave.domain;

import java.time.OffsetDateTime;
import java.util.UUID;

import jakarta.persistence.Column;
import jakarta.persistence.Embeddable;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;

@Embeddable
public class PrincipalDecision {

    @Enumerated(EnumType.STRING)
    @Column(name = "principal_outcome", length = 16)
    private DecisionOutcome outcome;

    @Column(name = "principal_comment", length = 500)
    private String comment;

    @Column(name = "principal_decided_by", columnDefinition = "uuid")
    private UUID decidedBy;

    @Column(name = "principal_decided_at")
    private OffsetDateTime decidedAt;

    protected PrincipalDecision() {
    }

    public PrincipalDecision(DecisionOutcome outcome, String comment, UUID decidedBy, OffsetDateTime decidedAt) {
        this.outcome = outcome;
        this.comment = comment;
        this.decidedBy = decidedBy;
        this.decidedAt = decidedAt;
    }

    public DecisionOutcome getOutcome() {
        return outcome;
    }

    public String getComment() {
        return comment;
    }

    public UUID getDecidedBy() {
        return decidedBy;
    }

    public OffsetDateTime getDecidedAt() {
        return decidedAt;
    }
}
