package com.hostelgate.backend.modules.leave.domain;

import java.time.OffsetDateTime;
import java.util.UUID;

import jakarta.persistence.Column;
import jakarta.persistence.Embeddable;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;

@Embeddable
public class WardenRecommendation {

    @Enumerated(EnumType.STRING)
    @Column(name = "warden_recommendation", length = 20)
    private Recommendation value;

    @Column(name = "warden_comment", length = 500)
    private String comment;

    @Column(name = "warden_recommended_by", columnDefinition = "uuid")
    private UUID recommendedBy;

    @Column(name = "warden_recommended_at")
    private OffsetDateTime recommendedAt;

    protected WardenRecommendation() {
    }

    public WardenRecommendation(Recommendation value, String comment, UUID recommendedBy, OffsetDateTime recommendedAt) {
        this.value = value;
        this.comment = comment;
        this.recommendedBy = recommendedBy;
        this.recommendedAt = recommendedAt;
    }

    public Recommendation getValue() {
        return value;
    }

    public String getComment() {
        return comment;
    }

    public UUID getRecommendedBy() {
        return recommendedBy;
    }

    public OffsetDateTime getRecommendedAt() {
        return recommendedAt;
    }
}
