package com.hostelgate.backend.modules.leave.domain;

import java.time.OffsetDateTime;

import jakarta.persistence.Column;
import jakarta.persistence.Embeddable;

/**
 * Scan window and counters of an approved leave or permission. Materialised on approval.
 */
@Embeddable
public class GatePass {

    @Column(name = "qr_available_from")
    private OffsetDateTime qrAvailableFrom;

    @Column(name = "valid_until")
    private OffsetDateTime validUntil;

    @Column(name = "visit_count")
    private int visitCount;

    @Column(name = "max_visits")
    private int maxVisits;

    @Column(name = "visit_locked")
    private boolean visitLocked;

    @Column(name = "outgoing_visit_count")
    private int outgoingVisitCount;

    @Column(name = "incoming_visit_count")
    private int incomingVisitCount;

    @Column(name = "incoming_qr_generated")
    private boolean incomingQrGenerated;

    @Column(name = "incoming_qr_generated_at")
    private OffsetDateTime incomingQrGeneratedAt;

    @Column(name = "incoming_qr_expires_at")
    private OffsetDateTime incomingQrExpiresAt;

    protected GatePass() {
    }

    public GatePass(OffsetDateTime qrAvailableFrom, OffsetDateTime validUntil, int maxVisits) {
        if (maxVisits < 1) {
            throw new IllegalArgumentException("maxVisits must be >= 1");
        }
        this.qrAvailableFrom = qrAvailableFrom;
        this.validUntil = validUntil;
        this.maxVisits = maxVisits;
    }

    public GatePassAvailability availabilityAt(OffsetDateTime now) {
        if (visitLocked) {
            return GatePassAvailability.LOCKED;
        }
        if (now.isBefore(qrAvailableFrom)) {
            return GatePassAvailability.NOT_YET_AVAILABLE;
        }
        if (now.isAfter(validUntil)) {
            return GatePassAvailability.EXPIRED;
        }
        return GatePassAvailability.AVAILABLE;
    }

    public boolean isIncomingQrValidAt(OffsetDateTime now) {
        return incomingQrGenerated && incomingQrExpiresAt != null && !now.isAfter(incomingQrExpiresAt);
    }

    void recount(int totalVisits, int outgoing, int incoming) {
        this.visitCount = Math.min(totalVisits, maxVisits);
        this.outgoingVisitCount = outgoing;
        this.incomingVisitCount = incoming;
        if (visitCount >= maxVisits) {
            visitLocked = true;
        }
    }

    /** Generates the return credential once; later calls are no-ops. */
    boolean generateIncomingQr(OffsetDateTime now, OffsetDateTime expiresAt) {
        if (incomingQrGenerated) {
            return false;
        }
        incomingQrGenerated = true;
        incomingQrGeneratedAt = now;
        incomingQrExpiresAt = expiresAt.isAfter(validUntil) ? validUntil : expiresAt;
        return true;
    }

    public int getRemainingVisits() {
        return Math.max(0, maxVisits - visitCount);
    }

    public OffsetDateTime getQrAvailableFrom() {
        return qrAvailableFrom;
    }

    public OffsetDateTime getValidUntil() {
        return validUntil;
    }

    public int getVisitCount() {
        return visitCount;
    }

    public int getMaxVisits() {
        return maxVisits;
    }

    public boolean isVisitLocked() {
        return visitLocked;
    }

    public int getOutgoingVisitCount() {
        return outgoingVisitCount;
    }

    public int getIncomingVisitCount() {
        return incomingVisitCount;
    }

    public boolean isIncomingQrGenerated() {
        return incomingQrGenerated;
    }

    public OffsetDateTime getIncomingQrGeneratedAt() {
        return incomingQrGeneratedAt;
    }

    public OffsetDateTime getIncomingQrExpiresAt() {
        return incomingQrExpiresAt;
    }
}
