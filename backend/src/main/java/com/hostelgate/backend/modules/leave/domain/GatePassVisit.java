package com.hostelgate.backend.modules.leave.domain;

import java.time.OffsetDateTime;
import java.util.UUID;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.FetchType;
import jakarta.persistence.Id;
import jakarta.persistence.JoinColumn;
import jakarta.persistence.ManyToOne;
import jakarta.persistence.Table;

import org.hibernate.annotations.UuidGenerator;

@Entity
@Table(name = "gate_pass_visit")
public class GatePassVisit {

    @Id
    @UuidGenerator
    @Column(name = "id", nullable = false, updatable = false, columnDefinition = "uuid")
    private UUID id;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "leave_request_id", nullable = false)
    private LeaveRequest leaveRequest;

    @Column(name = "scanned_at", nullable = false)
    private OffsetDateTime scannedAt;

    @Column(name = "scanned_by", nullable = false, columnDefinition = "uuid")
    private UUID scannedBy;

    @Column(name = "location", nullable = false, length = 100)
    private String location;

    @Enumerated(EnumType.STRING)
    @Column(name = "visit_type", nullable = false, length = 16)
    private VisitType type;

    protected GatePassVisit() {
    }

    GatePassVisit(LeaveRequest leaveRequest, OffsetDateTime scannedAt, UUID scannedBy, String location, VisitType type) {
        this.leaveRequest = leaveRequest;
        this.scannedAt = scannedAt;
        this.scannedBy = scannedBy;
        this.location = location;
        this.type = type;
    }

    public UUID getId() {
        return id;
    }

    public LeaveRequest getLeaveRequest() {
        return leaveRequest;
    }

    public OffsetDateTime getScannedAt() {
        return scannedAt;
    }

    public UUID getScannedBy() {
        return scannedBy;
    }

    public String getLocation() {
        return location;
    }

    public VisitType getType() {
        return type;
    }
}
