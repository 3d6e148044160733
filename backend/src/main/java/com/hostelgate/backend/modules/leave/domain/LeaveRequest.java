package com.hostelgate.backend.modules.leave.domain;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.UUID;

import com.hostelgate.backend.global.jpa.AbstractTimestampedEntity;

import jakarta.persistence.CascadeType;
import jakarta.persistence.Column;
import jakarta.persistence.Embedded;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.FetchType;
import jakarta.persistence.Id;
import jakarta.persistence.OneToMany;
import jakarta.persistence.OrderBy;
import jakarta.persistence.Table;
import jakarta.persistence.Version;

import org.hibernate.annotations.UuidGenerator;

/**
 * A student's request to leave the premises (or to stay in on a given day) together with its approval trail
 * and, once approved, its gate pass and scan history.
 * <p>
 * The schedule columns are only reachable through {@link #getSchedule()} and {@link #applySchedule(LeaveSchedule)}
 * so that exactly one group is populated for the request's type.
 */
@Entity
@Table(name = "leave_request")
public class LeaveRequest extends AbstractTimestampedEntity {

    @Id
    @UuidGenerator
    @Column(name = "id", nullable = false, updatable = false, columnDefinition = "uuid")
    private UUID id;

    @Column(name = "student_id", nullable = false, updatable = false, columnDefinition = "uuid")
    private UUID studentId;

    @Enumerated(EnumType.STRING)
    @Column(name = "application_type", nullable = false, updatable = false, length = 20)
    private ApplicationType applicationType;

    @Column(name = "start_date")
    private LocalDate startDate;

    @Column(name = "end_date")
    private LocalDate endDate;

    @Column(name = "gate_pass_date_time")
    private LocalDateTime gatePassDateTime;

    @Column(name = "permission_date")
    private LocalDate permissionDate;

    @Column(name = "out_time")
    private LocalTime outTime;

    @Column(name = "in_time")
    private LocalTime inTime;

    @Column(name = "stay_date")
    private LocalDate stayDate;

    @Column(name = "reason", nullable = false, length = 500)
    private String reason;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 32)
    private LeaveStatus status;

    @Embedded
    private OtpChallenge otp;

    @Embedded
    private WardenVerification wardenVerification;

    @Embedded
    private WardenRecommendation wardenRecommendation;

    @Embedded
    private PrincipalDecision principalDecision;

    @Embedded
    private Rejection rejection;

    @Embedded
    private GatePass gatePass;

    @OneToMany(mappedBy = "leaveRequest", cascade = CascadeType.ALL, fetch = FetchType.LAZY, orphanRemoval = true)
    @OrderBy("scannedAt ASC")
    private List<GatePassVisit> visits = new ArrayList<>();

    @Enumerated(EnumType.STRING)
    @Column(name = "verification_status", nullable = false, length = 16)
    private VerificationStatus verificationStatus = VerificationStatus.NOT_VERIFIED;

    @Column(name = "completed_at")
    private OffsetDateTime completedAt;

    @Version
    @Column(name = "version", nullable = false)
    private long version;

    protected LeaveRequest() {
    }

    public LeaveRequest(UUID studentId, LeaveSchedule schedule, String reason, LeaveStatus initialStatus) {
        this.studentId = Objects.requireNonNull(studentId, "studentId");
        this.applicationType = schedule.applicationType();
        this.reason = reason;
        this.status = Objects.requireNonNull(initialStatus, "initialStatus");
        applySchedule(schedule);
    }

    public LeaveSchedule getSchedule() {
        return switch (applicationType) {
            case LEAVE -> new LeaveSchedule.LeaveWindow(startDate, endDate, gatePassDateTime);
            case PERMISSION -> new LeaveSchedule.PermissionWindow(permissionDate, outTime, inTime);
            case STAY_IN_HOSTEL -> new LeaveSchedule.StayWindow(stayDate);
        };
    }

    public void applySchedule(LeaveSchedule schedule) {
        if (schedule.applicationType() != applicationType) {
            throw new IllegalArgumentException("Schedule " + schedule.applicationType() + " does not fit " + applicationType);
        }
        startDate = null;
        endDate = null;
        gatePassDateTime = null;
        permissionDate = null;
        outTime = null;
        inTime = null;
        stayDate = null;
        if (schedule instanceof LeaveSchedule.LeaveWindow leave) {
            startDate = leave.startDate();
            endDate = leave.endDate();
            gatePassDateTime = leave.gatePassDateTime();
        } else if (schedule instanceof LeaveSchedule.PermissionWindow permission) {
            permissionDate = permission.permissionDate();
            outTime = permission.outTime();
            inTime = permission.inTime();
        } else if (schedule instanceof LeaveSchedule.StayWindow stay) {
            stayDate = stay.stayDate();
        }
    }

    public void attachOtp(OtpChallenge challenge) {
        this.otp = challenge;
    }

    public void moveTo(LeaveStatus next) {
        if (status != null && status.isTerminal()) {
            throw new IllegalStateException("Request " + id + " is already " + status);
        }
        this.status = next;
    }

    public void recordWardenVerification(UUID wardenId, OffsetDateTime at) {
        this.wardenVerification = new WardenVerification(wardenId, at);
    }

    public void recordWardenRecommendation(Recommendation value, String comment, UUID wardenId, OffsetDateTime at) {
        this.wardenRecommendation = new WardenRecommendation(value, comment, wardenId, at);
    }

    public void recordPrincipalDecision(DecisionOutcome outcome, String comment, UUID principalId, OffsetDateTime at) {
        this.principalDecision = new PrincipalDecision(outcome, comment, principalId, at);
    }

    public void recordRejection(String rejectionReason, RejectionStage stage, UUID actorId, OffsetDateTime at) {
        this.rejection = new Rejection(rejectionReason, stage, actorId, at);
    }

    public void openGatePass(GatePass pass) {
        if (!applicationType.hasGatePass()) {
            throw new IllegalStateException("Stay-in-hostel requests have no gate pass");
        }
        this.gatePass = pass;
    }

    public GatePassAvailability gatePassAvailabilityAt(OffsetDateTime now) {
        if (status != LeaveStatus.APPROVED || gatePass == null) {
            return GatePassAvailability.NOT_APPROVED;
        }
        return gatePass.availabilityAt(now);
    }

    /**
     * @param typeFilter restricts the check to one visit type; {@code null} checks every visit
     */
    public boolean hasRecentVisit(UUID scannerId, OffsetDateTime since, VisitType typeFilter) {
        return visits.stream()
                .filter(visit -> typeFilter == null || visit.getType() == typeFilter)
                .anyMatch(visit -> visit.getScannedBy().equals(scannerId) && visit.getScannedAt().isAfter(since));
    }

    /**
     * Appends a scan and recomputes the counters. The first outgoing scan also generates the incoming
     * credential, valid until {@code incomingExpiresAt} capped at the end of the period.
     */
    public GatePassVisit appendVisit(
            VisitType type,
            UUID scannerId,
            String location,
            OffsetDateTime now,
            OffsetDateTime incomingExpiresAt
    ) {
        if (gatePass == null) {
            throw new IllegalStateException("Request " + id + " has no gate pass");
        }
        GatePassVisit visit = new GatePassVisit(this, now, scannerId, location, type);
        visits.add(visit);

        int outgoing = 0;
        int incoming = 0;
        for (GatePassVisit existing : visits) {
            if (existing.getType() == VisitType.OUTGOING) {
                outgoing++;
            } else {
                incoming++;
            }
        }
        gatePass.recount(visits.size(), outgoing, incoming);

        if (type == VisitType.OUTGOING) {
            gatePass.generateIncomingQr(now, incomingExpiresAt);
        } else {
            verificationStatus = VerificationStatus.COMPLETED;
            completedAt = now;
        }
        return visit;
    }

    public void updateVerificationStatus(VerificationStatus next) {
        this.verificationStatus = next;
    }

    public boolean isOwnedBy(UUID candidateStudentId) {
        return studentId.equals(candidateStudentId);
    }

    public UUID getId() {
        return id;
    }

    public UUID getStudentId() {
        return studentId;
    }

    public ApplicationType getApplicationType() {
        return applicationType;
    }

    public String getReason() {
        return reason;
    }

    public LeaveStatus getStatus() {
        return status;
    }

    public OtpChallenge getOtp() {
        return otp;
    }

    public WardenVerification getWardenVerification() {
        return wardenVerification;
    }

    public WardenRecommendation getWardenRecommendation() {
        return wardenRecommendation;
    }

    public PrincipalDecision getPrincipalDecision() {
        return principalDecision;
    }

    public Rejection getRejection() {
        return rejection;
    }

    public GatePass getGatePass() {
        return gatePass;
    }

    public List<GatePassVisit> getVisits() {
        return Collections.unmodifiableList(visits);
    }

    public VerificationStatus getVerificationStatus() {
        return verificationStatus;
    }

    public OffsetDateTime getCompletedAt() {
        return completedAt;
    }

    public long getVersion() {
        return version;
    }
}
