package com.hostelgate.backend.modules.leave.domain;

import java.util.EnumMap;
import java.util.Map;
import java.util.Optional;

/**
 * Transition table for leave requests. Leave and permission requests share one track; stay-in-hostel requests
 * follow the recommendation track. A missing entry means the action is not allowed from that status.
 */
public final class ApprovalStateMachine {

    private static final Map<LeaveStatus, Map<ApprovalAction, LeaveStatus>> GATE_PASS_TRACK = new EnumMap<>(LeaveStatus.class);
    private static final Map<LeaveStatus, Map<ApprovalAction, LeaveStatus>> STAY_TRACK = new EnumMap<>(LeaveStatus.class);

    static {
        allow(GATE_PASS_TRACK, LeaveStatus.PENDING_OTP_VERIFICATION, ApprovalAction.VERIFY_OTP, LeaveStatus.WARDEN_VERIFIED);
        for (LeaveStatus awaitingPrincipal : new LeaveStatus[] {LeaveStatus.WARDEN_VERIFIED, LeaveStatus.PENDING_PRINCIPAL_APPROVAL}) {
            allow(GATE_PASS_TRACK, awaitingPrincipal, ApprovalAction.PRINCIPAL_APPROVE, LeaveStatus.APPROVED);
            allow(GATE_PASS_TRACK, awaitingPrincipal, ApprovalAction.PRINCIPAL_REJECT, LeaveStatus.REJECTED);
        }
        for (LeaveStatus open : new LeaveStatus[] {
                LeaveStatus.PENDING,
                LeaveStatus.PENDING_OTP_VERIFICATION,
                LeaveStatus.WARDEN_VERIFIED,
                LeaveStatus.PENDING_PRINCIPAL_APPROVAL}) {
            allow(GATE_PASS_TRACK, open, ApprovalAction.WARDEN_REJECT, LeaveStatus.REJECTED);
            allow(GATE_PASS_TRACK, open, ApprovalAction.ADMIN_REJECT, LeaveStatus.REJECTED);
        }

        allow(STAY_TRACK, LeaveStatus.PENDING, ApprovalAction.RECOMMEND, LeaveStatus.WARDEN_RECOMMENDED);
        allow(STAY_TRACK, LeaveStatus.PENDING, ApprovalAction.NOT_RECOMMEND, LeaveStatus.REJECTED);
        allow(STAY_TRACK, LeaveStatus.WARDEN_RECOMMENDED, ApprovalAction.DECIDE_APPROVE, LeaveStatus.PRINCIPAL_APPROVED);
        allow(STAY_TRACK, LeaveStatus.WARDEN_RECOMMENDED, ApprovalAction.DECIDE_REJECT, LeaveStatus.PRINCIPAL_REJECTED);
        allow(STAY_TRACK, LeaveStatus.PENDING, ApprovalAction.ADMIN_REJECT, LeaveStatus.REJECTED);
        allow(STAY_TRACK, LeaveStatus.WARDEN_RECOMMENDED, ApprovalAction.ADMIN_REJECT, LeaveStatus.REJECTED);
    }

    private ApprovalStateMachine() {
    }

    public static LeaveStatus initialStatus(ApplicationType type, boolean parentPermissionForOuting) {
        return switch (type) {
            case LEAVE -> LeaveStatus.PENDING_OTP_VERIFICATION;
            case PERMISSION -> parentPermissionForOuting
                    ? LeaveStatus.PENDING_OTP_VERIFICATION
                    : LeaveStatus.PENDING_PRINCIPAL_APPROVAL;
            case STAY_IN_HOSTEL -> LeaveStatus.PENDING;
        };
    }

    public static Optional<LeaveStatus> next(ApplicationType type, LeaveStatus current, ApprovalAction action) {
        if (current == null || current.isTerminal()) {
            return Optional.empty();
        }
        Map<LeaveStatus, Map<ApprovalAction, LeaveStatus>> track = type.hasGatePass() ? GATE_PASS_TRACK : STAY_TRACK;
        return Optional.ofNullable(track.getOrDefault(current, Map.of()).get(action));
    }

    public static boolean requiresOtp(ApplicationType type, boolean parentPermissionForOuting) {
        return initialStatus(type, parentPermissionForOuting) == LeaveStatus.PENDING_OTP_VERIFICATION;
    }

    private static void allow(
            Map<LeaveStatus, Map<ApprovalAction, LeaveStatus>> track,
            LeaveStatus from,
            ApprovalAction action,
            LeaveStatus to
    ) {
        track.computeIfAbsent(from, ignored -> new EnumMap<>(ApprovalAction.class)).put(action, to);
    }
}
