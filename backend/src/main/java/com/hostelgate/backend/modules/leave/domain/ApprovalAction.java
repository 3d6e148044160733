package com.hostelgate.backend.modules.leave.domain;

import java.util.EnumSet;
import java.util.Set;

import com.hostelgate.backend.modules.auth.domain.HostelRole;

public enum ApprovalAction {
    VERIFY_OTP(EnumSet.of(HostelRole.WARDEN, HostelRole.ADMIN)),
    PRINCIPAL_APPROVE(EnumSet.of(HostelRole.PRINCIPAL)),
    PRINCIPAL_REJECT(EnumSet.of(HostelRole.PRINCIPAL)),
    WARDEN_REJECT(EnumSet.of(HostelRole.WARDEN)),
    ADMIN_REJECT(EnumSet.of(HostelRole.ADMIN)),
    RECOMMEND(EnumSet.of(HostelRole.WARDEN)),
    NOT_RECOMMEND(EnumSet.of(HostelRole.WARDEN)),
    DECIDE_APPROVE(EnumSet.of(HostelRole.PRINCIPAL)),
    DECIDE_REJECT(EnumSet.of(HostelRole.PRINCIPAL));

    private final Set<HostelRole> allowedRoles;

    ApprovalAction(Set<HostelRole> allowedRoles) {
        this.allowedRoles = allowedRoles;
    }

    public boolean isAllowedFor(HostelRole role) {
        return allowedRoles.contains(role);
    }

    public Set<HostelRole> allowedRoles() {
        return EnumSet.copyOf(allowedRoles);
    }
}
