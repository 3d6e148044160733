package com.hostelgate.backend.modules.auth.domain;

public enum HostelRole {
    STUDENT,
    WARDEN,
    PRINCIPAL,
    SECURITY,
    ADMIN;

    public boolean isStaff() {
        return this != STUDENT;
    }
}
