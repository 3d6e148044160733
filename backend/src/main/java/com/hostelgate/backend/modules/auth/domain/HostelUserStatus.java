package com.hostelgate.backend.modules.auth.domain;

public enum HostelUserStatus {
    ACTIVE,
    INACTIVE
}
