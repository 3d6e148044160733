package com.hostelgate.backend.modules.leave.domain;

public enum VisitType {
    OUTGOING,
    INCOMING
}
