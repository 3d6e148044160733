package com.hostelgate.backend.modules.leave.domain;

public enum Recommendation {
    RECOMMENDED,
    NOT_RECOMMENDED
}
