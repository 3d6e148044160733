package com.hostelgate.backend.modules.auth.domain;

public enum Gender {
    MALE,
    FEMALE
}
