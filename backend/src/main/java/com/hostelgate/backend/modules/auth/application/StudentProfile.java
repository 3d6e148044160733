package com.hostelgate.backend.modules.auth.application;

import java.util.UUID;

import com.hostelgate.backend.modules.auth.domain.Gender;

public record StudentProfile(
        UUID id,
        String fullName,
        String rollNumber,
        Gender gender,
        String courseName,
        String branchName,
        String parentPhone,
        boolean parentPermissionForOuting
) {
}
