package com.hostelgate.backend.modules.auth.application;

import java.util.Set;
import java.util.UUID;

import com.hostelgate.backend.modules.auth.domain.HostelRole;

/**
 * Staff member as seen by approval flows. {@code courseNames} is the raw assignment; normalisation happens in
 * the course scope resolver.
 */
public record StaffProfile(
        UUID id,
        String fullName,
        HostelRole role,
        Set<String> courseNames,
        String branchName
) {

    public StaffProfile {
        courseNames = courseNames == null ? Set.of() : Set.copyOf(courseNames);
    }

    public boolean hasRole(HostelRole candidate) {
        return role == candidate;
    }
}
