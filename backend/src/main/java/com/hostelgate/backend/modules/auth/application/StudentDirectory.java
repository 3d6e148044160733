package com.hostelgate.backend.modules.auth.application;

import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

import com.hostelgate.backend.modules.auth.domain.HostelRole;

/**
 * Read-only view of students and staff consumed by the leave workflow.
 */
public interface StudentDirectory {

    Optional<StudentProfile> findStudent(UUID studentId);

    Map<UUID, StudentProfile> findStudents(Collection<UUID> studentIds);

    Optional<StaffProfile> findStaff(UUID staffId);

    List<StaffProfile> findActiveStaff(HostelRole role);
}
