package com.hostelgate.backend.modules.auth.application;

import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.function.Function;
import java.util.stream.Collectors;

import com.hostelgate.backend.modules.auth.domain.HostelRole;
import com.hostelgate.backend.modules.auth.domain.HostelUser;
import com.hostelgate.backend.modules.auth.domain.HostelUserStatus;
import com.hostelgate.backend.modules.auth.infrastructure.persistence.HostelUserRepository;

import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Service
@Transactional(readOnly = true)
public class JpaStudentDirectory implements StudentDirectory {

    private final HostelUserRepository hostelUserRepository;

    public JpaStudentDirectory(HostelUserRepository hostelUserRepository) {
        this.hostelUserRepository = hostelUserRepository;
    }

    @Override
    public Optional<StudentProfile> findStudent(UUID studentId) {
        return hostelUserRepository.findById(studentId)
                .filter(user -> user.getRole() == HostelRole.STUDENT)
                .map(JpaStudentDirectory::toStudentProfile);
    }

    @Override
    public Map<UUID, StudentProfile> findStudents(Collection<UUID> studentIds) {
        if (studentIds.isEmpty()) {
            return Map.of();
        }
        return hostelUserRepository.findAllById(studentIds).stream()
                .filter(user -> user.getRole() == HostelRole.STUDENT)
                .map(JpaStudentDirectory::toStudentProfile)
                .collect(Collectors.toMap(StudentProfile::id, Function.identity()));
    }

    @Override
    public Optional<StaffProfile> findStaff(UUID staffId) {
        return hostelUserRepository.findById(staffId)
                .filter(user -> user.getRole().isStaff())
                .filter(user -> user.getStatus() == HostelUserStatus.ACTIVE)
                .map(JpaStudentDirectory::toStaffProfile);
    }

    @Override
    public List<StaffProfile> findActiveStaff(HostelRole role) {
        return hostelUserRepository.findByRoleAndStatus(role, HostelUserStatus.ACTIVE).stream()
                .map(JpaStudentDirectory::toStaffProfile)
                .toList();
    }

    private static StudentProfile toStudentProfile(HostelUser user) {
        return new StudentProfile(
                user.getId(),
                user.getFullName(),
                user.getRollNumber(),
                user.getGender(),
                user.getCourseName(),
                user.getBranchName(),
                user.getParentPhone(),
                user.isParentPermissionForOuting()
        );
    }

    private static StaffProfile toStaffProfile(HostelUser user) {
        return new StaffProfile(
                user.getId(),
                user.getFullName(),
                user.getRole(),
                user.getAssignedCourses(),
                user.getBranchName()
        );
    }
}
