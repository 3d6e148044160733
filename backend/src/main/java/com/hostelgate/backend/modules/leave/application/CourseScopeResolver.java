package com.hostelgate.backend.modules.leave.application;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

import com.hostelgate.backend.modules.auth.application.StaffProfile;
import com.hostelgate.backend.modules.auth.application.StudentDirectory;
import com.hostelgate.backend.modules.auth.application.StudentProfile;
import com.hostelgate.backend.modules.auth.domain.HostelRole;

import org.springframework.stereotype.Component;

/**
 * Decides which students a staff member may act on. Course names are compared after alias normalisation,
 * so "BTECH", "B TECH" and "B.Tech" refer to the same course.
 */
@Component
public class CourseScopeResolver {

    private final StudentDirectory studentDirectory;
    private final Map<String, String> aliases;

    public CourseScopeResolver(StudentDirectory studentDirectory, LeaveProperties properties) {
        this.studentDirectory = studentDirectory;
        this.aliases = properties.courseAliases().entrySet().stream()
                .collect(Collectors.toUnmodifiableMap(
                        entry -> entry.getKey().trim().toUpperCase(Locale.ROOT),
                        entry -> entry.getValue().trim()));
    }

    public String resolveCourseName(String raw) {
        if (raw == null) {
            return null;
        }
        String trimmed = raw.trim();
        return aliases.getOrDefault(trimmed.toUpperCase(Locale.ROOT), trimmed);
    }

    public Set<String> getAllowedCourseNames(StaffProfile staff) {
        Set<String> allowed = new LinkedHashSet<>();
        for (String course : staff.courseNames()) {
            String resolved = resolveCourseName(course);
            if (resolved != null && !resolved.isEmpty()) {
                allowed.add(resolved);
            }
        }
        return allowed;
    }

    public boolean canAct(StaffProfile staff, StudentProfile student) {
        if (staff.hasRole(HostelRole.ADMIN)) {
            return true;
        }
        Set<String> allowed = getAllowedCourseNames(staff);
        if (allowed.isEmpty()) {
            return staff.hasRole(HostelRole.WARDEN);
        }
        String studentCourse = resolveCourseName(student.courseName());
        if (studentCourse == null || !allowed.contains(studentCourse)) {
            return false;
        }
        String staffBranch = staff.branchName();
        if (staffBranch == null || staffBranch.isBlank()) {
            return true;
        }
        return student.branchName() != null && staffBranch.trim().equalsIgnoreCase(student.branchName().trim());
    }

    public void ensureCanAct(StaffProfile staff, StudentProfile student) {
        if (!canAct(staff, student)) {
            throw LeaveProblems.authorizationDenied(
                    "You can only act on requests from students of your assigned course.");
        }
    }

    /** Active staff of {@code role} whose scope covers the student. */
    public List<StaffProfile> findScopedStaff(HostelRole role, StudentProfile student) {
        return studentDirectory.findActiveStaff(role).stream()
                .filter(staff -> canAct(staff, student))
                .toList();
    }
}
