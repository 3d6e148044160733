package com.hostelgate.backend.modules.auth.domain;

import java.util.LinkedHashSet;
import java.util.Set;
import java.util.UUID;

import com.hostelgate.backend.global.jpa.AbstractTimestampedEntity;

import jakarta.persistence.CollectionTable;
import jakarta.persistence.Column;
import jakarta.persistence.ElementCollection;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.FetchType;
import jakarta.persistence.Id;
import jakarta.persistence.JoinColumn;
import jakarta.persistence.Table;

import org.hibernate.annotations.UuidGenerator;

/**
 * Hostel account: students and staff share one table. Student-only columns (roll number, parent phone,
 * parent-permission flag) stay null for staff; staff course scope lives in {@code staff_course_scope}.
 */
@Entity
@Table(name = "hostel_user")
public class HostelUser extends AbstractTimestampedEntity {

    @Id
    @UuidGenerator
    @Column(name = "id", nullable = false, updatable = false, columnDefinition = "uuid")
    private UUID id;

    @Column(name = "login_id", nullable = false, unique = true, length = 50)
    private String loginId;

    @Column(name = "full_name", nullable = false, length = 100)
    private String fullName;

    @Enumerated(EnumType.STRING)
    @Column(name = "role", nullable = false, length = 16)
    private HostelRole role;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 16)
    private HostelUserStatus status = HostelUserStatus.ACTIVE;

    @Column(name = "roll_number", length = 32)
    private String rollNumber;

    @Enumerated(EnumType.STRING)
    @Column(name = "gender", length = 8)
    private Gender gender;

    @Column(name = "course_name", length = 64)
    private String courseName;

    @Column(name = "branch_name", length = 64)
    private String branchName;

    @Column(name = "parent_phone", length = 20)
    private String parentPhone;

    @Column(name = "parent_permission_for_outing", nullable = false)
    private boolean parentPermissionForOuting = true;

    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "staff_course_scope", joinColumns = @JoinColumn(name = "user_id"))
    @Column(name = "course_name", nullable = false, length = 64)
    private Set<String> assignedCourses = new LinkedHashSet<>();

    public UUID getId() {
        return id;
    }

    public String getLoginId() {
        return loginId;
    }

    public void setLoginId(String loginId) {
        this.loginId = loginId;
    }

    public String getFullName() {
        return fullName;
    }

    public void setFullName(String fullName) {
        this.fullName = fullName;
    }

    public HostelRole getRole() {
        return role;
    }

    public void setRole(HostelRole role) {
        this.role = role;
    }

    public HostelUserStatus getStatus() {
        return status;
    }

    public void setStatus(HostelUserStatus status) {
        this.status = status;
    }

    public String getRollNumber() {
        return rollNumber;
    }

    public void setRollNumber(String rollNumber) {
        this.rollNumber = rollNumber;
    }

    public Gender getGender() {
        return gender;
    }

    public void setGender(Gender gender) {
        this.gender = gender;
    }

    public String getCourseName() {
        return courseName;
    }

    public void setCourseName(String courseName) {
        this.courseName = courseName;
    }

    public String getBranchName() {
        return branchName;
    }

    public void setBranchName(String branchName) {
        this.branchName = branchName;
    }

    public String getParentPhone() {
        return parentPhone;
    }

    public void setParentPhone(String parentPhone) {
        this.parentPhone = parentPhone;
    }

    public boolean isParentPermissionForOuting() {
        return parentPermissionForOuting;
    }

    public void setParentPermissionForOuting(boolean parentPermissionForOuting) {
        this.parentPermissionForOuting = parentPermissionForOuting;
    }

    public Set<String> getAssignedCourses() {
        return assignedCourses;
    }

    public void setAssignedCourses(Set<String> assignedCourses) {
        this.assignedCourses = assignedCourses;
    }
}
