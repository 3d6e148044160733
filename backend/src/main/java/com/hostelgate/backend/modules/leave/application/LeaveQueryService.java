package com.hostelgate.backend.modules.leave.application;

import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;

import com.hostelgate.backend.modules.auth.application.StaffProfile;
import com.hostelgate.backend.modules.auth.application.StudentDirectory;
import com.hostelgate.backend.modules.auth.application.StudentProfile;
import com.hostelgate.backend.modules.auth.domain.HostelRole;
import com.hostelgate.backend.modules.leave.domain.ApplicationType;
import com.hostelgate.backend.modules.leave.domain.LeaveRequest;
import com.hostelgate.backend.modules.leave.domain.LeaveStatus;
import com.hostelgate.backend.modules.leave.infrastructure.persistence.LeaveRequestRepository;
import com.hostelgate.backend.modules.leave.presentation.dto.LeaveDtoMapper;
import com.hostelgate.backend.modules.leave.presentation.dto.LeaveRequestResponse;

import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Staff work queues. Every listing is narrowed to the students the caller's course scope covers.
 */
@Service
@Transactional(readOnly = true)
public class LeaveQueryService {

    private static final int HISTORY_LIMIT = 20;
    private static final Set<ApplicationType> GATE_PASS_TYPES = EnumSet.of(ApplicationType.LEAVE, ApplicationType.PERMISSION);
    private static final Set<LeaveStatus> PRINCIPAL_QUEUE = EnumSet.of(
            LeaveStatus.WARDEN_VERIFIED, LeaveStatus.PENDING_PRINCIPAL_APPROVAL);
    private static final Set<LeaveStatus> FINISHED = EnumSet.of(
            LeaveStatus.APPROVED, LeaveStatus.REJECTED, LeaveStatus.PRINCIPAL_APPROVED, LeaveStatus.PRINCIPAL_REJECTED);

    private final LeaveRequestRepository leaveRequestRepository;
    private final StudentDirectory studentDirectory;
    private final CourseScopeResolver courseScopeResolver;

    public LeaveQueryService(
            LeaveRequestRepository leaveRequestRepository,
            StudentDirectory studentDirectory,
            CourseScopeResolver courseScopeResolver
    ) {
        this.leaveRequestRepository = leaveRequestRepository;
        this.studentDirectory = studentDirectory;
        this.courseScopeResolver = courseScopeResolver;
    }

    public List<LeaveRequestResponse> listForWarden(UUID wardenId, LeaveStatus status, ApplicationType type) {
        StaffProfile warden = requireStaff(wardenId);
        Set<ApplicationType> types = type != null ? EnumSet.of(type) : GATE_PASS_TYPES;
        Set<LeaveStatus> statuses = status != null ? EnumSet.of(status) : EnumSet.allOf(LeaveStatus.class);
        return scoped(warden, leaveRequestRepository.findByStatusInAndApplicationTypeInOrderByCreatedAtDesc(statuses, types));
    }

    public List<LeaveRequestResponse> listStayRequestsForWarden(UUID wardenId) {
        StaffProfile warden = requireStaff(wardenId);
        return scoped(warden, leaveRequestRepository.findByApplicationTypeInOrderByCreatedAtDesc(
                EnumSet.of(ApplicationType.STAY_IN_HOSTEL)));
    }

    public List<LeaveRequestResponse> listStayRequestsForPrincipal(UUID principalId, LeaveStatus status) {
        StaffProfile principal = requireStaff(principalId);
        Set<LeaveStatus> statuses = status != null ? EnumSet.of(status) : EnumSet.of(LeaveStatus.WARDEN_RECOMMENDED);
        return scoped(principal, leaveRequestRepository.findByStatusInAndApplicationTypeInOrderByCreatedAtDesc(
                statuses, EnumSet.of(ApplicationType.STAY_IN_HOSTEL)));
    }

    public List<LeaveRequestResponse> listForPrincipal(UUID principalId, LeaveStatus status, ApplicationType type) {
        StaffProfile principal = requireStaff(principalId);
        Set<ApplicationType> types = type != null ? EnumSet.of(type) : GATE_PASS_TYPES;
        Set<LeaveStatus> statuses = status != null ? EnumSet.of(status) : PRINCIPAL_QUEUE;
        return scoped(principal, leaveRequestRepository.findByStatusInAndApplicationTypeInOrderByCreatedAtDesc(statuses, types));
    }

    /** Latest finished requests of one student, for the principal's decision context. */
    public List<LeaveRequestResponse> getStudentHistory(UUID principalId, UUID studentId) {
        StaffProfile principal = requireStaff(principalId);
        StudentProfile student = studentDirectory.findStudent(studentId)
                .orElseThrow(() -> LeaveProblems.studentNotFound(studentId));
        courseScopeResolver.ensureCanAct(principal, student);
        return leaveRequestRepository.findByStudentIdAndStatusInOrderByCreatedAtDesc(
                        studentId, FINISHED, PageRequest.of(0, HISTORY_LIMIT)).stream()
                .map(request -> LeaveDtoMapper.toResponse(request, student))
                .toList();
    }

    public List<LeaveRequestResponse> listApproved() {
        List<LeaveRequest> approved = leaveRequestRepository.findByStatusInAndApplicationTypeInOrderByCreatedAtDesc(
                EnumSet.of(LeaveStatus.APPROVED), GATE_PASS_TYPES);
        Map<UUID, StudentProfile> students = studentDirectory.findStudents(
                approved.stream().map(LeaveRequest::getStudentId).distinct().toList());
        return approved.stream()
                .map(request -> LeaveDtoMapper.toResponse(request, students.get(request.getStudentId())))
                .toList();
    }

    private List<LeaveRequestResponse> scoped(StaffProfile staff, List<LeaveRequest> requests) {
        Map<UUID, StudentProfile> students = studentDirectory.findStudents(
                requests.stream().map(LeaveRequest::getStudentId).distinct().toList());
        boolean unrestricted = staff.hasRole(HostelRole.ADMIN);
        return requests.stream()
                .filter(request -> {
                    StudentProfile student = students.get(request.getStudentId());
                    return student != null && (unrestricted || courseScopeResolver.canAct(staff, student));
                })
                .map(request -> LeaveDtoMapper.toResponse(request, students.get(request.getStudentId())))
                .toList();
    }

    private StaffProfile requireStaff(UUID staffId) {
        return studentDirectory.findStaff(staffId).orElseThrow(() -> LeaveProblems.staffNotFound(staffId));
    }
}
