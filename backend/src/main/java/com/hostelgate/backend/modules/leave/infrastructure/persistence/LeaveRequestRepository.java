package com.hostelgate.backend.modules.leave.infrastructure.persistence;

import java.time.OffsetDateTime;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

import com.hostelgate.backend.modules.leave.domain.ApplicationType;
import com.hostelgate.backend.modules.leave.domain.LeaveRequest;
import com.hostelgate.backend.modules.leave.domain.LeaveStatus;

import jakarta.persistence.LockModeType;

import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface LeaveRequestRepository extends JpaRepository<LeaveRequest, UUID> {

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("select lr from LeaveRequest lr where lr.id = :id")
    Optional<LeaveRequest> findByIdForUpdate(@Param("id") UUID id);

    @Query("""
            select count(lr) > 0
              from LeaveRequest lr
             where lr.studentId = :studentId
               and lr.applicationType = :applicationType
               and lr.createdAt >= :from
               and lr.createdAt < :to
            """)
    boolean existsCreatedBetween(
            @Param("studentId") UUID studentId,
            @Param("applicationType") ApplicationType applicationType,
            @Param("from") OffsetDateTime from,
            @Param("to") OffsetDateTime to
    );

    List<LeaveRequest> findByStudentIdOrderByCreatedAtDesc(UUID studentId);

    List<LeaveRequest> findByStudentIdAndStatusInOrderByCreatedAtDesc(
            UUID studentId,
            Collection<LeaveStatus> statuses,
            Pageable pageable
    );

    List<LeaveRequest> findByStatusInAndApplicationTypeInOrderByCreatedAtDesc(
            Collection<LeaveStatus> statuses,
            Collection<ApplicationType> applicationTypes
    );

    List<LeaveRequest> findByApplicationTypeInOrderByCreatedAtDesc(Collection<ApplicationType> applicationTypes);

    @Query("select lr.id from LeaveRequest lr where lr.status in :statuses order by lr.createdAt asc")
    List<UUID> findIdsByStatusIn(@Param("statuses") Collection<LeaveStatus> statuses);
}
