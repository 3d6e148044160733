package com.hostelgate.backend.modules.leave.application;

import java.util.List;
import java.util.Map;
import java.util.UUID;

import com.hostelgate.backend.global.common.time.IstTimeWindow;
import com.hostelgate.backend.modules.audit.application.AuditLogService;
import com.hostelgate.backend.modules.audit.application.AuditLogService.AuditLogCommand;
import com.hostelgate.backend.modules.leave.domain.LeaveRequest;
import com.hostelgate.backend.modules.leave.domain.LeaveStatus;
import com.hostelgate.backend.modules.leave.infrastructure.persistence.LeaveRequestRepository;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

/**
 * Deletes requests that were never fully processed before their dates passed. Each candidate is notified first and
 * then deleted in a short transaction under the row lock, so one failure does not stop the sweep and no lock is
 * held while the notice is sent.
 */
@Service
public class LeaveExpiryReaper {

    private static final Logger log = LoggerFactory.getLogger(LeaveExpiryReaper.class);

    private final LeaveRequestRepository leaveRequestRepository;
    private final LeaveNotifier leaveNotifier;
    private final AuditLogService auditLogService;
    private final IstTimeWindow timeWindow;
    private final TransactionTemplate transactionTemplate;

    public LeaveExpiryReaper(
            LeaveRequestRepository leaveRequestRepository,
            LeaveNotifier leaveNotifier,
            AuditLogService auditLogService,
            IstTimeWindow timeWindow,
            PlatformTransactionManager transactionManager
    ) {
        this.leaveRequestRepository = leaveRequestRepository;
        this.leaveNotifier = leaveNotifier;
        this.auditLogService = auditLogService;
        this.timeWindow = timeWindow;
        this.transactionTemplate = new TransactionTemplate(transactionManager);
    }

    /**
     * @return number of requests deleted in this run
     */
    public int runExpirySweep() {
        List<UUID> candidates = leaveRequestRepository.findIdsByStatusIn(LeaveStatus.reapable());
        int deleted = 0;
        int failed = 0;
        for (UUID candidateId : candidates) {
            try {
                if (reap(candidateId)) {
                    deleted++;
                }
            } catch (RuntimeException e) {
                failed++;
                log.warn("[ALERT][Batch][LEAVE_EXPIRED] request={} error={}", candidateId, e.getMessage(), e);
            }
        }
        log.info("Leave expiry sweep finished: candidates={}, deleted={}, failed={}", candidates.size(), deleted, failed);
        return deleted;
    }

    private boolean reap(UUID requestId) {
        ExpiredLeave expired = leaveRequestRepository.findById(requestId)
                .filter(request -> request.getStatus().isReapable() && isExpired(request))
                .map(ExpiredLeave::of)
                .orElse(null);
        if (expired == null) {
            return false;
        }
        // A failed notice propagates and leaves the request for the next run.
        leaveNotifier.notifyExpired(expired);
        return Boolean.TRUE.equals(transactionTemplate.execute(status -> delete(expired)));
    }

    private boolean delete(ExpiredLeave expired) {
        LeaveRequest request = leaveRequestRepository.findByIdForUpdate(expired.requestId()).orElse(null);
        if (request == null || request.getStatus() != expired.status() || !isExpired(request)) {
            log.info("Leave request {} changed before expiry, kept", expired.requestId());
            return false;
        }
        leaveRequestRepository.delete(request);
        auditLogService.record(new AuditLogCommand(
                "LEAVE_EXPIRED",
                "LEAVE_REQUEST",
                expired.requestId().toString(),
                null,
                null,
                Map.of(
                        "status", expired.status().name(),
                        "applicationType", expired.applicationType().name(),
                        "lastDate", expired.lastDate().toString()
                )
        ));
        return true;
    }

    boolean isExpired(LeaveRequest request) {
        return timeWindow.isBeforeToday(request.getSchedule().lastDate());
    }
}
