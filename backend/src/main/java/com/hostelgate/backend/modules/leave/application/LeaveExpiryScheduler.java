package com.hostelgate.backend.modules.leave.application;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

@Component
@ConditionalOnProperty(prefix = "app.leave.expiry", name = "enabled", havingValue = "true", matchIfMissing = true)
public class LeaveExpiryScheduler {

    private static final Logger log = LoggerFactory.getLogger(LeaveExpiryScheduler.class);

    private final LeaveExpiryReaper leaveExpiryReaper;

    public LeaveExpiryScheduler(LeaveExpiryReaper leaveExpiryReaper) {
        this.leaveExpiryReaper = leaveExpiryReaper;
    }

    @Scheduled(cron = "${app.leave.expiry.cron:0 5 0 * * *}", zone = "Asia/Kolkata")
    public void sweepExpiredRequests() {
        try {
            leaveExpiryReaper.runExpirySweep();
        } catch (RuntimeException e) {
            log.warn("[ALERT][Batch][LEAVE_EXPIRED] sweep aborted: {}", e.getMessage(), e);
        }
    }
}
