package com.hostelgate.backend.modules.leave.application;

import com.hostelgate.backend.global.config.AsyncConfig;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Component;
import org.springframework.transaction.event.TransactionPhase;
import org.springframework.transaction.event.TransactionalEventListener;

@Component
public class LeaveEventListener {

    private static final Logger log = LoggerFactory.getLogger(LeaveEventListener.class);

    private final LeaveNotifier leaveNotifier;
    private final OtpSmsDispatcher otpSmsDispatcher;

    public LeaveEventListener(LeaveNotifier leaveNotifier, OtpSmsDispatcher otpSmsDispatcher) {
        this.leaveNotifier = leaveNotifier;
        this.otpSmsDispatcher = otpSmsDispatcher;
    }

    @Async(AsyncConfig.DISPATCH_EXECUTOR)
    @TransactionalEventListener(phase = TransactionPhase.AFTER_COMMIT)
    public void onStatusChanged(LeaveStatusChangedEvent event) {
        try {
            leaveNotifier.notifyStatusChanged(event);
        } catch (RuntimeException e) {
            log.warn("[ALERT][Notification][LEAVE_STATUS] request={} status={} error={}",
                    event.requestId(), event.current(), e.getMessage(), e);
        }
    }

    @Async(AsyncConfig.DISPATCH_EXECUTOR)
    @TransactionalEventListener(phase = TransactionPhase.AFTER_COMMIT)
    public void onOtpIssued(OtpIssuedEvent event) {
        try {
            otpSmsDispatcher.dispatch(event);
        } catch (RuntimeException e) {
            log.warn("[ALERT][Sms][OTP] request={} error={}", event.requestId(), e.getMessage(), e);
        }
    }
}
