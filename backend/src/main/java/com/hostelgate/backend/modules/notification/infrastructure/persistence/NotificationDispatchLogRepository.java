package com.hostelgate.backend.modules.notification.infrastructure.persistence;

import java.util.List;

import com.hostelgate.backend.modules.notification.domain.NotificationChannel;
import com.hostelgate.backend.modules.notification.domain.NotificationDispatchLog;
import com.hostelgate.backend.modules.notification.domain.NotificationDispatchStatus;

import org.springframework.data.jpa.repository.JpaRepository;

public interface NotificationDispatchLogRepository extends JpaRepository<NotificationDispatchLog, Long> {

    long countByChannelAndStatus(NotificationChannel channel, NotificationDispatchStatus status);

    List<NotificationDispatchLog> findByReferenceKeyOrderByLoggedAtAsc(String referenceKey);
}
