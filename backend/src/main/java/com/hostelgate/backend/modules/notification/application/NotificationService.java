package com.hostelgate.backend.modules.notification.application;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

import com.hostelgate.backend.modules.auth.domain.HostelUser;
import com.hostelgate.backend.modules.auth.infrastructure.persistence.HostelUserRepository;
import com.hostelgate.backend.modules.notification.domain.Notification;
import com.hostelgate.backend.modules.notification.domain.NotificationChannel;
import com.hostelgate.backend.modules.notification.domain.NotificationDispatchLog;
import com.hostelgate.backend.modules.notification.domain.NotificationDispatchStatus;
import com.hostelgate.backend.modules.notification.domain.NotificationState;
import com.hostelgate.backend.modules.notification.infrastructure.persistence.NotificationDispatchLogRepository;
import com.hostelgate.backend.modules.notification.infrastructure.persistence.NotificationRepository;

import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.web.server.ResponseStatusException;

@Service
@Transactional
public class NotificationService {

    public static final String KIND_LEAVE_STATUS = "LEAVE_STATUS";
    public static final String KIND_LEAVE_APPROVAL_QUEUE = "LEAVE_APPROVAL_QUEUE";
    public static final String KIND_LEAVE_EXPIRED = "LEAVE_EXPIRED";
    public static final int DEFAULT_TTL_HOURS = 24 * 7;

    private static final int MAX_ERROR_MESSAGE_LENGTH = 500;

    private final NotificationRepository notificationRepository;
    private final NotificationDispatchLogRepository notificationDispatchLogRepository;
    private final HostelUserRepository hostelUserRepository;
    private final Clock clock;

    public NotificationService(
            NotificationRepository notificationRepository,
            NotificationDispatchLogRepository notificationDispatchLogRepository,
            HostelUserRepository hostelUserRepository,
            Clock clock
    ) {
        this.notificationRepository = notificationRepository;
        this.notificationDispatchLogRepository = notificationDispatchLogRepository;
        this.hostelUserRepository = hostelUserRepository;
        this.clock = clock;
    }

    public NotificationPageResult getNotifications(UUID userId, NotificationFilterState filter, Pageable pageable) {
        expireNotifications(userId);

        List<NotificationState> states = switch (filter) {
            case ALL -> List.of(NotificationState.UNREAD, NotificationState.READ);
            case UNREAD -> List.of(NotificationState.UNREAD);
            case READ -> List.of(NotificationState.READ);
        };

        Page<Notification> page = notificationRepository.findByUserIdAndStates(userId, states, pageable);
        long unreadCount = notificationRepository.countByUserIdAndState(userId, NotificationState.UNREAD);

        return new NotificationPageResult(
                page.getContent(),
                page.getNumber(),
                page.getSize(),
                page.getTotalElements(),
                unreadCount
        );
    }

    public void markNotificationRead(UUID userId, UUID notificationId) {
        Notification notification = notificationRepository.findByIdAndUserId(notificationId, userId)
                .orElseThrow(() -> new ResponseStatusException(HttpStatus.NOT_FOUND, "NOTIFICATION_NOT_FOUND"));

        OffsetDateTime now = OffsetDateTime.now(clock);
        if (notification.getState() == NotificationState.EXPIRED || notification.isExpiredAt(now)) {
            throw new ResponseStatusException(HttpStatus.CONFLICT, "NOTIFICATION_EXPIRED");
        }

        if (notification.getState() == NotificationState.UNREAD) {
            notification.markRead(now);
            notificationRepository.save(notification);
        }
    }

    public int markAllNotificationsRead(UUID userId) {
        List<Notification> unread = notificationRepository.findByUserIdAndState(userId, NotificationState.UNREAD);
        if (unread.isEmpty()) {
            return 0;
        }
        OffsetDateTime now = OffsetDateTime.now(clock);
        unread.forEach(notification -> notification.markRead(now));
        notificationRepository.saveAll(unread);
        return unread.size();
    }

    /**
     * Creates an in-app notification unless one with the same dedupe key already exists for the user.
     *
     * @return the created notification, or empty when it was deduplicated
     */
    public Optional<Notification> sendNotification(
            UUID userId,
            String kindCode,
            String title,
            String body,
            String dedupeKey,
            Map<String, Object> metadata,
            int ttlHours,
            UUID relatedId
    ) {
        HostelUser user = hostelUserRepository.findById(userId)
                .orElseThrow(() -> new ResponseStatusException(HttpStatus.NOT_FOUND, "USER_NOT_FOUND"));

        if (dedupeKey != null && notificationRepository.findByUserIdAndDedupeKey(userId, dedupeKey).isPresent()) {
            return Optional.empty();
        }

        OffsetDateTime now = OffsetDateTime.now(clock);

        Notification notification = new Notification();
        notification.setUser(user);
        notification.setKindCode(kindCode);
        notification.setTitle(title);
        notification.setBody(body);
        notification.setState(NotificationState.UNREAD);
        notification.setDedupeKey(dedupeKey);
        notification.setTtlAt(now.plusHours(ttlHours));
        notification.setRelatedId(relatedId);
        notification.setMetadata(metadata == null ? Map.of() : metadata);

        notificationRepository.save(notification);
        recordDispatch(new DispatchRecord(
                notification,
                userId,
                NotificationChannel.IN_APP,
                dedupeKey,
                NotificationDispatchStatus.SUCCESS,
                null,
                null,
                null
        ));
        return Optional.of(notification);
    }

    public NotificationDispatchLog recordDispatch(DispatchRecord record) {
        NotificationDispatchLog log = new NotificationDispatchLog();
        log.setNotification(record.notification());
        log.setRecipientUserId(record.recipientUserId());
        log.setChannel(record.channel());
        log.setReferenceKey(record.referenceKey());
        log.setStatus(record.status());
        log.setProviderMessageId(record.providerMessageId());
        log.setErrorCode(record.errorCode());
        log.setErrorMessage(truncate(record.errorMessage()));
        log.setLoggedAt(OffsetDateTime.now(clock));
        return notificationDispatchLogRepository.save(log);
    }

    private void expireNotifications(UUID userId) {
        OffsetDateTime now = OffsetDateTime.now(clock);
        List<Notification> expirable = notificationRepository.findByUserIdAndTtlAtBeforeAndStateNot(
                userId,
                now,
                NotificationState.EXPIRED
        );
        if (expirable.isEmpty()) {
            return;
        }
        expirable.forEach(notification -> notification.markExpired(now));
        notificationRepository.saveAll(expirable);
    }

    private static String truncate(String message) {
        if (message == null || message.length() <= MAX_ERROR_MESSAGE_LENGTH) {
            return message;
        }
        return message.substring(0, MAX_ERROR_MESSAGE_LENGTH);
    }

    public enum NotificationFilterState {
        ALL,
        UNREAD,
        READ
    }

    public record NotificationPageResult(
            List<Notification> notifications,
            int page,
            int size,
            long totalElements,
            long unreadCount
    ) {
    }

    public record DispatchRecord(
            Notification notification,
            UUID recipientUserId,
            NotificationChannel channel,
            String referenceKey,
            NotificationDispatchStatus status,
            String providerMessageId,
            String errorCode,
            String errorMessage
    ) {
    }
}
