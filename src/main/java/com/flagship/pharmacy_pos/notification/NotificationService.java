package com.flagship.pharmacy_pos.notification;

import com.flagship.pharmacy_pos.exception.ResourceNotFoundException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * In-app notifications for cashiers, mostly about sessions closed on their behalf.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class NotificationService {

    private final NotificationRepository repository;

    @Transactional
    public Notification notify(UUID userId, NotificationType type, String title, String message,
                               UUID sourceEventId) {
        Notification notification = Notification.builder()
            .id(UUID.randomUUID())
            .userId(userId)
            .type(type)
            .title(title)
            .message(message)
            .sourceEventId(sourceEventId)
            .createdAt(Instant.now())
            .build();

        repository.save(NotificationEntity.fromDomain(notification));
        log.info("Notification created: userId={}, type={}, sourceEventId={}", userId, type, sourceEventId);
        return notification;
    }

    @Transactional(readOnly = true)
    public List<Notification> findForUser(UUID userId, boolean unreadOnly) {
        List<NotificationEntity> entities = unreadOnly
            ? repository.findByUserIdAndReadAtIsNullOrderByCreatedAtDesc(userId)
            : repository.findByUserIdOrderByCreatedAtDesc(userId);
        return entities.stream().map(NotificationEntity::toDomain).toList();
    }

    /**
     * Marking an already read notification again keeps the first read time.
     */
    @Transactional
    public Notification markRead(UUID notificationId) {
        NotificationEntity entity = repository.findById(notificationId)
            .orElseThrow(() -> new ResourceNotFoundException("Notification", notificationId));
        if (entity.getReadAt() == null) {
            entity.setReadAt(Instant.now());
            repository.save(entity);
        }
        return entity.toDomain();
    }
}
