package com.birthdayreminder.scheduler.infrastructure.db.notification;

import com.birthdayreminder.scheduler.domain.notification.Notification;
import com.birthdayreminder.scheduler.domain.notification.NotificationRepository;
import com.birthdayreminder.scheduler.infrastructure.db.notification.mapper.NotificationEntityMapper;
import java.time.Instant;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

@Repository
@RequiredArgsConstructor
public class NotificationRepositoryAdapter implements NotificationRepository {

    private final NotificationJpaRepository jpaRepository;
    private final NotificationEntityMapper mapper;

    @Override
    @Transactional
    public Notification save(Notification notification) {
        var saved = jpaRepository.save(mapper.toEntity(notification));
        return mapper.toDomain(saved);
    }

    @Override
    @Transactional(readOnly = true)
    public boolean existsWithMetadataSince(
            String userId, String birthdayId, String metadataKey, String metadataValue, Instant since) {
        return jpaRepository.existsWithMetadataSince(userId, birthdayId, metadataKey, metadataValue, since);
    }

    @Override
    @Transactional(readOnly = true)
    public long countUnreadByUserId(String userId) {
        return jpaRepository.countByUserIdAndReadFalse(userId);
    }
}
