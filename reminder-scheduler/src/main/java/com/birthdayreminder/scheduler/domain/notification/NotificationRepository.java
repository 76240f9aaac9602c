package com.birthdayreminder.scheduler.domain.notification;

import java.time.Instant;

public interface NotificationRepository {

    Notification save(Notification notification);

    /**
     * Whether the user already has a notification for the birthday whose metadata maps
     * {@code metadataKey} to {@code metadataValue}, created at or after {@code since}.
     */
    boolean existsWithMetadataSince(
            String userId, String birthdayId, String metadataKey, String metadataValue, Instant since);

    long countUnreadByUserId(String userId);
}
