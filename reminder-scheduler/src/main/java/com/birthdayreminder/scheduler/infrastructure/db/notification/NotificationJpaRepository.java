package com.birthdayreminder.scheduler.infrastructure.db.notification;

import java.time.Instant;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface NotificationJpaRepository extends JpaRepository<NotificationEntity, String> {

    @Query("""
            SELECT CASE WHEN COUNT(n) > 0 THEN true ELSE false END
            FROM NotificationEntity n JOIN n.metadata m
            WHERE n.userId = :userId
              AND n.birthdayId = :birthdayId
              AND KEY(m) = :metadataKey
              AND VALUE(m) = :metadataValue
              AND n.createdAt >= :since
            """)
    boolean existsWithMetadataSince(
            @Param("userId") String userId,
            @Param("birthdayId") String birthdayId,
            @Param("metadataKey") String metadataKey,
            @Param("metadataValue") String metadataValue,
            @Param("since") Instant since);

    long countByUserIdAndReadFalse(String userId);
}
