package com.birthdayreminder.scheduler.domain.notification;

import java.time.Instant;
import java.util.Map;
import java.util.stream.Collectors;
import lombok.Builder;

@Builder(toBuilder = true)
public record Notification(
        String id,
        String userId,
        String message,
        NotificationType type,
        boolean read,
        String birthdayId,
        Map<String, String> metadata,
        Instant createdAt
) {

    /** Metadata key holding the day-count that produced a birthday reminder. */
    public static final String DAY_COUNT_KEY = "dayCount";

    /** Entries with a null key or value are dropped. */
    public Notification {
        metadata = metadata == null ? Map.of() : metadata.entrySet().stream()
                .filter(entry -> entry.getKey() != null && entry.getValue() != null)
                .collect(Collectors.toUnmodifiableMap(Map.Entry::getKey, Map.Entry::getValue));
    }
}
