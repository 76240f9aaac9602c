package com.birthdayreminder.scheduler.domain.notification;

import com.birthdayreminder.common.id.UlidGenerator;
import com.birthdayreminder.scheduler.domain.birthday.Birthday;
import java.time.Clock;
import java.time.Instant;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

@Slf4j
@Service
@RequiredArgsConstructor
public class NotificationService {

    private final NotificationRepository notificationRepository;
    private final Clock clock;

    public Notification createNotification(
            String userId,
            String message,
            NotificationType type,
            Map<String, String> metadata,
            String birthdayId) {
        var now = Instant.now(clock);
        var notification = Notification.builder()
                .id(UlidGenerator.generate(now))
                .userId(userId)
                .message(message)
                .type(type != null ? type : NotificationType.SYSTEM)
                .read(false)
                .birthdayId(birthdayId)
                .metadata(metadata)
                .createdAt(now)
                .build();
        try {
            return notificationRepository.save(notification);
        } catch (RuntimeException e) {
            log.error("Failed to store notification for user {}: {}", userId, e.getMessage());
            throw e;
        }
    }

    public Notification createBirthdayReminder(String userId, Birthday birthday, int daysUntil) {
        var saved = createNotification(
                userId,
                reminderMessage(birthday.name(), daysUntil),
                NotificationType.BIRTHDAY,
                Map.of(Notification.DAY_COUNT_KEY, Integer.toString(daysUntil)),
                birthday.id());
        log.info("Birthday reminder created: user_id={}, birthday_id={}, days_until={}",
                userId, birthday.id(), daysUntil);
        return saved;
    }

    public long countUnread(String userId) {
        return notificationRepository.countUnreadByUserId(userId);
    }

    static String reminderMessage(String name, int daysUntil) {
        if (daysUntil == 0) {
            return "🎉 Today is " + name + "'s birthday!";
        }
        if (daysUntil == 1) {
            return "⏰ Tomorrow is " + name + "'s birthday";
        }
        return "📅 " + name + "'s birthday is in " + daysUntil + " days";
    }
}
