package com.birthdayreminder.scheduler.domain.reminder;

import com.birthdayreminder.scheduler.domain.notification.Notification;
import com.birthdayreminder.scheduler.domain.notification.NotificationRepository;
import java.time.Duration;
import java.time.Instant;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/**
 * Suppresses a reminder when the same (user, birthday, day-count) was already notified within
 * the lookback. The lookback spans two scheduler periods so one late or missed run does not
 * re-alert. Storage errors propagate.
 */
@Component
@RequiredArgsConstructor
public class ReminderDedupGuard {

    public static final Duration LOOKBACK = Duration.ofHours(48);

    private final NotificationRepository notificationRepository;

    public boolean alreadyNotified(String userId, String birthdayId, int daysUntil, Instant now) {
        return notificationRepository.existsWithMetadataSince(
                userId,
                birthdayId,
                Notification.DAY_COUNT_KEY,
                Integer.toString(daysUntil),
                now.minus(LOOKBACK));
    }
}
