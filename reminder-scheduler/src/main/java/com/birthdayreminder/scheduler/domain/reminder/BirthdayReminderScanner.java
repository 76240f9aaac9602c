package com.birthdayreminder.scheduler.domain.reminder;

import com.birthdayreminder.scheduler.domain.account.AccountDirectory;
import com.birthdayreminder.scheduler.domain.birthday.Birthday;
import com.birthdayreminder.scheduler.domain.birthday.BirthdayRepository;
import com.birthdayreminder.scheduler.domain.notification.NotificationService;
import com.birthdayreminder.scheduler.domain.occurrence.OccurrenceCalculator;
import java.time.Instant;
import java.time.LocalDate;
import java.util.concurrent.atomic.AtomicBoolean;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * One pass over every birthday of every account.
 *
 * <p>Birthdays are checked sequentially and each reminder is stored as soon as it is built. The
 * first error ends the pass: reminders stored before it stay, the rest wait for the next run.
 * Only one pass runs at a time; a concurrent request is skipped so two passes never both see
 * "not yet notified" for the same reminder.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class BirthdayReminderScanner {

    private final AccountDirectory accountDirectory;
    private final BirthdayRepository birthdayRepository;
    private final ReminderDedupGuard dedupGuard;
    private final NotificationService notificationService;

    private final AtomicBoolean inProgress = new AtomicBoolean();

    public ScanSummary scan(LocalDate today, Instant now) {
        if (!inProgress.compareAndSet(false, true)) {
            log.warn("Birthday reminder check already in progress, skipping run at {}", now);
            return ScanSummary.skipped(now);
        }
        var progress = new Progress();
        try {
            for (var userId : accountDirectory.findAllAccountIds()) {
                progress.accounts++;
                for (var birthday : birthdayRepository.findByUserId(userId)) {
                    progress.birthdays++;
                    check(userId, birthday, today, now, progress);
                }
            }
            log.info("Birthday reminder check completed at {}: accounts={}, birthdays={}, created={}, duplicates={}",
                    now, progress.accounts, progress.birthdays, progress.created, progress.duplicates);
            return progress.toSummary(now, ScanSummary.Outcome.COMPLETED);
        } catch (RuntimeException e) {
            log.error("Birthday reminder check aborted after {} birthdays ({} reminders created)",
                    progress.birthdays, progress.created, e);
            return progress.toSummary(now, ScanSummary.Outcome.ABORTED);
        } finally {
            inProgress.set(false);
        }
    }

    private void check(String userId, Birthday birthday, LocalDate today, Instant now, Progress progress) {
        if (!birthday.allowNotifications()) {
            log.debug("Notifications disabled for birthday {}", birthday.id());
            return;
        }
        var occurrence = OccurrenceCalculator.nextOccurrence(birthday.recurringDate(), today);
        if (!AlertWindows.matches(occurrence.daysUntil())) {
            return;
        }
        if (dedupGuard.alreadyNotified(userId, birthday.id(), occurrence.daysUntil(), now)) {
            log.debug("Reminder already sent: birthday_id={}, days_until={}", birthday.id(), occurrence.daysUntil());
            progress.duplicates++;
            return;
        }
        notificationService.createBirthdayReminder(userId, birthday, occurrence.daysUntil());
        progress.created++;
    }

    private static final class Progress {
        int accounts;
        int birthdays;
        int created;
        int duplicates;

        ScanSummary toSummary(Instant startedAt, ScanSummary.Outcome outcome) {
            return new ScanSummary(startedAt, outcome, accounts, birthdays, created, duplicates);
        }
    }
}
