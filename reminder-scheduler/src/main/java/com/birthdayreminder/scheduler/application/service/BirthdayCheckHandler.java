package com.birthdayreminder.scheduler.application.service;

import com.birthdayreminder.scheduler.application.config.ReminderProperties;
import com.birthdayreminder.scheduler.domain.reminder.BirthdayReminderScanner;
import com.birthdayreminder.scheduler.domain.reminder.ScanSummary;
import io.micrometer.core.instrument.Counter;
import java.time.Clock;
import java.time.LocalDate;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/** Runs one birthday check for the current day in the configured zone and records metrics. */
@Component
@RequiredArgsConstructor
public class BirthdayCheckHandler {

    private final BirthdayReminderScanner scanner;
    private final ReminderProperties properties;
    private final Clock clock;
    private final Counter remindersCreatedCounter;
    private final Counter remindersDeduplicatedCounter;
    private final Counter checksCompletedCounter;
    private final Counter checksFailedCounter;

    public ScanSummary runCheck() {
        var now = clock.instant();
        var today = LocalDate.ofInstant(now, properties.schedule().zoneId());
        var summary = scanner.scan(today, now);

        remindersCreatedCounter.increment(summary.remindersCreated());
        remindersDeduplicatedCounter.increment(summary.duplicatesSkipped());
        if (summary.outcome() == ScanSummary.Outcome.COMPLETED) {
            checksCompletedCounter.increment();
        } else if (summary.aborted()) {
            checksFailedCounter.increment();
        }
        return summary;
    }
}
