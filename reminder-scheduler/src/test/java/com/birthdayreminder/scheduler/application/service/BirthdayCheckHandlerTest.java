package com.birthdayreminder.scheduler.application.service;

import static com.birthdayreminder.scheduler.test.fixtures.BirthdayFixtures.SOME_NOW;
import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.BDDMockito.given;
import static org.mockito.BDDMockito.then;

import com.birthdayreminder.scheduler.application.config.ReminderProperties;
import com.birthdayreminder.scheduler.domain.reminder.BirthdayReminderScanner;
import com.birthdayreminder.scheduler.domain.reminder.ScanSummary;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class BirthdayCheckHandlerTest {

    @Mock
    BirthdayReminderScanner scanner;

    SimpleMeterRegistry registry;
    Counter created;
    Counter deduplicated;
    Counter completed;
    Counter failed;

    @BeforeEach
    void setUp() {
        registry = new SimpleMeterRegistry();
        created = registry.counter("birthday.reminders.created");
        deduplicated = registry.counter("birthday.reminders.deduplicated");
        completed = registry.counter("birthday.checks.completed");
        failed = registry.counter("birthday.checks.failed");
    }

    @Test
    void shouldScanTodayOfConfiguredZone() {
        // given (23:30 UTC on the 9th is already the 10th in Auckland)
        var now = Instant.parse("2024-03-09T23:30:00Z");
        var handler = handler("Pacific/Auckland", now);
        given(scanner.scan(LocalDate.of(2024, 3, 10), now)).willReturn(completed(now, 0, 0));

        // when
        handler.runCheck();

        // then
        then(scanner).should().scan(LocalDate.of(2024, 3, 10), now);
    }

    @Test
    void shouldRecordCountersForCompletedCheck() {
        // given
        var handler = handler("UTC", SOME_NOW);
        var summary = completed(SOME_NOW, 3, 2);
        given(scanner.scan(LocalDate.of(2024, 3, 10), SOME_NOW)).willReturn(summary);

        // when
        var result = handler.runCheck();

        // then
        assertThat(result).isEqualTo(summary);
        assertThat(created.count()).isEqualTo(3.0);
        assertThat(deduplicated.count()).isEqualTo(2.0);
        assertThat(completed.count()).isEqualTo(1.0);
        assertThat(failed.count()).isZero();
    }

    @Test
    void shouldCountAbortedCheckAsFailedAndKeepPartialReminders() {
        // given
        var handler = handler("UTC", SOME_NOW);
        var summary = new ScanSummary(SOME_NOW, ScanSummary.Outcome.ABORTED, 1, 2, 1, 0);
        given(scanner.scan(LocalDate.of(2024, 3, 10), SOME_NOW)).willReturn(summary);

        // when
        handler.runCheck();

        // then
        assertThat(created.count()).isEqualTo(1.0);
        assertThat(failed.count()).isEqualTo(1.0);
        assertThat(completed.count()).isZero();
    }

    @Test
    void shouldNotCountSkippedCheck() {
        // given
        var handler = handler("UTC", SOME_NOW);
        given(scanner.scan(LocalDate.of(2024, 3, 10), SOME_NOW)).willReturn(ScanSummary.skipped(SOME_NOW));

        // when
        handler.runCheck();

        // then
        assertThat(completed.count()).isZero();
        assertThat(failed.count()).isZero();
        assertThat(created.count()).isZero();
    }

    private BirthdayCheckHandler handler(String zone, Instant now) {
        var properties = new ReminderProperties(
                new ReminderProperties.Schedule(true, 8, zone, Duration.ofHours(24), false));
        return new BirthdayCheckHandler(
                scanner, properties, Clock.fixed(now, ZoneOffset.UTC), created, deduplicated, completed, failed);
    }

    private static ScanSummary completed(Instant startedAt, int remindersCreated, int duplicatesSkipped) {
        return new ScanSummary(
                startedAt, ScanSummary.Outcome.COMPLETED, 1, remindersCreated + duplicatesSkipped,
                remindersCreated, duplicatesSkipped);
    }
}
