package com.birthdayreminder.scheduler.domain.reminder;

import java.time.Instant;

public record ScanSummary(
        Instant startedAt,
        Outcome outcome,
        int accountsScanned,
        int birthdaysChecked,
        int remindersCreated,
        int duplicatesSkipped
) {

    public enum Outcome {
        COMPLETED,
        ABORTED,
        SKIPPED
    }

    public static ScanSummary skipped(Instant startedAt) {
        return new ScanSummary(startedAt, Outcome.SKIPPED, 0, 0, 0, 0);
    }

    public boolean aborted() {
        return outcome == Outcome.ABORTED;
    }
}
