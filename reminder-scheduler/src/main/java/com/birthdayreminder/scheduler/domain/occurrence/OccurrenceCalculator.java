package com.birthdayreminder.scheduler.domain.occurrence;

import java.time.LocalDate;
import java.time.MonthDay;
import java.time.temporal.ChronoUnit;
import lombok.AccessLevel;
import lombok.NoArgsConstructor;

/**
 * Computes when a recurring month/day next comes around.
 *
 * <p>The occurrence is the month/day placed in the reference year, moved one year ahead when it
 * is already behind {@code today}. A 29 February in a non-leap year falls on 28 February
 * ({@link MonthDay#atYear(int)} semantics).
 */
@NoArgsConstructor(access = AccessLevel.PRIVATE)
public final class OccurrenceCalculator {

    public static Occurrence nextOccurrence(MonthDay recurring, LocalDate today) {
        var next = recurring.atYear(today.getYear());
        if (next.isBefore(today)) {
            next = recurring.atYear(today.getYear() + 1);
        }
        return new Occurrence(next, (int) ChronoUnit.DAYS.between(today, next));
    }

    public static Occurrence nextOccurrence(LocalDate date, LocalDate today) {
        return nextOccurrence(MonthDay.from(date), today);
    }
}
