package com.birthdayreminder.scheduler.domain.occurrence;

import java.time.LocalDate;

/** Next yearly occurrence of a recurring date, seen from a reference day. */
public record Occurrence(LocalDate nextOccurrence, int daysUntil) {
}
