package com.birthdayreminder.scheduler.domain.reminder;

import java.util.List;
import lombok.AccessLevel;
import lombok.NoArgsConstructor;

/** Day-counts before a birthday that produce a reminder. Only exact matches count. */
@NoArgsConstructor(access = AccessLevel.PRIVATE)
public final class AlertWindows {

    public static final List<Integer> DAYS_BEFORE = List.of(7, 3, 1, 0);

    public static boolean matches(int daysUntil) {
        return DAYS_BEFORE.contains(daysUntil);
    }
}
