package com.birthdayreminder.scheduler.domain.birthday;

import com.birthdayreminder.scheduler.domain.exceptions.MalformedBirthdayException;
import java.time.Instant;
import java.time.LocalDate;
import java.time.MonthDay;
import lombok.Builder;

@Builder(toBuilder = true)
public record Birthday(
        String id,
        String userId,
        String name,
        LocalDate date,
        String relationship,
        String notes,
        String image,
        Integer notifyBefore,
        boolean allowNotifications,
        Instant createdAt,
        Instant updatedAt
) {

    /** Month and day the birthday recurs on; the stored year is ignored. */
    public MonthDay recurringDate() {
        if (date == null) {
            throw MalformedBirthdayException.missingDate(id);
        }
        return MonthDay.from(date);
    }
}
