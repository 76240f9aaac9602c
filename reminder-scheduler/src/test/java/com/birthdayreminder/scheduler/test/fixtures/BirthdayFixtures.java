package com.birthdayreminder.scheduler.test.fixtures;

import com.birthdayreminder.scheduler.domain.birthday.Birthday;
import java.time.Instant;
import java.time.LocalDate;
import lombok.AccessLevel;
import lombok.NoArgsConstructor;

@NoArgsConstructor(access = AccessLevel.PRIVATE)
public final class BirthdayFixtures {

    public static final String SOME_USER_ID = "01HRZ0000000000000000USER1";
    public static final String SOME_OTHER_USER_ID = "01HRZ0000000000000000USER2";
    public static final String SOME_BIRTHDAY_ID = "01HRZ000000000000000BDAY01";
    public static final String SOME_OTHER_BIRTHDAY_ID = "01HRZ000000000000000BDAY02";
    public static final String SOME_NAME = "Alice";

    /** 2024-03-10 08:00 UTC, seven days before a 17 March birthday. */
    public static final LocalDate SOME_TODAY = LocalDate.of(2024, 3, 10);
    public static final Instant SOME_NOW = Instant.parse("2024-03-10T08:00:00Z");

    public static Birthday.BirthdayBuilder birthdayBuilder() {
        return Birthday.builder()
                .id(SOME_BIRTHDAY_ID)
                .userId(SOME_USER_ID)
                .name(SOME_NAME)
                .date(LocalDate.of(1990, 3, 17))
                .relationship("friend")
                .notes("")
                .notifyBefore(7)
                .allowNotifications(true)
                .createdAt(Instant.parse("2024-01-01T00:00:00Z"))
                .updatedAt(Instant.parse("2024-01-01T00:00:00Z"));
    }

    public static Birthday birthdayOn(String id, int month, int day) {
        return birthdayBuilder().id(id).date(LocalDate.of(1990, month, day)).build();
    }
}
