package com.birthdayreminder.scheduler.application.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import java.time.Duration;
import java.time.ZoneId;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

@Validated
@ConfigurationProperties(prefix = "reminder")
public record ReminderProperties(@NotNull @Valid Schedule schedule) {

    /**
     * @param triggerHour hour of day, in {@code zone}, of the daily check
     * @param period step between checks when not realigning
     * @param realignDaily recompute the next trigger hour each day instead of adding {@code period}
     */
    public record Schedule(
            boolean enabled,
            @Min(0) @Max(23) int triggerHour,
            @NotBlank String zone,
            @NotNull Duration period,
            boolean realignDaily) {

        public ZoneId zoneId() {
            return ZoneId.of(zone);
        }
    }
}
