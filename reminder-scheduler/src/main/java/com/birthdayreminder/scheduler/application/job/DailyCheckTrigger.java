package com.birthdayreminder.scheduler.application.job;

import java.time.Duration;
import java.time.Instant;
import java.time.LocalTime;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import org.springframework.scheduling.Trigger;
import org.springframework.scheduling.TriggerContext;

/**
 * First run at the next trigger hour (today if not yet passed, otherwise tomorrow), then either a
 * fixed period after each scheduled run or, when realigning, the trigger hour of the following
 * local day. The next run never depends on how the previous one ended.
 */
public class DailyCheckTrigger implements Trigger {

    private final LocalTime triggerTime;
    private final ZoneId zone;
    private final Duration period;
    private final boolean realignDaily;

    public DailyCheckTrigger(int triggerHour, ZoneId zone, Duration period, boolean realignDaily) {
        this.triggerTime = LocalTime.of(triggerHour, 0);
        this.zone = zone;
        this.period = period;
        this.realignDaily = realignDaily;
    }

    @Override
    public Instant nextExecution(TriggerContext context) {
        var lastScheduled = context.lastScheduledExecution();
        if (lastScheduled == null) {
            return firstExecution(context.getClock().instant());
        }
        if (realignDaily) {
            var lastDay = ZonedDateTime.ofInstant(lastScheduled, zone).toLocalDate();
            return lastDay.plusDays(1).atTime(triggerTime).atZone(zone).toInstant();
        }
        return lastScheduled.plus(period);
    }

    public Instant firstExecution(Instant now) {
        var today = ZonedDateTime.ofInstant(now, zone).toLocalDate();
        var todayAtTrigger = today.atTime(triggerTime).atZone(zone).toInstant();
        if (now.isAfter(todayAtTrigger)) {
            return today.plusDays(1).atTime(triggerTime).atZone(zone).toInstant();
        }
        return todayAtTrigger;
    }
}
