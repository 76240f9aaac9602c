package com.birthdayreminder.scheduler.application.job;

import com.birthdayreminder.scheduler.application.config.ReminderProperties;
import com.birthdayreminder.scheduler.application.service.BirthdayCheckHandler;
import java.time.Clock;
import java.time.Duration;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.atomic.AtomicReference;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.SmartLifecycle;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.stereotype.Component;

/**
 * Daily birthday check: waits for the first trigger hour, then repeats for the life of the
 * process. A failing check is logged and the schedule carries on.
 */
@Slf4j
@Component
@RequiredArgsConstructor
@ConditionalOnProperty(name = "reminder.schedule.enabled", havingValue = "true", matchIfMissing = true)
public class BirthdayCheckScheduler implements SmartLifecycle {

    private final BirthdayCheckHandler checkHandler;
    private final TaskScheduler birthdayCheckTaskScheduler;
    private final ReminderProperties properties;
    private final Clock clock;

    private final AtomicReference<SchedulerState> state = new AtomicReference<>(SchedulerState.STOPPED);
    private ScheduledFuture<?> scheduledCheck;

    @Override
    public synchronized void start() {
        if (state.get() != SchedulerState.STOPPED) {
            return;
        }
        var schedule = properties.schedule();
        var trigger = new DailyCheckTrigger(
                schedule.triggerHour(), schedule.zoneId(), schedule.period(), schedule.realignDaily());
        var now = clock.instant();
        var firstRun = trigger.firstExecution(now);

        state.set(SchedulerState.WAITING);
        scheduledCheck = birthdayCheckTaskScheduler.schedule(this::runScheduledCheck, trigger);
        log.info("Scheduling birthday checks to run daily at {}:00 {}. First run in {} minutes",
                String.format("%02d", schedule.triggerHour()),
                schedule.zone(),
                Duration.between(now, firstRun).toMinutes());
    }

    @Override
    public synchronized void stop() {
        if (scheduledCheck != null) {
            scheduledCheck.cancel(false);
            scheduledCheck = null;
        }
        if (state.getAndSet(SchedulerState.STOPPED) != SchedulerState.STOPPED) {
            log.info("Birthday check scheduler stopped");
        }
    }

    @Override
    public boolean isRunning() {
        return state.get() != SchedulerState.STOPPED;
    }

    public SchedulerState state() {
        return state.get();
    }

    void runScheduledCheck() {
        if (state.compareAndSet(SchedulerState.WAITING, SchedulerState.RUNNING)) {
            log.info("First birthday check triggered, repeating every {}",
                    properties.schedule().realignDaily() ? "day" : properties.schedule().period());
        }
        try {
            checkHandler.runCheck();
        } catch (RuntimeException e) {
            log.error("Birthday check failed outside the scan, next run stays scheduled", e);
        }
    }
}
