package com.birthdayreminder.scheduler.application.config;

import java.time.Clock;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

@Configuration
@EnableConfigurationProperties(ReminderProperties.class)
public class ReminderConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    /** Single thread: checks never overlap. */
    @Bean
    public TaskScheduler birthdayCheckTaskScheduler(Clock clock) {
        var scheduler = new ThreadPoolTaskScheduler();
        scheduler.setPoolSize(1);
        scheduler.setThreadNamePrefix("birthday-check-");
        scheduler.setClock(clock);
        scheduler.setWaitForTasksToCompleteOnShutdown(false);
        return scheduler;
    }
}
