package com.birthdayreminder.scheduler.application.config;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class MetricsConfig {

    @Bean
    public Counter remindersCreatedCounter(MeterRegistry registry) {
        return Counter.builder("birthday.reminders.created")
                .description("Birthday reminder notifications created")
                .register(registry);
    }

    @Bean
    public Counter remindersDeduplicatedCounter(MeterRegistry registry) {
        return Counter.builder("birthday.reminders.deduplicated")
                .description("Birthday reminders suppressed by the 48h lookback")
                .register(registry);
    }

    @Bean
    public Counter checksCompletedCounter(MeterRegistry registry) {
        return Counter.builder("birthday.checks.completed")
                .description("Birthday checks that scanned every account")
                .register(registry);
    }

    @Bean
    public Counter checksFailedCounter(MeterRegistry registry) {
        return Counter.builder("birthday.checks.failed")
                .description("Birthday checks aborted by an error")
                .register(registry);
    }
}
