package com.example.commitnotifier.config;

import com.example.commitnotifier.service.retry.RetryPolicy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

import java.time.Clock;
import java.time.Duration;

/**
 * Configuration for the threads that drive notification cycles.
 * <p>
 * The recurring cycle trigger and the @Scheduled ledger cleanup share one small
 * scheduler pool. Cycles never overlap within a process: the scheduler guards
 * its own entry, so a second thread only lets the cleanup job run while a long
 * cycle is in progress.
 */
@Slf4j
@Configuration
public class SchedulerConfig {

    @Bean(name = "notificationTaskScheduler")
    public ThreadPoolTaskScheduler notificationTaskScheduler() {
        log.info("Creating notification task scheduler");

        var scheduler = new ThreadPoolTaskScheduler();
        scheduler.setPoolSize(2);
        scheduler.setThreadNamePrefix("notification-scheduler-");
        scheduler.setErrorHandler(t -> log.error("Unhandled error in scheduled job: {}", t.getMessage(), t));
        // Draining is done by NotificationScheduler.stop(), not by the executor
        scheduler.setWaitForTasksToCompleteOnShutdown(false);
        scheduler.initialize();

        return scheduler;
    }

    /**
     * Attempt budget and backoff for one repository within a cycle
     */
    @Bean
    public RetryPolicy repositoryRetryPolicy(SchedulerProperties properties) {
        return new RetryPolicy(
                properties.getMaxRetries(),
                Duration.ofMillis(properties.getRetryBaseDelayMs()),
                Duration.ofMillis(properties.getRetryMaxDelayMs()));
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }
}
