package com.example.commitnotifier.config;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

/**
 * Configuration properties for the notification scheduler.
 * Loaded from application.yml.
 */
@Data
@Validated
@Configuration
@ConfigurationProperties(prefix = "commit-notifier.scheduler")
public class SchedulerProperties {

    /**
     * Explicit on/off switch. When unset the scheduler only runs with the "production" profile.
     */
    private Boolean enabled;

    /**
     * Polling interval in milliseconds between notification cycles
     */
    @Min(1000)
    private long pollIntervalMs = 300_000;

    /**
     * Attempts per repository before the cycle gives up on it
     */
    @Min(1)
    private int maxRetries = 3;

    /**
     * Backoff before the second attempt; doubles for each further attempt
     */
    @Min(1)
    private long retryBaseDelayMs = 1000;

    /**
     * Upper bound for a single backoff delay
     */
    @Min(1)
    private long retryMaxDelayMs = 8000;

    /**
     * Maximum commits fetched per repository per attempt
     */
    @Min(1)
    private int maxCommitsPerFetch = 100;

    /**
     * How long stop() waits for an in-flight cycle
     */
    @Min(0)
    private long shutdownTimeoutMs = 30_000;

    @Min(1)
    private long shutdownPollIntervalMs = 100;

    /**
     * Name of the cluster-wide scheduler lock
     */
    @NotNull
    private String lockName = "notification_scheduler";

    /**
     * Upper bound on how long a crashed instance can keep the lock
     */
    @NotNull
    private Duration lockAtMostFor = Duration.ofMinutes(10);
}
