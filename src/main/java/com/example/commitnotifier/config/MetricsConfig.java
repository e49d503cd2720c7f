package com.example.commitnotifier.config;

import com.example.commitnotifier.domain.repository.TrackedRepositoryRepository;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.Scheduled;

import java.time.Clock;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Metrics for monitoring notification delivery.
 * <p>
 * Exposes Prometheus metrics for:
 * - Tracked and currently due repositories
 * - Cycle durations
 * - Repositories processed, messages sent and errors
 */
@Configuration
@RequiredArgsConstructor
public class MetricsConfig {

    private static final String PREFIX = "commit_notifier_";

    private final MeterRegistry meterRegistry;
    private final TrackedRepositoryRepository repositoryRepository;
    private final Clock clock;

    private final AtomicLong trackedRepositories = new AtomicLong(0);
    private final AtomicLong dueRepositories = new AtomicLong(0);

    @PostConstruct
    public void initializeMetrics() {
        Gauge.builder(PREFIX + "repositories", trackedRepositories, AtomicLong::get)
                .description("Number of tracked repositories")
                .register(meterRegistry);

        Gauge.builder(PREFIX + "repositories_due", dueRepositories, AtomicLong::get)
                .description("Number of repositories whose next check time has passed")
                .register(meterRegistry);
    }

    /**
     * Periodically refresh gauges from the database
     */
    @Scheduled(fixedDelayString = "${commit-notifier.metrics-update-interval-ms:60000}")
    public void updateMetrics() {
        trackedRepositories.set(repositoryRepository.count());
        dueRepositories.set(repositoryRepository.countByNextCheckTimeLessThanEqual(clock.instant()));
    }

    public Timer.Sample startCycleTimer() {
        return Timer.start(meterRegistry);
    }

    public void recordCycle(Timer.Sample sample, String outcome) {
        sample.stop(Timer.builder(PREFIX + "cycle_duration")
                .tag("outcome", outcome)
                .description("Notification cycle duration")
                .register(meterRegistry));
    }

    public void recordRepositoryProcessed(int messagesSent) {
        meterRegistry.counter(PREFIX + "repositories_processed").increment();
        if (messagesSent > 0) {
            meterRegistry.counter(PREFIX + "notifications_sent").increment(messagesSent);
        }
    }

    /**
     * Record a repository or cycle failure
     */
    public void recordError(String stage) {
        meterRegistry.counter(PREFIX + "errors", "stage", stage).increment();
    }
}
