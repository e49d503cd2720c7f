package com.example.commitnotifier.service.scheduler;

import com.example.commitnotifier.config.GitHubProperties;
import com.example.commitnotifier.config.MetricsConfig;
import com.example.commitnotifier.config.SchedulerProperties;
import com.example.commitnotifier.config.TelegramProperties;
import com.example.commitnotifier.domain.entity.TrackedRepository;
import com.example.commitnotifier.dto.SchedulerStats;
import com.example.commitnotifier.exception.SchedulerLockException;
import com.example.commitnotifier.service.TrackedRepositoryService;
import com.example.commitnotifier.service.alert.SlackAlertService;
import com.example.commitnotifier.service.lock.SchedulerLock;
import com.example.commitnotifier.service.retry.RetryPolicy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.env.Environment;
import org.springframework.core.env.Profiles;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Drives periodic notification cycles over the due repositories.
 * <p>
 * Cycles never overlap: within the process an atomic flag guards entry, across
 * processes the {@link SchedulerLock} does. Repositories of a cycle are processed
 * one after another, oldest-due first, each with its own retry budget.
 * <p>
 * Flow of one cycle:
 * 1. Skip if shutting down or a cycle is already running here
 * 2. Acquire the cluster-wide lock, or skip
 * 3. Load the due repositories
 * 4. Process each one with retry, stopping early on shutdown or when the lock is lost
 * 5. Release the lock
 * <p>
 * No failure escapes a cycle; errors are logged, counted and alerted.
 */
@Slf4j
@Service
public class NotificationScheduler {

    static final String PRODUCTION_PROFILE = "production";

    private final TrackedRepositoryService repositoryService;
    private final RepositoryNotificationProcessor processor;
    private final SchedulerLock schedulerLock;
    private final RetryPolicy retryPolicy;
    private final SlackAlertService alertService;
    private final MetricsConfig metrics;
    private final SchedulerProperties properties;
    private final GitHubProperties gitHubProperties;
    private final TelegramProperties telegramProperties;
    private final Environment environment;
    private final TaskScheduler taskScheduler;
    private final Clock clock;

    private final AtomicBoolean cycleRunning = new AtomicBoolean(false);
    private volatile boolean shuttingDown = false;
    private ScheduledFuture<?> trigger;

    // Stats
    private final AtomicReference<Instant> lastRunTime = new AtomicReference<>();
    private final AtomicReference<Long> lastRunDurationMs = new AtomicReference<>();
    private final AtomicLong totalCycles = new AtomicLong();
    private final AtomicLong totalReposProcessed = new AtomicLong();
    private final AtomicLong totalNotificationsSent = new AtomicLong();
    private final AtomicLong totalErrors = new AtomicLong();

    public NotificationScheduler(TrackedRepositoryService repositoryService,
                                 RepositoryNotificationProcessor processor,
                                 SchedulerLock schedulerLock,
                                 RetryPolicy retryPolicy,
                                 SlackAlertService alertService,
                                 MetricsConfig metrics,
                                 SchedulerProperties properties,
                                 GitHubProperties gitHubProperties,
                                 TelegramProperties telegramProperties,
                                 Environment environment,
                                 @Qualifier("notificationTaskScheduler") TaskScheduler taskScheduler,
                                 Clock clock) {
        this.repositoryService = repositoryService;
        this.processor = processor;
        this.schedulerLock = schedulerLock;
        this.retryPolicy = retryPolicy;
        this.alertService = alertService;
        this.metrics = metrics;
        this.properties = properties;
        this.gitHubProperties = gitHubProperties;
        this.telegramProperties = telegramProperties;
        this.environment = environment;
        this.taskScheduler = taskScheduler;
        this.clock = clock;
    }

    // === Lifecycle ===

    /**
     * Schedule the recurring trigger and run one cycle right away.
     *
     * @return true if the scheduler is running after the call
     */
    public boolean start() {
        synchronized (this) {
            if (trigger != null) {
                log.debug("Notification scheduler already started");
                return true;
            }

            if (!isEnabled()) {
                log.info("Notification scheduler disabled by configuration");
                return false;
            }

            if (!gitHubProperties.hasToken() || !telegramProperties.isConfigured()) {
                log.warn("Notification scheduler not started: GitHub token, Telegram bot token or chat id is missing");
                return false;
            }

            shuttingDown = false;
            var period = Duration.ofMillis(properties.getPollIntervalMs());
            trigger = taskScheduler.scheduleAtFixedRate(this::runCycle, clock.instant().plus(period), period);
            log.info("Notification scheduler started with {}s polling interval", period.toSeconds());
        }

        runCycle();
        return true;
    }

    /**
     * Cancel the trigger and wait (bounded) for an in-flight cycle to finish.
     * The running cycle is not interrupted; it stops between repositories.
     */
    public void stop() {
        log.info("Notification scheduler shutdown initiated");
        shuttingDown = true;

        synchronized (this) {
            if (trigger != null) {
                trigger.cancel(false);
                trigger = null;
            }
        }

        var deadline = System.nanoTime() + Duration.ofMillis(properties.getShutdownTimeoutMs()).toNanos();
        while (cycleRunning.get() && System.nanoTime() < deadline) {
            try {
                Thread.sleep(properties.getShutdownPollIntervalMs());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                break;
            }
        }

        if (cycleRunning.get()) {
            log.warn("Notification cycle still running after {}ms, shutting down anyway", properties.getShutdownTimeoutMs());
        } else {
            log.info("Notification scheduler shutdown complete");
        }
    }

    public synchronized boolean isStarted() {
        return trigger != null;
    }

    /**
     * Explicit property wins; otherwise only the production profile runs the scheduler
     */
    boolean isEnabled() {
        if (properties.getEnabled() != null) {
            return properties.getEnabled();
        }
        return environment.acceptsProfiles(Profiles.of(PRODUCTION_PROFILE));
    }

    // === Cycle ===

    /**
     * Run one notification cycle on the calling thread, subject to the same guards as the trigger
     */
    public void runCycle() {
        if (shuttingDown) {
            log.debug("Shutdown in progress, skipping cycle");
            return;
        }

        if (!cycleRunning.compareAndSet(false, true)) {
            log.debug("Previous notification cycle still running, skipping");
            return;
        }

        var lockAcquired = false;
        try {
            try {
                lockAcquired = schedulerLock.tryAcquire();
            } catch (SchedulerLockException e) {
                log.error("Failed to acquire scheduler lock: {}", e.getMessage(), e);
                return;
            }

            if (!lockAcquired) {
                log.info("Another instance is running a notification cycle, skipping");
                return;
            }

            executeCycle();
        } finally {
            if (lockAcquired) {
                try {
                    schedulerLock.release();
                } catch (Exception e) {
                    log.error("Failed to release scheduler lock: {}", e.getMessage(), e);
                }
            }
            cycleRunning.set(false);
        }
    }

    private void executeCycle() {
        var cycleStart = clock.instant();
        var sample = metrics.startCycleTimer();
        var outcome = "completed";

        try {
            var repositories = repositoryService.findDue(cycleStart);

            if (!repositories.isEmpty()) {
                log.info("Processing {} repositories due for notification", repositories.size());
            } else {
                log.debug("No repositories due for notification");
            }

            var processed = 0;
            for (var repository : repositories) {
                if (shuttingDown) {
                    log.info("Shutdown requested, stopping cycle after {} of {} repositories",
                            processed, repositories.size());
                    outcome = "interrupted";
                    break;
                }

                if (!schedulerLock.isHeld()) {
                    log.warn("Scheduler lock lost, stopping cycle after {} of {} repositories",
                            processed, repositories.size());
                    outcome = "lock_lost";
                    break;
                }

                processWithRetry(repository);
                processed++;
            }

            totalCycles.incrementAndGet();
            lastRunTime.set(clock.instant());
            lastRunDurationMs.set(Duration.between(cycleStart, clock.instant()).toMillis());
        } catch (Exception e) {
            outcome = "failed";
            log.error("Error in notification cycle: {}", e.getMessage(), e);
            totalErrors.incrementAndGet();
            metrics.recordError("cycle");
            alertService.sendErrorAlert("Notification cycle failed", e.getMessage(), e.getClass().getName());
        } finally {
            metrics.recordCycle(sample, outcome);
        }
    }

    private void processWithRetry(TrackedRepository repository) {
        var result = new AtomicReference<RepositoryProcessingResult>();

        try {
            retryPolicy.execute(repository.getRepoString(), () -> result.set(processor.process(repository)));
        } catch (Exception e) {
            log.error("All {} attempts failed for {}: {}",
                    retryPolicy.getMaxAttempts(), repository.getRepoString(), e.getMessage());
            totalErrors.incrementAndGet();
            metrics.recordError("repository");
            alertService.sendRetriesExhaustedAlert(repository, retryPolicy.getMaxAttempts(), e.getMessage());
            return;
        }

        var outcome = result.get();
        totalReposProcessed.incrementAndGet();
        totalNotificationsSent.addAndGet(outcome.getMessagesSent());
        metrics.recordRepositoryProcessed(outcome.getMessagesSent());
    }

    // === Stats ===

    public SchedulerStats getStats() {
        return SchedulerStats.builder()
                .running(cycleRunning.get())
                .lastRunTime(lastRunTime.get())
                .lastRunDurationMs(lastRunDurationMs.get())
                .totalCycles(totalCycles.get())
                .totalReposProcessed(totalReposProcessed.get())
                .totalNotificationsSent(totalNotificationsSent.get())
                .totalErrors(totalErrors.get())
                .build();
    }
}
