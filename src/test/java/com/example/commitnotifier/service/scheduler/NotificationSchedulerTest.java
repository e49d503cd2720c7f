package com.example.commitnotifier.service.scheduler;

import com.example.commitnotifier.config.GitHubProperties;
import com.example.commitnotifier.config.MetricsConfig;
import com.example.commitnotifier.config.SchedulerProperties;
import com.example.commitnotifier.config.TelegramProperties;
import com.example.commitnotifier.domain.entity.TrackedRepository;
import com.example.commitnotifier.exception.ExternalServiceException;
import com.example.commitnotifier.exception.SchedulerLockException;
import com.example.commitnotifier.service.TrackedRepositoryService;
import com.example.commitnotifier.service.alert.SlackAlertService;
import com.example.commitnotifier.service.lock.SchedulerLock;
import com.example.commitnotifier.service.retry.RetryPolicy;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.mock.env.MockEnvironment;
import org.springframework.scheduling.TaskScheduler;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;
import java.util.stream.LongStream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
@DisplayName("NotificationScheduler Tests")
class NotificationSchedulerTest {

    private static final Instant NOW = Instant.parse("2024-05-01T10:00:00Z");

    @Mock
    private TrackedRepositoryService repositoryService;

    @Mock
    private RepositoryNotificationProcessor processor;

    @Mock
    private SlackAlertService alertService;

    @Mock
    private MetricsConfig metrics;

    @Mock
    private TaskScheduler taskScheduler;

    @Mock
    private ScheduledFuture<?> scheduledFuture;

    private SchedulerProperties properties;
    private GitHubProperties gitHubProperties;
    private TelegramProperties telegramProperties;
    private MockEnvironment environment;
    private InMemorySchedulerLock lock;
    private NotificationScheduler scheduler;

    @BeforeEach
    void setUp() {
        properties = new SchedulerProperties();
        properties.setEnabled(true);
        properties.setPollIntervalMs(300_000);
        properties.setShutdownTimeoutMs(1000);
        properties.setShutdownPollIntervalMs(5);

        gitHubProperties = new GitHubProperties();
        gitHubProperties.setToken("gh-token");
        telegramProperties = new TelegramProperties();
        telegramProperties.setBotToken("bot-token");
        telegramProperties.setChatId("-100123");

        environment = new MockEnvironment();
        lock = new InMemorySchedulerLock(new AtomicReference<>());
        scheduler = newScheduler(lock, repositoryService, processor);
    }

    private NotificationScheduler newScheduler(SchedulerLock schedulerLock,
                                               TrackedRepositoryService repositories,
                                               RepositoryNotificationProcessor repositoryProcessor) {
        return new NotificationScheduler(
                repositories,
                repositoryProcessor,
                schedulerLock,
                new RetryPolicy(3, Duration.ofMillis(1), Duration.ofMillis(4)),
                alertService,
                metrics,
                properties,
                gitHubProperties,
                telegramProperties,
                environment,
                taskScheduler,
                Clock.fixed(NOW, ZoneOffset.UTC));
    }

    private static TrackedRepository repository(long id) {
        return TrackedRepository.builder()
                .id(id)
                .repoString("acme/repo-" + id)
                .owner("acme")
                .repo("repo-" + id)
                .nextCheckTime(NOW.minusSeconds(60))
                .build();
    }

    private static RepositoryProcessingResult sent(int messages) {
        return RepositoryProcessingResult.builder()
                .commitsFetched(messages)
                .newCommits(messages)
                .messagesSent(messages)
                .scheduleAdvanced(true)
                .build();
    }

    @Nested
    @DisplayName("runCycle Tests")
    class RunCycleTests {

        @Test
        @DisplayName("Should process every due repository and update statistics")
        void shouldProcessDueRepositories() {
            // Given
            var first = repository(1);
            var second = repository(2);
            when(repositoryService.findDue(NOW)).thenReturn(List.of(first, second));
            when(processor.process(first)).thenReturn(sent(2));
            when(processor.process(second)).thenReturn(sent(0));

            // When
            scheduler.runCycle();

            // Then
            var inOrder = inOrder(processor);
            inOrder.verify(processor).process(first);
            inOrder.verify(processor).process(second);

            var stats = scheduler.getStats();
            assertThat(stats.isRunning()).isFalse();
            assertThat(stats.getTotalCycles()).isEqualTo(1);
            assertThat(stats.getTotalReposProcessed()).isEqualTo(2);
            assertThat(stats.getTotalNotificationsSent()).isEqualTo(2);
            assertThat(stats.getTotalErrors()).isZero();
            assertThat(stats.getLastRunTime()).isEqualTo(NOW);
            assertThat(stats.getLastRunDurationMs()).isZero();
            assertThat(lock.isHeld()).isFalse();
            verify(metrics).recordRepositoryProcessed(2);
            verify(metrics).recordRepositoryProcessed(0);
        }

        @Test
        @DisplayName("Should skip cycle without side effects when lock is held elsewhere")
        void shouldSkipWhenLockHeldElsewhere() {
            // Given
            var otherInstance = new InMemorySchedulerLock(lock.owner);
            assertThat(otherInstance.tryAcquire()).isTrue();

            // When
            scheduler.runCycle();

            // Then
            verifyNoInteractions(repositoryService, processor);
            assertThat(scheduler.getStats().getTotalCycles()).isZero();
            assertThat(lock.owner.get()).isSameAs(otherInstance);
        }

        @Test
        @DisplayName("Should abort cycle when the lock store is unreachable")
        void shouldAbortWhenLockStoreUnreachable() {
            // Given
            var failingLock = mock(SchedulerLock.class);
            when(failingLock.tryAcquire())
                    .thenThrow(new SchedulerLockException("notification_scheduler", new RuntimeException("connection refused")))
                    .thenReturn(true);
            var failingScheduler = newScheduler(failingLock, repositoryService, processor);
            when(repositoryService.findDue(NOW)).thenReturn(List.of());

            // When
            failingScheduler.runCycle();

            // Then
            verifyNoInteractions(repositoryService);
            verify(failingLock, never()).release();
            assertThat(failingScheduler.getStats().getTotalErrors()).isZero();

            // And the guard is cleared for the next cycle
            failingScheduler.runCycle();
            verify(repositoryService).findDue(NOW);
            verify(failingLock).release();
        }

        @Test
        @DisplayName("Should count error, alert and still release the lock when due query fails")
        void shouldReleaseLockWhenDueQueryFails() {
            // Given
            when(repositoryService.findDue(NOW)).thenThrow(new IllegalStateException("database unavailable"));

            // When
            scheduler.runCycle();

            // Then
            assertThat(lock.isHeld()).isFalse();
            assertThat(lock.releases).hasValue(1);
            assertThat(scheduler.getStats().getTotalErrors()).isEqualTo(1);
            assertThat(scheduler.getStats().getTotalCycles()).isZero();
            assertThat(scheduler.getStats().isRunning()).isFalse();
            verify(alertService).sendErrorAlert(eq("Notification cycle failed"), eq("database unavailable"), anyString());
            verify(metrics).recordError("cycle");
        }

        @Test
        @DisplayName("Should skip a nested cycle while one is running in this process")
        void shouldSkipReentrantCycle() {
            // Given
            var repo = repository(1);
            when(repositoryService.findDue(NOW)).thenReturn(List.of(repo));
            when(processor.process(repo)).thenAnswer(invocation -> {
                scheduler.runCycle();
                return sent(1);
            });

            // When
            scheduler.runCycle();

            // Then
            verify(repositoryService, times(1)).findDue(NOW);
            verify(processor, times(1)).process(repo);
            assertThat(scheduler.getStats().getTotalCycles()).isEqualTo(1);
        }

        @Test
        @DisplayName("Should stop between repositories when shutdown is requested")
        void shouldStopMidLoopOnShutdown() {
            // Given
            properties.setShutdownTimeoutMs(0);
            var repositories = LongStream.rangeClosed(1, 10).mapToObj(NotificationSchedulerTest::repository).toList();
            when(repositoryService.findDue(NOW)).thenReturn(repositories);
            var calls = new AtomicInteger();
            when(processor.process(any())).thenAnswer(invocation -> {
                if (calls.incrementAndGet() == 3) {
                    scheduler.stop();
                }
                return sent(1);
            });

            // When
            scheduler.runCycle();

            // Then
            verify(processor, times(3)).process(any());
            var stats = scheduler.getStats();
            assertThat(stats.getTotalReposProcessed()).isEqualTo(3);
            assertThat(stats.getTotalCycles()).isEqualTo(1);
            assertThat(lock.isHeld()).isFalse();

            // And no further cycles run after shutdown
            scheduler.runCycle();
            verify(repositoryService, times(1)).findDue(NOW);
        }

        @Test
        @DisplayName("Should stop between repositories when the lock is lost and leave the new holder alone")
        void shouldStopWhenLockLost() {
            // Given
            var repositories = LongStream.rangeClosed(1, 5).mapToObj(NotificationSchedulerTest::repository).toList();
            when(repositoryService.findDue(NOW)).thenReturn(repositories);
            var otherInstance = new InMemorySchedulerLock(lock.owner);
            var calls = new AtomicInteger();
            when(processor.process(any())).thenAnswer(invocation -> {
                if (calls.incrementAndGet() == 2) {
                    lock.expireTo(otherInstance);
                }
                return sent(1);
            });

            // When
            scheduler.runCycle();

            // Then
            verify(processor, times(2)).process(any());
            assertThat(scheduler.getStats().getTotalReposProcessed()).isEqualTo(2);
            assertThat(otherInstance.isHeld()).isTrue();
            assertThat(lock.releases).hasValue(0);
            verify(metrics).recordCycle(any(), eq("lock_lost"));
        }
    }

    @Nested
    @DisplayName("Retry Tests")
    class RetryTests {

        @Test
        @DisplayName("Should succeed on second attempt without counting an error")
        void shouldSucceedOnSecondAttempt() {
            // Given
            var repo = repository(1);
            when(repositoryService.findDue(NOW)).thenReturn(List.of(repo));
            when(processor.process(repo))
                    .thenThrow(new ExternalServiceException("Telegram", 502, "Bad Gateway"))
                    .thenReturn(sent(1));

            // When
            scheduler.runCycle();

            // Then
            verify(processor, times(2)).process(repo);
            var stats = scheduler.getStats();
            assertThat(stats.getTotalErrors()).isZero();
            assertThat(stats.getTotalReposProcessed()).isEqualTo(1);
            assertThat(stats.getTotalNotificationsSent()).isEqualTo(1);
            verifyNoInteractions(alertService);
        }

        @Test
        @DisplayName("Should give up after all attempts, alert, and continue with the next repository")
        void shouldGiveUpAfterAllAttempts() {
            // Given
            var failing = repository(1);
            var healthy = repository(2);
            when(repositoryService.findDue(NOW)).thenReturn(List.of(failing, healthy));
            when(processor.process(failing)).thenThrow(new ExternalServiceException("Telegram", 500, "down"));
            when(processor.process(healthy)).thenReturn(sent(1));

            // When
            scheduler.runCycle();

            // Then
            verify(processor, times(3)).process(failing);
            verify(processor, times(1)).process(healthy);
            var stats = scheduler.getStats();
            assertThat(stats.getTotalErrors()).isEqualTo(1);
            assertThat(stats.getTotalReposProcessed()).isEqualTo(1);
            assertThat(stats.getTotalCycles()).isEqualTo(1);
            verify(alertService).sendRetriesExhaustedAlert(eq(failing), eq(3), anyString());
            verify(metrics).recordError("repository");
        }
    }

    @Nested
    @DisplayName("Multi-instance Tests")
    class MultiInstanceTests {

        @Mock
        private TrackedRepositoryService otherRepositoryService;

        @Mock
        private RepositoryNotificationProcessor otherProcessor;

        @Test
        @DisplayName("Only one of two instances sharing a lock should run a cycle")
        void onlyOneInstanceShouldRunCycle() throws Exception {
            // Given
            var other = newScheduler(new InMemorySchedulerLock(lock.owner), otherRepositoryService, otherProcessor);
            var repo = repository(1);
            var inCycle = new CountDownLatch(1);
            var otherFinished = new CountDownLatch(1);
            when(repositoryService.findDue(NOW)).thenReturn(List.of(repo));
            when(processor.process(repo)).thenAnswer(invocation -> {
                inCycle.countDown();
                assertThat(otherFinished.await(5, TimeUnit.SECONDS)).isTrue();
                return sent(1);
            });

            // When
            var first = new Thread(scheduler::runCycle);
            first.start();
            assertThat(inCycle.await(5, TimeUnit.SECONDS)).isTrue();
            other.runCycle();
            otherFinished.countDown();
            first.join(5000);

            // Then
            verify(processor).process(repo);
            verifyNoInteractions(otherRepositoryService, otherProcessor);
            assertThat(scheduler.getStats().getTotalCycles()).isEqualTo(1);
            assertThat(other.getStats().getTotalCycles()).isZero();
            assertThat(lock.owner.get()).isNull();
        }

        @Test
        @DisplayName("Second instance should run once the first released the lock")
        void secondInstanceShouldRunAfterRelease() {
            // Given
            var other = newScheduler(new InMemorySchedulerLock(lock.owner), otherRepositoryService, otherProcessor);
            when(repositoryService.findDue(NOW)).thenReturn(List.of());
            when(otherRepositoryService.findDue(NOW)).thenReturn(List.of());

            // When
            scheduler.runCycle();
            other.runCycle();

            // Then
            assertThat(scheduler.getStats().getTotalCycles()).isEqualTo(1);
            assertThat(other.getStats().getTotalCycles()).isEqualTo(1);
        }
    }

    @Nested
    @DisplayName("Lifecycle Tests")
    class LifecycleTests {

        @Test
        @DisplayName("Should schedule the trigger and run one cycle immediately")
        void shouldStartAndRunImmediately() {
            // Given
            doReturn(scheduledFuture).when(taskScheduler)
                    .scheduleAtFixedRate(any(Runnable.class), any(Instant.class), any(Duration.class));
            when(repositoryService.findDue(NOW)).thenReturn(List.of());

            // When
            var started = scheduler.start();

            // Then
            assertThat(started).isTrue();
            assertThat(scheduler.isStarted()).isTrue();
            verify(taskScheduler).scheduleAtFixedRate(any(Runnable.class),
                    eq(NOW.plus(Duration.ofMinutes(5))), eq(Duration.ofMinutes(5)));
            assertThat(scheduler.getStats().getTotalCycles()).isEqualTo(1);
        }

        @Test
        @DisplayName("Calling start twice should schedule only one trigger")
        void shouldStartOnlyOnce() {
            // Given
            doReturn(scheduledFuture).when(taskScheduler)
                    .scheduleAtFixedRate(any(Runnable.class), any(Instant.class), any(Duration.class));
            when(repositoryService.findDue(NOW)).thenReturn(List.of());

            // When
            scheduler.start();
            scheduler.start();

            // Then
            verify(taskScheduler, times(1)).scheduleAtFixedRate(any(Runnable.class), any(Instant.class), any(Duration.class));
        }

        @Test
        @DisplayName("Should not start when disabled by configuration")
        void shouldNotStartWhenDisabled() {
            properties.setEnabled(false);

            assertThat(scheduler.start()).isFalse();

            verifyNoInteractions(taskScheduler, repositoryService);
        }

        @Test
        @DisplayName("Should not start when the Telegram chat id is missing")
        void shouldNotStartWithoutCredentials() {
            telegramProperties.setChatId(" ");

            assertThat(scheduler.start()).isFalse();

            verifyNoInteractions(taskScheduler, repositoryService);
        }

        @Test
        @DisplayName("Should not start when the GitHub token is missing")
        void shouldNotStartWithoutGitHubToken() {
            gitHubProperties.setToken(null);

            assertThat(scheduler.start()).isFalse();

            verifyNoInteractions(taskScheduler);
        }

        @Test
        @DisplayName("Should follow the production profile when the switch is unset")
        void shouldFollowProductionProfile() {
            properties.setEnabled(null);
            assertThat(scheduler.isEnabled()).isFalse();

            environment.setActiveProfiles("production");
            assertThat(scheduler.isEnabled()).isTrue();
        }

        @Test
        @DisplayName("Stop should cancel the trigger and be idempotent")
        void stopShouldCancelTrigger() {
            // Given
            doReturn(scheduledFuture).when(taskScheduler)
                    .scheduleAtFixedRate(any(Runnable.class), any(Instant.class), any(Duration.class));
            when(repositoryService.findDue(NOW)).thenReturn(List.of());
            scheduler.start();

            // When
            scheduler.stop();
            scheduler.stop();

            // Then
            verify(scheduledFuture, times(1)).cancel(false);
            assertThat(scheduler.isStarted()).isFalse();
        }

        @Test
        @DisplayName("Stop should wait for the in-flight cycle to finish")
        void stopShouldWaitForRunningCycle() throws Exception {
            // Given
            var repo = repository(1);
            var inCycle = new CountDownLatch(1);
            var finished = new ArrayList<String>();
            when(repositoryService.findDue(NOW)).thenReturn(List.of(repo));
            when(processor.process(repo)).thenAnswer(invocation -> {
                inCycle.countDown();
                Thread.sleep(50);
                synchronized (finished) {
                    finished.add("cycle");
                }
                return sent(1);
            });
            var cycle = new Thread(scheduler::runCycle);
            cycle.start();
            assertThat(inCycle.await(5, TimeUnit.SECONDS)).isTrue();

            // When
            scheduler.stop();

            // Then
            synchronized (finished) {
                assertThat(finished).containsExactly("cycle");
            }
            cycle.join(5000);
            assertThat(scheduler.getStats().getTotalReposProcessed()).isEqualTo(1);
        }
    }

    /**
     * Lock shared between scheduler instances through a common owner slot
     */
    static class InMemorySchedulerLock implements SchedulerLock {

        private final AtomicReference<InMemorySchedulerLock> owner;
        private final AtomicInteger releases = new AtomicInteger();

        InMemorySchedulerLock(AtomicReference<InMemorySchedulerLock> owner) {
            this.owner = owner;
        }

        @Override
        public boolean tryAcquire() {
            return owner.compareAndSet(null, this);
        }

        @Override
        public void release() {
            if (owner.compareAndSet(this, null)) {
                releases.incrementAndGet();
            }
        }

        @Override
        public boolean isHeld() {
            return owner.get() == this;
        }

        /**
         * Simulates expiry: the lock row is taken over by another holder
         */
        void expireTo(InMemorySchedulerLock next) {
            owner.set(next);
        }
    }
}
