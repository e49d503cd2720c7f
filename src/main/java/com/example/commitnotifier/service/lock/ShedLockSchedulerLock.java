package com.example.commitnotifier.service.lock;

import com.example.commitnotifier.config.SchedulerProperties;
import com.example.commitnotifier.exception.SchedulerLockException;
import lombok.extern.slf4j.Slf4j;
import net.javacrumbs.shedlock.core.LockConfiguration;
import net.javacrumbs.shedlock.core.LockProvider;
import net.javacrumbs.shedlock.core.SimpleLock;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/**
 * {@link SchedulerLock} backed by a ShedLock {@link LockProvider}.
 * <p>
 * The lock row is held for {@code lockAtMostFor} and extended by another
 * {@code lockAtMostFor} every half period while held, so a long cycle keeps it
 * and a crashed holder loses it once extensions stop. If an extension is refused
 * the lock counts as lost: {@link #isHeld()} turns false and release leaves the
 * row alone, since it may belong to the next holder by then.
 * lockAtLeastFor is zero: release frees the lock immediately.
 */
@Slf4j
@Component
public class ShedLockSchedulerLock implements SchedulerLock {

    private final LockProvider lockProvider;
    private final ScheduledExecutorService keepAliveExecutor;
    private final Clock clock;
    private final String lockName;
    private final Duration lockAtMostFor;

    // Guarded by this
    private SimpleLock heldLock;
    private Instant heldUntil;
    private ScheduledFuture<?> keepAlive;

    public ShedLockSchedulerLock(LockProvider lockProvider,
                                 SchedulerProperties properties,
                                 @Qualifier("lockKeepAliveExecutor") ScheduledExecutorService keepAliveExecutor,
                                 Clock clock) {
        this.lockProvider = lockProvider;
        this.keepAliveExecutor = keepAliveExecutor;
        this.clock = clock;
        this.lockName = properties.getLockName();
        this.lockAtMostFor = properties.getLockAtMostFor();
    }

    @Override
    public synchronized boolean tryAcquire() {
        if (heldLock != null) {
            log.debug("Lock {} is already held by this instance", lockName);
            return false;
        }

        var acquiredAt = clock.instant();
        try {
            var lock = lockProvider.lock(new LockConfiguration(acquiredAt, lockName, lockAtMostFor, Duration.ZERO));

            if (lock.isEmpty()) {
                log.debug("Lock {} is held by another instance", lockName);
                return false;
            }

            heldLock = lock.get();
            heldUntil = acquiredAt.plus(lockAtMostFor);
            var periodMs = Math.max(1, lockAtMostFor.toMillis() / 2);
            keepAlive = keepAliveExecutor.scheduleAtFixedRate(this::extendHeldLock, periodMs, periodMs, TimeUnit.MILLISECONDS);
        } catch (RejectedExecutionException e) {
            release();
            throw new SchedulerLockException(lockName, e);
        } catch (Exception e) {
            throw new SchedulerLockException(lockName, e);
        }

        log.debug("Acquired lock {}", lockName);
        return true;
    }

    @Override
    public synchronized boolean isHeld() {
        return heldLock != null && clock.instant().isBefore(heldUntil);
    }

    @Override
    public synchronized void release() {
        stopKeepAlive();
        var lock = heldLock;
        heldLock = null;
        heldUntil = null;
        if (lock == null) {
            return;
        }

        try {
            lock.unlock();
            log.debug("Released lock {}", lockName);
        } catch (Exception e) {
            throw new SchedulerLockException(lockName, e);
        }
    }

    /**
     * Runs on the keep-alive executor. Must not throw, or the executor drops the task.
     */
    synchronized void extendHeldLock() {
        if (heldLock == null) {
            return;
        }

        var extendedAt = clock.instant();
        try {
            var extended = heldLock.extend(lockAtMostFor, Duration.ZERO);
            if (extended.isPresent()) {
                heldLock = extended.get();
                heldUntil = extendedAt.plus(lockAtMostFor);
                log.debug("Extended lock {} until {}", lockName, heldUntil);
            } else {
                log.warn("Lock {} could not be extended and is no longer held by this instance", lockName);
                heldLock = null;
                heldUntil = null;
                stopKeepAlive();
            }
        } catch (Exception e) {
            // The current lock stays valid until heldUntil; the next period tries again
            log.error("Failed to extend lock {}: {}", lockName, e.getMessage(), e);
        }
    }

    private void stopKeepAlive() {
        if (keepAlive != null) {
            keepAlive.cancel(false);
            keepAlive = null;
        }
    }
}
