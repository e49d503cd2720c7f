package com.example.commitnotifier.service.lock;

import com.example.commitnotifier.exception.SchedulerLockException;

/**
 * Cluster-wide mutual exclusion for notification cycles.
 * <p>
 * At most one process holds the lock at a time. Acquisition never blocks.
 */
public interface SchedulerLock {

    /**
     * Try to take the lock without waiting
     *
     * @return true if this process now holds the lock, false if another holder has it
     * @throws SchedulerLockException if the lock store cannot be reached
     */
    boolean tryAcquire();

    /**
     * Whether this process still holds the lock. Turns false when the lock was
     * lost while held, e.g. because it could not be kept alive.
     */
    boolean isHeld();

    /**
     * Release the lock if this process holds it; otherwise a no-op
     */
    void release();
}
