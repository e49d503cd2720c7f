package com.example.commitnotifier.exception;

import lombok.Getter;

/**
 * Exception for a scheduler lock store that cannot be reached
 */
@Getter
public class SchedulerLockException extends RuntimeException {

    private final String lockName;

    public SchedulerLockException(String lockName, Throwable cause) {
        super(String.format("Lock store unavailable for lock %s: %s", lockName, cause.getMessage()), cause);
        this.lockName = lockName;
    }
}
