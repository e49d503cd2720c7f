package com.example.commitnotifier.domain.enums;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

import java.time.Duration;

/**
 * Allowed per-repository notification intervals.
 * Stored as the number of hours; the repositories table enforces the same set.
 */
@Getter
@RequiredArgsConstructor
public enum NotificationInterval {

    ONE_HOUR(1),
    TWO_HOURS(2),
    THREE_HOURS(3),
    SIX_HOURS(6),
    TWELVE_HOURS(12),
    TWENTY_FOUR_HOURS(24);

    public static final NotificationInterval DEFAULT = THREE_HOURS;

    private final int hours;

    public Duration toDuration() {
        return Duration.ofHours(hours);
    }

    /**
     * Find NotificationInterval by its hour value
     */
    public static NotificationInterval fromHours(int hours) {
        for (var interval : values()) {
            if (interval.getHours() == hours) {
                return interval;
            }
        }
        throw new IllegalArgumentException("Unsupported notification interval: " + hours
                + "h. Allowed values are 1, 2, 3, 6, 12, 24");
    }
}
