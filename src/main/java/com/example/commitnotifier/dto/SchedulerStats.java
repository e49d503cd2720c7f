package com.example.commitnotifier.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Point-in-time snapshot of the notification scheduler's run statistics.
 * Counters are process-local and reset on restart.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SchedulerStats {

    @JsonProperty("isRunning")
    private boolean running;
    private Instant lastRunTime;
    private Long lastRunDurationMs;
    private long totalCycles;
    private long totalReposProcessed;
    private long totalNotificationsSent;
    private long totalErrors;
}
