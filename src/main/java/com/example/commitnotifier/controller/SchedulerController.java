package com.example.commitnotifier.controller;

import com.example.commitnotifier.client.ClientModels.RateLimitStatus;
import com.example.commitnotifier.client.GitHubClient;
import com.example.commitnotifier.dto.ApiResponse;
import com.example.commitnotifier.dto.NotificationTestResult;
import com.example.commitnotifier.dto.SchedulerStats;
import com.example.commitnotifier.service.NotificationTestService;
import com.example.commitnotifier.service.scheduler.NotificationScheduler;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Operator endpoints for the notification scheduler.
 * <p>
 * Provides endpoints for:
 * - Scheduler statistics and manual cycles
 * - Test notifications over all tracked repositories
 * - GitHub API quota
 */
@Slf4j
@RestController
@RequiredArgsConstructor
@RequestMapping("/api/v1")
@Tag(name = "Scheduler", description = "Notification scheduler operations")
public class SchedulerController {

    private final NotificationScheduler scheduler;
    private final NotificationTestService notificationTestService;
    private final GitHubClient gitHubClient;

    @GetMapping("/scheduler/stats")
    @Operation(summary = "Scheduler statistics", description = "Counters of the notification scheduler since startup")
    public ResponseEntity<ApiResponse<SchedulerStats>> getStats() {
        return ResponseEntity.ok(ApiResponse.success(scheduler.getStats()));
    }

    @PostMapping("/scheduler/run")
    @Operation(summary = "Run a cycle now",
            description = "Run one notification cycle on the request thread. Skipped if a cycle is running anywhere in the cluster.")
    public ResponseEntity<ApiResponse<SchedulerStats>> runCycle() {
        log.info("API: Manual notification cycle requested");

        scheduler.runCycle();
        return ResponseEntity.ok(ApiResponse.success(scheduler.getStats(), "Notification cycle finished"));
    }

    @PostMapping("/notifications/test")
    @Operation(summary = "Send test notifications",
            description = "Send the latest commits of every tracked repository without touching the ledger or schedule")
    public ResponseEntity<ApiResponse<NotificationTestResult>> testNotifications() {
        log.info("API: Test notifications requested");

        var result = notificationTestService.testNotifications();
        var message = String.format("Processed %d repositories, sent %d messages",
                result.getReposProcessed(), result.getMessagesSent());
        return ResponseEntity.ok(ApiResponse.success(result, message));
    }

    @GetMapping("/github/rate-limit")
    @Operation(summary = "GitHub rate limit", description = "Remaining GitHub API quota of the configured token")
    public ResponseEntity<ApiResponse<RateLimitStatus>> getRateLimit() {
        return ResponseEntity.ok(ApiResponse.success(gitHubClient.getRateLimit()));
    }
}
