package com.example.commitnotifier.controller;

import com.example.commitnotifier.dto.ApiResponse;
import com.example.commitnotifier.dto.CreateRepositoryRequest;
import com.example.commitnotifier.dto.RepositoryResponse;
import com.example.commitnotifier.dto.SendCommitsResult;
import com.example.commitnotifier.dto.UpdateRepositoryRequest;
import com.example.commitnotifier.service.NotificationTestService;
import com.example.commitnotifier.service.TrackedRepositoryService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageRequest;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

/**
 * REST API controller for tracked repositories
 */
@Slf4j
@RestController
@RequiredArgsConstructor
@RequestMapping("/api/v1/repositories")
@Tag(name = "Repositories", description = "Register and manage tracked GitHub repositories")
public class RepositoryController {

    private final TrackedRepositoryService repositoryService;
    private final NotificationTestService notificationTestService;

    @PostMapping
    @Operation(summary = "Track a repository",
            description = "Accepts owner/repo, owner/repo:branch or a GitHub URL, optionally with /tree/branch")
    public ResponseEntity<ApiResponse<RepositoryResponse>> register(@Valid @RequestBody CreateRepositoryRequest request) {
        log.info("API: Register repository {}", request.getRepository());

        var response = repositoryService.register(request);
        return ResponseEntity.status(HttpStatus.CREATED).body(ApiResponse.success(response, "Repository added successfully"));
    }

    @GetMapping
    @Operation(summary = "List repositories", description = "Tracked repositories, newest first")
    public ResponseEntity<ApiResponse<Page<RepositoryResponse>>> list(
            @Parameter(description = "Substring filter on owner/repo:branch") @RequestParam(required = false) String search,
            @Parameter(description = "Page number") @RequestParam(defaultValue = "0") int page,
            @Parameter(description = "Page size") @RequestParam(defaultValue = "20") int size) {

        var repositories = repositoryService.listRepositories(search, PageRequest.of(page, Math.min(Math.max(size, 1), 100)));
        return ResponseEntity.ok(ApiResponse.success(repositories));
    }

    @GetMapping("/{id}")
    @Operation(summary = "Get repository by ID")
    public ResponseEntity<ApiResponse<RepositoryResponse>> get(@Parameter(description = "Repository ID") @PathVariable Long id) {
        return ResponseEntity.ok(ApiResponse.success(repositoryService.getRepository(id)));
    }

    @PatchMapping("/{id}")
    @Operation(summary = "Change notification interval",
            description = "Allowed values are 1, 2, 3, 6, 12 and 24 hours. The next check is recomputed from the last one.")
    public ResponseEntity<ApiResponse<RepositoryResponse>> updateInterval(
            @Parameter(description = "Repository ID") @PathVariable Long id,
            @Valid @RequestBody UpdateRepositoryRequest request) {
        log.info("API: Update repository {} interval to {}h", id, request.getNotificationInterval());

        var response = repositoryService.updateInterval(id, request.getNotificationInterval());
        return ResponseEntity.ok(ApiResponse.success(response, "Repository updated successfully"));
    }

    @DeleteMapping("/{id}")
    @Operation(summary = "Stop tracking a repository")
    public ResponseEntity<ApiResponse<Void>> delete(@Parameter(description = "Repository ID") @PathVariable Long id) {
        log.info("API: Delete repository {}", id);

        repositoryService.delete(id);
        return ResponseEntity.ok(ApiResponse.success(null, "Repository deleted successfully"));
    }

    @PostMapping("/{id}/send-commits")
    @Operation(summary = "Send latest commits",
            description = "Send the latest commits of one repository to Telegram without recording them as notified")
    public ResponseEntity<ApiResponse<SendCommitsResult>> sendCommits(
            @Parameter(description = "Repository ID") @PathVariable Long id,
            @Parameter(description = "Number of commits") @RequestParam(required = false) Integer limit) {
        log.info("API: Send latest commits of repository {}", id);

        var result = notificationTestService.sendCommits(id, limit);
        var message = result.getCommitsFound() == 0
                ? "No commits found"
                : String.format("Sent %d commit(s) in %d message(s)", result.getCommitsFound(), result.getMessagesSent());
        return ResponseEntity.ok(ApiResponse.success(result, message));
    }
}
