package com.example.commitnotifier.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Response DTO for a tracked repository
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RepositoryResponse {

    private Long id;
    private String repoString;
    private String owner;
    private String repo;
    private String branch;
    private Integer notificationIntervalHours;
    private Instant lastCheckTime;
    private Instant nextCheckTime;
    private Instant createdAt;
    private Instant updatedAt;
}
