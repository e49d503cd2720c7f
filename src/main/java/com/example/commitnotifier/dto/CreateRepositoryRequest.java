package com.example.commitnotifier.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Request DTO for registering a repository to track
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CreateRepositoryRequest {

    /**
     * "owner/repo", "owner/repo:branch" or a GitHub URL
     */
    @NotBlank(message = "Repository is required")
    @Size(max = 255)
    private String repository;

    /**
     * Notification interval in hours (1, 2, 3, 6, 12 or 24); defaults to 3
     */
    private Integer notificationInterval;
}
