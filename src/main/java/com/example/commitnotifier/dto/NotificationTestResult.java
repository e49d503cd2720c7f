package com.example.commitnotifier.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Outcome of a manual notification run
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class NotificationTestResult {

    private int reposProcessed;
    private int messagesSent;
    @Builder.Default
    private List<RepositoryError> errors = new ArrayList<>();

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class RepositoryError {
        private String repo;
        private String error;
    }
}
