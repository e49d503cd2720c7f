package com.example.commitnotifier.exception;

import lombok.Getter;

/**
 * Exception for a tracked repository that does not exist
 */
@Getter
public class RepositoryNotFoundException extends RuntimeException {

    private final Long repositoryId;

    public RepositoryNotFoundException(Long repositoryId) {
        super("Repository not found: " + repositoryId);
        this.repositoryId = repositoryId;
    }
}
