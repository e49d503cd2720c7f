package com.example.commitnotifier.exception;

import lombok.Getter;

/**
 * Exception for registering a repository that is already tracked
 */
@Getter
public class DuplicateRepositoryException extends RuntimeException {

    private final String repoString;

    public DuplicateRepositoryException(String repoString) {
        super("Repository is already tracked: " + repoString);
        this.repoString = repoString;
    }
}
