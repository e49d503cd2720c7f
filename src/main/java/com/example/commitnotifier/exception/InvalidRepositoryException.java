package com.example.commitnotifier.exception;

import lombok.Getter;

/**
 * Exception for a repository string that cannot be parsed
 */
@Getter
public class InvalidRepositoryException extends RuntimeException {

    private final String input;

    public InvalidRepositoryException(String input) {
        super(String.format("Invalid repository format: %s. Expected \"owner/repo\", \"owner/repo:branch\" "
                + "or \"https://github.com/owner/repo/tree/branch\"", input));
        this.input = input;
    }
}
