package com.example.commitnotifier.service.scheduler;

import lombok.Builder;
import lombok.Data;

/**
 * Outcome of one successful check of a repository
 */
@Data
@Builder
public class RepositoryProcessingResult {

    /**
     * Commits returned by GitHub for the check window
     */
    private int commitsFetched;

    /**
     * Commits not seen before, i.e. the ones notified
     */
    private int newCommits;

    /**
     * Telegram messages delivered
     */
    private int messagesSent;

    /**
     * False if the repository was deleted while it was being processed
     */
    private boolean scheduleAdvanced;
}
