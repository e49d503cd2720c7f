package com.example.commitnotifier.service.scheduler;

import com.example.commitnotifier.client.GitHubClient;
import com.example.commitnotifier.client.TelegramClient;
import com.example.commitnotifier.config.SchedulerProperties;
import com.example.commitnotifier.domain.entity.TrackedRepository;
import com.example.commitnotifier.service.CommitLedgerService;
import com.example.commitnotifier.service.TrackedRepositoryService;
import com.example.commitnotifier.service.format.CommitMessageFormatter;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;

/**
 * Checks one due repository and notifies its new commits.
 * <p>
 * Flow of one attempt:
 * 1. Fetch commits since the last check (all history window on the first check)
 * 2. Drop commits already in the ledger
 * 3. Format and send every message, in order, recording the commits of each
 *    message in the ledger as soon as it is delivered
 * 4. Advance the schedule from the attempt start
 * <p>
 * Any failure aborts the attempt before step 4, so the repository stays due and
 * the same window is fetched again by the next attempt. Commits of messages that
 * were already delivered are in the ledger by then and are not sent again.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class RepositoryNotificationProcessor {

    private final GitHubClient gitHubClient;
    private final TelegramClient telegramClient;
    private final CommitMessageFormatter formatter;
    private final CommitLedgerService ledgerService;
    private final TrackedRepositoryService repositoryService;
    private final SchedulerProperties properties;
    private final Clock clock;

    public RepositoryProcessingResult process(TrackedRepository repository) {
        var attemptStart = clock.instant();
        var repoString = repository.getRepoString();

        var commits = gitHubClient.fetchCommits(
                repository.getCoordinates(), repository.getLastCheckTime(), properties.getMaxCommitsPerFetch());
        var newCommits = ledgerService.filterUnnotified(commits);

        var messagesSent = 0;
        if (!newCommits.isEmpty()) {
            for (var message : formatter.formatMessages(newCommits, repoString)) {
                telegramClient.sendMessage(message.getText());
                ledgerService.recordNotified(repository.getId(), message.getCommits());
                messagesSent++;
            }
            log.info("Sent {} message(s) for {} ({} new commits)", messagesSent, repoString, newCommits.size());
        } else {
            log.debug("No new commits in {}", repoString);
        }

        var advanced = repositoryService.advanceSchedule(repository, attemptStart);

        return RepositoryProcessingResult.builder()
                .commitsFetched(commits.size())
                .newCommits(newCommits.size())
                .messagesSent(messagesSent)
                .scheduleAdvanced(advanced)
                .build();
    }
}
