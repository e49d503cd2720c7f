package com.example.commitnotifier.service;

import com.example.commitnotifier.client.GitHubClient;
import com.example.commitnotifier.client.TelegramClient;
import com.example.commitnotifier.config.GitHubProperties;
import com.example.commitnotifier.config.ManualNotificationProperties;
import com.example.commitnotifier.config.TelegramProperties;
import com.example.commitnotifier.domain.entity.TrackedRepository;
import com.example.commitnotifier.dto.NotificationTestResult;
import com.example.commitnotifier.dto.NotificationTestResult.RepositoryError;
import com.example.commitnotifier.dto.SendCommitsResult;
import com.example.commitnotifier.exception.NotificationConfigurationException;
import com.example.commitnotifier.service.format.CommitMessageFormatter;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Operator-triggered notification runs.
 * <p>
 * Both runs send the latest commits regardless of what was notified before.
 * They never touch the ledger or the schedule, so the next scheduled check
 * behaves as if they had not happened.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class NotificationTestService {

    private final TrackedRepositoryService repositoryService;
    private final GitHubClient gitHubClient;
    private final TelegramClient telegramClient;
    private final CommitMessageFormatter formatter;
    private final GitHubProperties gitHubProperties;
    private final TelegramProperties telegramProperties;
    private final ManualNotificationProperties properties;

    /**
     * Send the latest commits of every tracked repository.
     * A failing repository is reported and does not stop the run.
     */
    public NotificationTestResult testNotifications() {
        requireCredentials();

        var repositories = repositoryService.findRecent(properties.getTestRepositoryLimit());
        var result = NotificationTestResult.builder().build();
        log.info("Test notification run over {} repositories", repositories.size());

        for (var repository : repositories) {
            try {
                result.setMessagesSent(result.getMessagesSent() + sendLatest(repository, properties.getTestCommitCount()));
                result.setReposProcessed(result.getReposProcessed() + 1);
            } catch (Exception e) {
                log.error("Test notification failed for {}: {}", repository.getRepoString(), e.getMessage());
                result.getErrors().add(new RepositoryError(repository.getRepoString(),
                        e.getMessage() != null ? e.getMessage() : "Unknown error"));
            }
        }

        log.info("Test notification run finished: {} repositories, {} messages, {} errors",
                result.getReposProcessed(), result.getMessagesSent(), result.getErrors().size());
        return result;
    }

    /**
     * Send the latest commits of one repository
     *
     * @param limit number of commits; null for the configured default
     */
    public SendCommitsResult sendCommits(Long repositoryId, Integer limit) {
        requireCredentials();

        var repository = repositoryService.findById(repositoryId);
        var count = limit != null && limit > 0 ? limit : properties.getSendCommitsDefaultLimit();

        var commits = gitHubClient.fetchCommits(repository.getCoordinates(), null, count);
        var messages = formatter.format(commits, repository.getRepoString());
        for (var message : messages) {
            telegramClient.sendMessage(message);
        }

        log.info("Sent {} latest commits of {} in {} message(s)", commits.size(), repository.getRepoString(), messages.size());
        return SendCommitsResult.builder()
                .repoString(repository.getRepoString())
                .commitsFound(commits.size())
                .messagesSent(messages.size())
                .build();
    }

    private int sendLatest(TrackedRepository repository, int count) {
        var commits = gitHubClient.fetchCommits(repository.getCoordinates(), null, count);
        var messages = formatter.format(commits, repository.getRepoString());
        for (var message : messages) {
            telegramClient.sendMessage(message);
        }
        return messages.size();
    }

    private void requireCredentials() {
        if (!gitHubProperties.hasToken() || !telegramProperties.isConfigured()) {
            throw new NotificationConfigurationException(
                    "Missing required configuration (GITHUB_TOKEN, TELEGRAM_BOT_TOKEN, TELEGRAM_CHAT_ID)");
        }
    }
}
